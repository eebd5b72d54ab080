package com.community.botguard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A member joined a community, as reported by the platform connector")
public class ParticipantJoinedEvent {

    @Schema(description = "Community (guild) ID", example = "GUILD-1")
    private String communityId;

    @Schema(description = "ID of the member that joined", example = "BOT-42")
    private String participantId;

    @Schema(description = "Display name of the member", example = "music-bot")
    private String participantName;

    @Schema(description = "True when the platform flags the account as automated", example = "true")
    private boolean automated;

    @Schema(description = "Account that added the member, if the platform audit trail exposes it", example = "USER-7")
    private String inviterId;

    @Schema(description = "Display name of the inviter", example = "alice")
    private String inviterName;

    @Schema(description = "Account creation time in epoch milliseconds, 0 if unknown", example = "1700000000000")
    private long accountCreatedAt;
}
