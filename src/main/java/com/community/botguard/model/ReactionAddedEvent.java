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
@Schema(description = "A reviewer reacted to a review request message")
public class ReactionAddedEvent {

    @Schema(description = "Community the review request belongs to", example = "GUILD-1")
    private String communityId;

    @Schema(description = "Message that received the reaction", example = "MSG-991")
    private String messageId;

    @Schema(description = "Participant the review request is about", example = "BOT-42")
    private String participantId;

    @Schema(description = "Reaction emoji", example = "✅")
    private String emoji;

    @Schema(description = "Account that reacted", example = "REVIEWER-1")
    private String actorId;
}
