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
@Schema(description = "Outcome of a reviewer decision")
public class DecisionResult {

    @Schema(description = "Community (guild) ID", example = "GUILD-1")
    private String communityId;

    @Schema(description = "Participant ID", example = "BOT-42")
    private String participantId;

    @Schema(description = "Terminal status of the entry after the call", example = "APPROVED")
    private ApprovalStatus status;

    @Schema(description = "True when another reviewer or the timeout resolved the entry first")
    private boolean alreadyHandled;

    @Schema(description = "Who resolved the entry (the caller unless alreadyHandled)", example = "REVIEWER-1")
    private String resolvedBy;

    @Schema(description = "True when the participant could not be removed from the community")
    private boolean removalFailed;
}
