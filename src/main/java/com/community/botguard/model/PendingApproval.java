package com.community.botguard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.concurrent.ScheduledFuture;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Automated participant held for reviewer approval")
public class PendingApproval {

    @Schema(description = "Identifier of this approval lifecycle", example = "5b0c4f0e-8f0a-4d43-9b52-4a3c1de0d4a1")
    private String approvalId;

    @Schema(description = "Community (guild) the participant joined", example = "GUILD-1")
    private String communityId;

    @Schema(description = "Automated participant (bot) account ID", example = "BOT-42")
    private String participantId;

    @Schema(description = "Display name of the participant", example = "music-bot")
    private String participantName;

    @Schema(description = "Account that added the participant, when the platform reports it", example = "USER-7")
    private String inviterId;

    @Schema(description = "Display name of the inviter", example = "alice")
    private String inviterName;

    @Schema(description = "Detection timestamp in epoch milliseconds", example = "1739886764000")
    private long detectedAt;

    @Schema(description = "Automatic rejection deadline in epoch milliseconds", example = "1739886774000")
    private long deadline;

    @Schema(description = "Workflow status; PENDING is the only non-terminal state", example = "PENDING")
    private ApprovalStatus status;

    @Schema(description = "Reviewer who resolved the entry; absent for TIMED_OUT")
    private String resolvedBy;

    @Schema(description = "Resolution timestamp in epoch milliseconds, 0 while pending")
    private long resolvedAt;

    @Schema(description = "Reviewers the review request was delivered to")
    private int notifiedReviewers;

    @Schema(description = "Seconds left before automatic rejection, as of when this snapshot was taken", example = "7")
    private long secondsRemaining;

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Schema(hidden = true)
    private ScheduledFuture<?> timerHandle;

    public ApprovalKey key() {
        return new ApprovalKey(communityId, participantId);
    }

    public long remainingSeconds(long now) {
        return Math.max(0, (deadline - now) / 1000);
    }
}
