package com.community.botguard.service;

import com.community.botguard.config.BotGuardConfig;
import com.community.botguard.config.MetricsConfig;
import com.community.botguard.connector.CommunityGateway;
import com.community.botguard.connector.ConnectorException;
import com.community.botguard.connector.ReviewerDirectory;
import com.community.botguard.model.PendingApproval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Delivers review requests and follow-ups to reviewers by direct message.
 * Delivery is best-effort per reviewer; nothing here fails the workflow.
 */
@Service
public class DecisionNotificationService {

    private static final Logger log = LoggerFactory.getLogger(DecisionNotificationService.class);

    static final String APPROVE_EMOJI = "✅";
    static final String REJECT_EMOJI = "❌";

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final CommunityGateway gateway;
    private final ReviewerDirectory reviewerDirectory;
    private final BotGuardConfig config;
    private final MetricsConfig metricsConfig;

    public DecisionNotificationService(CommunityGateway gateway,
                                       ReviewerDirectory reviewerDirectory,
                                       BotGuardConfig config,
                                       MetricsConfig metricsConfig) {
        this.gateway = gateway;
        this.reviewerDirectory = reviewerDirectory;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Send the review request to each reviewer independently.
     *
     * @return number of reviewers the request reached
     */
    @Async
    public CompletableFuture<Integer> notifyReviewers(PendingApproval approval, List<String> reviewers) {
        String body = buildReviewRequest(approval);
        int delivered = 0;
        for (String reviewerId : reviewers) {
            if (deliver(reviewerId, body)) {
                delivered++;
            }
        }
        log.info("Notified {}/{} reviewers about participant={} in community={}",
                delivered, reviewers.size(), approval.getParticipantId(), approval.getCommunityId());
        return CompletableFuture.completedFuture(delivered);
    }

    /**
     * Tell reviewers that a rejected or timed-out participant is still in the community.
     */
    @Async
    public void notifyRemovalFailure(PendingApproval approval, String error) {
        List<String> reviewers;
        try {
            reviewers = reviewerDirectory.findReviewers(approval.getCommunityId());
        } catch (ConnectorException e) {
            log.warn("Cannot look up reviewers to report removal failure for participant={} in community={}: {}",
                    approval.getParticipantId(), approval.getCommunityId(), e.getMessage());
            return;
        }

        String body = String.format(
                "⚠️ Permission error\n" +
                "Could not remove bot %s (ID: %s) from community %s after it was %s.\n" +
                "Reason: %s\n" +
                "Grant the guard the kick_members permission and remove the bot manually.",
                displayName(approval), approval.getParticipantId(), approval.getCommunityId(),
                approval.getStatus() == null ? "rejected" : approval.getStatus().name().toLowerCase().replace('_', ' '),
                error);

        for (String reviewerId : reviewers) {
            deliver(reviewerId, body);
        }
    }

    /**
     * Confirmation DM to the reviewer whose approval took effect.
     */
    public void sendDecisionConfirmation(String actorId, PendingApproval approval) {
        String body = String.format(
                "%s Bot approved\nBot %s (ID: %s) has been approved in community %s.",
                APPROVE_EMOJI, displayName(approval), approval.getParticipantId(), approval.getCommunityId());
        deliver(actorId, body);
    }

    String buildReviewRequest(PendingApproval approval) {
        StringBuilder body = new StringBuilder();
        body.append("🚨 New bot detected\n")
                .append("A new bot has joined community ").append(approval.getCommunityId())
                .append(" and requires approval.\n")
                .append("Name: ").append(displayName(approval)).append('\n')
                .append("ID: ").append(approval.getParticipantId()).append('\n')
                .append("Detected: ").append(TIME_FORMAT.format(Instant.ofEpochMilli(approval.getDetectedAt()))).append('\n');
        if (approval.getInviterId() != null) {
            body.append("Added by: ")
                    .append(approval.getInviterName() != null ? approval.getInviterName() : approval.getInviterId())
                    .append('\n');
        }
        body.append("React with ").append(APPROVE_EMOJI).append(" to approve or ")
                .append(REJECT_EMOJI).append(" to reject, or use ")
                .append(config.getCommandPrefix()).append("approve ").append(approval.getParticipantId())
                .append(" / ").append(config.getCommandPrefix()).append("reject ").append(approval.getParticipantId())
                .append('\n')
                .append("⏰ Auto-reject in ").append(config.getApprovalTimeoutSeconds()).append(" seconds");
        return body.toString();
    }

    private boolean deliver(String userId, String body) {
        try {
            gateway.sendDirectMessage(userId, body);
            metricsConfig.recordNotification("direct_message", "success");
            return true;
        } catch (Exception e) {
            metricsConfig.recordNotification("direct_message", "error");
            log.warn("Cannot send direct message to reviewer={}: {}", userId, e.getMessage());
            return false;
        }
    }

    private static String displayName(PendingApproval approval) {
        return approval.getParticipantName() != null ? approval.getParticipantName() : approval.getParticipantId();
    }
}
