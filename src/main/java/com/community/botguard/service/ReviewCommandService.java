package com.community.botguard.service;

import com.community.botguard.config.BotGuardConfig;
import com.community.botguard.connector.CommunityGateway;
import com.community.botguard.connector.ReviewerDirectory;
import com.community.botguard.exception.ApprovalNotFoundException;
import com.community.botguard.exception.NotAuthorizedException;
import com.community.botguard.model.AuditEventType;
import com.community.botguard.model.AuditRecord;
import com.community.botguard.model.AuditStats;
import com.community.botguard.model.CommandInvokedEvent;
import com.community.botguard.model.CommandReply;
import com.community.botguard.model.DecisionResult;
import com.community.botguard.model.DecisionSource;
import com.community.botguard.model.PendingApproval;
import com.community.botguard.model.ReactionAddedEvent;
import com.community.botguard.model.StatusSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Text commands and reactions issued by reviewers inside a community.
 */
@Service
public class ReviewCommandService {

    private static final Logger log = LoggerFactory.getLogger(ReviewCommandService.class);

    static final String PERMISSION_DENIED = "❌ You don't have permission to use this command.";
    static final String LOGS_UNAVAILABLE = "❌ Error retrieving logs. Please try again later.";
    static final String HISTORY_UNAVAILABLE = "❌ Error retrieving bot history. Please try again later.";

    private static final int STATUS_PENDING_SHOWN = 5;
    private static final int LOG_ENTRIES_SHOWN = 10;
    private static final int HISTORY_ENTRIES_SHOWN = 5;

    private static final DateTimeFormatter SHORT_TIME =
            DateTimeFormatter.ofPattern("MM/dd HH:mm").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter FULL_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final ApprovalWorkflowService workflowService;
    private final AuditLogService auditLogService;
    private final ReviewerDirectory reviewerDirectory;
    private final CommunityGateway gateway;
    private final BotGuardConfig config;
    private final Clock clock;

    public ReviewCommandService(ApprovalWorkflowService workflowService,
                                AuditLogService auditLogService,
                                ReviewerDirectory reviewerDirectory,
                                CommunityGateway gateway,
                                BotGuardConfig config,
                                Clock clock) {
        this.workflowService = workflowService;
        this.auditLogService = auditLogService;
        this.reviewerDirectory = reviewerDirectory;
        this.gateway = gateway;
        this.config = config;
        this.clock = clock;
    }

    /**
     * ✅ approves and ❌ rejects. Other emoji, non-reviewers and participants that are
     * not pending are ignored.
     *
     * @return the decision, or empty if the reaction was ignored
     */
    public Optional<DecisionResult> handleReaction(ReactionAddedEvent event) {
        Boolean approve = emojiDecision(event.getEmoji());
        if (approve == null || event.getParticipantId() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(workflowService.onReviewerDecision(event.getCommunityId(), event.getParticipantId(),
                    approve, event.getActorId(), DecisionSource.REACTION));
        } catch (NotAuthorizedException e) {
            log.debug("Ignoring reaction {} from non-reviewer actor={}", event.getEmoji(), event.getActorId());
            return Optional.empty();
        } catch (ApprovalNotFoundException e) {
            log.debug("Ignoring reaction {} on participant={}: not pending", event.getEmoji(), event.getParticipantId());
            return Optional.empty();
        }
    }

    public CommandReply handleCommand(CommandInvokedEvent event) {
        CommandReply reply = dispatch(event);
        postToChannel(event.getChannelId(), reply);
        return reply;
    }

    private CommandReply dispatch(CommandInvokedEvent event) {
        String name = normalize(event.getName());
        List<String> args = event.getArgs() != null ? event.getArgs() : Collections.emptyList();

        if (!isKnown(name)) {
            return CommandReply.error(usage());
        }
        if (!isReviewer(event.getCommunityId(), event.getActorId())) {
            log.info("Command {} denied for actor={} in community={}", name, event.getActorId(), event.getCommunityId());
            return CommandReply.error(PERMISSION_DENIED);
        }

        switch (name) {
            case "status":
            case "botstatus":
                return status(event.getCommunityId());
            case "approve":
            case "reject":
                if (args.isEmpty() || args.get(0).isBlank()) {
                    return CommandReply.error("Usage: " + config.getCommandPrefix() + name + " <participantId>");
                }
                return decide(event, args.get(0).trim(), "approve".equals(name));
            case "history":
            case "bothistory":
                if (args.isEmpty() || args.get(0).isBlank()) {
                    return CommandReply.error("Usage: " + config.getCommandPrefix() + "history <participantId>");
                }
                return history(event.getCommunityId(), args.get(0).trim());
            case "logs":
                return logs(event.getCommunityId(), args);
            default:
                return CommandReply.error(usage());
        }
    }

    private CommandReply status(String communityId) {
        StatusSummary summary = workflowService.statusSummary(communityId);
        long now = clock.millis();

        StringBuilder body = new StringBuilder("🤖 Bot Security Status\n")
                .append("Pending Approvals: ").append(summary.getPendingCount()).append('\n')
                .append("Approval timeout: ").append(config.getApprovalTimeoutSeconds()).append("s\n");
        if (summary.getStats() != null) {
            body.append("Approved (24h): ").append(summary.getStats().getRecentApproved()).append('\n');
        }

        List<PendingApproval> pending = summary.getPending();
        if (pending != null && !pending.isEmpty()) {
            body.append("Pending Bots:\n");
            pending.stream().limit(STATUS_PENDING_SHOWN).forEach(p -> body
                    .append("• ").append(displayName(p)).append(" (ID: ").append(p.getParticipantId()).append(") - ")
                    .append(p.remainingSeconds(now)).append("s remaining\n"));
        }
        return CommandReply.ok(body.toString().trim());
    }

    private CommandReply decide(CommandInvokedEvent event, String participantId, boolean approve) {
        DecisionResult result;
        try {
            result = workflowService.onReviewerDecision(event.getCommunityId(), participantId, approve,
                    event.getActorId(), DecisionSource.COMMAND);
        } catch (ApprovalNotFoundException e) {
            return CommandReply.error("❌ Bot not found in pending list.");
        } catch (NotAuthorizedException e) {
            return CommandReply.error(PERMISSION_DENIED);
        }

        if (result.isAlreadyHandled()) {
            String outcome = result.getStatus() != null
                    ? result.getStatus().name().toLowerCase(Locale.ROOT).replace('_', ' ')
                    : "handled";
            return CommandReply.ok("ℹ️ Bot " + participantId + " was already " + outcome + ".");
        }
        if (approve) {
            return CommandReply.ok("✅ Bot " + participantId + " has been approved.");
        }
        if (result.isRemovalFailed()) {
            return CommandReply.ok("❌ Bot " + participantId + " has been rejected, but it could not be removed. "
                    + "Check the kick_members permission.");
        }
        return CommandReply.ok("❌ Bot " + participantId + " has been rejected and removed.");
    }

    private CommandReply history(String communityId, String participantId) {
        List<AuditRecord> history;
        try {
            history = auditLogService.history(participantId, communityId);
        } catch (RuntimeException e) {
            log.error("Error retrieving history for participant={}: {}", participantId, e.getMessage());
            return CommandReply.error(HISTORY_UNAVAILABLE);
        }
        if (history.isEmpty()) {
            return CommandReply.error("❌ No history found for bot ID: " + participantId);
        }

        StringBuilder body = new StringBuilder("🤖 Bot History: ")
                .append(participantNameOf(history, participantId)).append('\n')
                .append("Bot ID: ").append(participantId).append('\n');
        history.stream()
                .filter(r -> r.getEventType() == AuditEventType.DETECTED)
                .reduce((first, second) -> second)
                .ifPresent(detected -> body
                        .append("Account Age: ").append(detected.getDetail().getOrDefault("accountAgeDays", "?")).append(" days\n")
                        .append("Invited By: ").append(detected.getDetail().getOrDefault("invitedBy", "Unknown")).append('\n'));

        int from = Math.max(0, history.size() - HISTORY_ENTRIES_SHOWN);
        for (AuditRecord record : history.subList(from, history.size())) {
            body.append(eventEmoji(record.getEventType())).append(' ').append(record.getEventType())
                    .append(" - ").append(FULL_TIME.format(Instant.ofEpochMilli(record.getTimestamp())))
                    .append(" by ").append(actorName(record)).append('\n');
            String reason = record.getDetail() != null ? record.getDetail().get("reason") : null;
            if (reason != null) {
                body.append("   Reason: ").append(reason).append('\n');
            }
        }
        if (history.size() > HISTORY_ENTRIES_SHOWN) {
            body.append("Showing ").append(HISTORY_ENTRIES_SHOWN).append(" most recent of ")
                    .append(history.size()).append(" total entries");
        }
        return CommandReply.ok(body.toString().trim());
    }

    private CommandReply logs(String communityId, List<String> args) {
        Integer requested = null;
        if (!args.isEmpty()) {
            try {
                requested = Integer.parseInt(args.get(0).trim());
            } catch (NumberFormatException e) {
                return CommandReply.error("Usage: " + config.getCommandPrefix() + "logs [limit]");
            }
        }
        int limit = auditLogService.clampLimit(requested);

        List<AuditRecord> records;
        AuditStats stats;
        try {
            records = auditLogService.recent(communityId, limit, null).data();
            stats = auditLogService.stats(communityId);
        } catch (RuntimeException e) {
            log.error("Error retrieving logs for community={}: {}", communityId, e.getMessage());
            return CommandReply.error(LOGS_UNAVAILABLE);
        }

        if (records.isEmpty()) {
            return CommandReply.ok("📋 Bot Action Logs\nNo bot actions recorded yet.");
        }

        StringBuilder body = new StringBuilder("📋 Bot Action Logs\n")
                .append("Overall: ").append(stats.getTotalActions()).append(" actions, ")
                .append(stats.getApprovedCount()).append(" approved, ")
                .append(stats.getRejectedCount()).append(" rejected, ")
                .append(stats.getTimedOutCount()).append(" timed out\n")
                .append("Last 24 hours: ").append(stats.getRecentTotal()).append(" actions, ")
                .append(stats.getRecentApproved()).append(" approved, ")
                .append(stats.getRecentRejected()).append(" rejected, ")
                .append(stats.getRecentTimedOut()).append(" timed out\n");

        int shown = Math.min(LOG_ENTRIES_SHOWN, records.size());
        body.append("Recent Actions (showing ").append(shown).append(" of ").append(records.size()).append("):\n");
        for (AuditRecord record : records.subList(0, shown)) {
            body.append(eventEmoji(record.getEventType())).append(' ')
                    .append(record.getDetail().getOrDefault("participantName", record.getParticipantId()))
                    .append(" (").append(record.getEventType()).append(") ")
                    .append(SHORT_TIME.format(Instant.ofEpochMilli(record.getTimestamp())))
                    .append(" by ").append(actorName(record));
            if (record.getEventType() == AuditEventType.DETECTED) {
                body.append(" | Invited by: ").append(record.getDetail().getOrDefault("invitedBy", "Unknown"));
            }
            body.append('\n');
        }
        body.append("Use ").append(config.getCommandPrefix()).append("logs ").append(limit)
                .append(" to see more entries (max ").append(config.getAudit().getLogsMaxLimit()).append(")");
        return CommandReply.ok(body.toString());
    }

    private void postToChannel(String channelId, CommandReply reply) {
        if (channelId == null || channelId.isBlank()) {
            return;
        }
        try {
            gateway.sendChannelMessage(channelId, reply.message());
        } catch (RuntimeException e) {
            log.warn("Cannot post command reply to channel={}: {}", channelId, e.getMessage());
        }
    }

    private boolean isReviewer(String communityId, String actorId) {
        if (actorId == null || actorId.isBlank()) {
            return false;
        }
        try {
            return reviewerDirectory.isReviewer(communityId, actorId);
        } catch (RuntimeException e) {
            log.warn("Reviewer check failed for actor={} in community={}; denying: {}",
                    actorId, communityId, e.getMessage());
            return false;
        }
    }

    private String normalize(String name) {
        if (name == null) {
            return "";
        }
        String trimmed = name.trim();
        String prefix = config.getCommandPrefix();
        if (prefix != null && !prefix.isEmpty() && trimmed.startsWith(prefix)) {
            trimmed = trimmed.substring(prefix.length());
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    private static boolean isKnown(String name) {
        switch (name) {
            case "status":
            case "botstatus":
            case "approve":
            case "reject":
            case "history":
            case "bothistory":
            case "logs":
                return true;
            default:
                return false;
        }
    }

    private String usage() {
        String p = config.getCommandPrefix();
        return "Available commands: " + p + "status, " + p + "approve <participantId>, "
                + p + "reject <participantId>, " + p + "history <participantId>, " + p + "logs [limit]";
    }

    private static Boolean emojiDecision(String emoji) {
        if (DecisionNotificationService.APPROVE_EMOJI.equals(emoji)) {
            return Boolean.TRUE;
        }
        if (DecisionNotificationService.REJECT_EMOJI.equals(emoji)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static String eventEmoji(AuditEventType type) {
        switch (type) {
            case DETECTED:
                return "🔍";
            case APPROVED:
                return "✅";
            case REJECTED:
                return "❌";
            case TIMED_OUT:
                return "⏰";
            default:
                return "⚠️";
        }
    }

    private static String actorName(AuditRecord record) {
        return record.getActorId() != null ? record.getActorId() : "System";
    }

    private static String participantNameOf(List<AuditRecord> history, String fallback) {
        return history.stream()
                .map(r -> r.getDetail() != null ? r.getDetail().get("participantName") : null)
                .filter(n -> n != null)
                .findFirst()
                .orElse(fallback);
    }

    private static String displayName(PendingApproval approval) {
        return approval.getParticipantName() != null ? approval.getParticipantName() : approval.getParticipantId();
    }
}
