package com.community.botguard.service;

import com.community.botguard.config.BotGuardConfig;
import com.community.botguard.config.MetricsConfig;
import com.community.botguard.connector.CommunityGateway;
import com.community.botguard.connector.ConnectorException;
import com.community.botguard.connector.ReviewerDirectory;
import com.community.botguard.exception.AlreadyResolvedException;
import com.community.botguard.exception.ApprovalNotFoundException;
import com.community.botguard.exception.DuplicateEntryException;
import com.community.botguard.exception.NotAuthorizedException;
import com.community.botguard.model.ApprovalKey;
import com.community.botguard.model.ApprovalStatus;
import com.community.botguard.model.AuditEventType;
import com.community.botguard.model.AuditRecord;
import com.community.botguard.model.AuditStats;
import com.community.botguard.model.DecisionResult;
import com.community.botguard.model.DecisionSource;
import com.community.botguard.model.DetectionResult;
import com.community.botguard.model.ParticipantJoinedEvent;
import com.community.botguard.model.PendingApproval;
import com.community.botguard.model.StatusSummary;
import com.community.botguard.registry.ApprovalRegistry;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives each detected bot from PENDING to exactly one terminal outcome.
 *
 * Flow:
 * 1. Detection creates a registry entry, writes DETECTED and arms a one-shot timer
 * 2. Reviewers are messaged asynchronously
 * 3. A reviewer decision or the timer resolves the entry through the registry;
 *    whichever call reaches {@link ApprovalRegistry#resolve} first wins
 * 4. The winner writes the outcome record and, for REJECTED / TIMED_OUT, removes the bot.
 *    For timeouts this runs on the follow-up executor, not the timer thread
 *
 * Losing a resolution race is not an error: the decision path reports
 * "already handled" and the timer path does nothing.
 */
@Service
public class ApprovalWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalWorkflowService.class);

    static final String TIMEOUT_REASON = "Timeout - no approval received";

    private final ApprovalRegistry registry;
    private final AuditLogService auditLogService;
    private final DecisionNotificationService notificationService;
    private final TwilioAlertService twilioAlertService;
    private final CommunityGateway gateway;
    private final ReviewerDirectory reviewerDirectory;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor followUpExecutor;
    private final BotGuardConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;

    public ApprovalWorkflowService(ApprovalRegistry registry,
                                   AuditLogService auditLogService,
                                   DecisionNotificationService notificationService,
                                   TwilioAlertService twilioAlertService,
                                   CommunityGateway gateway,
                                   ReviewerDirectory reviewerDirectory,
                                   TaskScheduler taskScheduler,
                                   @Qualifier("taskExecutor") TaskExecutor followUpExecutor,
                                   BotGuardConfig config,
                                   MetricsConfig metricsConfig,
                                   Tracer tracer,
                                   Clock clock) {
        this.registry = registry;
        this.auditLogService = auditLogService;
        this.notificationService = notificationService;
        this.twilioAlertService = twilioAlertService;
        this.gateway = gateway;
        this.reviewerDirectory = reviewerDirectory;
        this.taskScheduler = taskScheduler;
        this.followUpExecutor = followUpExecutor;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;
    }

    @Observed(name = "approval.detect", contextualName = "participant-detected")
    public DetectionResult onParticipantDetected(ParticipantJoinedEvent event) {
        if (!event.isAutomated()) {
            return DetectionResult.ignored();
        }

        long now = clock.millis();
        PendingApproval created;
        try {
            created = registry.create(PendingApproval.builder()
                    .communityId(event.getCommunityId())
                    .participantId(event.getParticipantId())
                    .participantName(event.getParticipantName())
                    .inviterId(event.getInviterId())
                    .inviterName(event.getInviterName())
                    .detectedAt(now)
                    .deadline(now + config.getApprovalTimeout().toMillis())
                    .build());
        } catch (DuplicateEntryException e) {
            metricsConfig.recordDetection("duplicate");
            log.warn("Bot {} is already pending approval in community={}; ignoring repeated join",
                    event.getParticipantId(), event.getCommunityId());
            return DetectionResult.duplicate(
                    registry.get(event.getCommunityId(), event.getParticipantId()).orElse(null));
        }

        metricsConfig.recordDetection("pending");
        metricsConfig.updatePendingCount(registry.pendingCount());
        log.info("Bot detected joining community={}: {} (ID: {}), deadline in {}s",
                event.getCommunityId(), event.getParticipantName(), event.getParticipantId(),
                config.getApprovalTimeoutSeconds());

        auditLogService.record(AuditEventType.DETECTED, created.getCommunityId(), created.getParticipantId(),
                AuditRecord.SYSTEM_ACTOR, detectionDetail(event, now));

        scheduleTimeout(created);
        requestReview(created);
        return DetectionResult.pending(created);
    }

    /**
     * Apply a reviewer's approve / reject decision.
     *
     * @throws NotAuthorizedException    if the actor lacks the reviewer capability
     * @throws ApprovalNotFoundException if the participant is not, and was not recently, pending
     */
    @Observed(name = "approval.decide", contextualName = "reviewer-decision")
    public DecisionResult onReviewerDecision(String communityId, String participantId, boolean approve,
                                             String actorId, DecisionSource source) {
        if (!hasReviewerCapability(communityId, actorId)) {
            log.warn("Rejected decision on participant={} in community={}: actor={} is not a reviewer",
                    participantId, communityId, actorId);
            throw new NotAuthorizedException(communityId, actorId);
        }

        ApprovalStatus outcome = approve ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED;
        PendingApproval resolved;
        try {
            resolved = registry.resolve(new ApprovalKey(communityId, participantId), null, outcome, actorId);
        } catch (AlreadyResolvedException e) {
            metricsConfig.recordLateDecision(source.name());
            PendingApproval previous = e.getResolved();
            log.info("Decision {} by {} on participant={} in community={} arrived too late: already {}",
                    outcome, actorId, participantId, communityId,
                    previous != null ? previous.getStatus() : "handled");
            return DecisionResult.builder()
                    .communityId(communityId)
                    .participantId(participantId)
                    .status(previous != null ? previous.getStatus() : null)
                    .resolvedBy(previous != null ? previous.getResolvedBy() : null)
                    .alreadyHandled(true)
                    .build();
        }

        recordResolution(resolved);
        String reason = approve ? "Approved by " + actorId : "Rejected by " + actorId;
        Map<String, String> detail = new LinkedHashMap<>();
        detail.put("source", source.name());
        detail.put("reason", reason);
        auditLogService.record(outcome.toAuditEventType(), communityId, participantId, actorId, detail);
        log.info("Bot {} (ID: {}) {} by {} in community={}",
                resolved.getParticipantName(), participantId, outcome, actorId, communityId);

        boolean removalFailed = false;
        if (approve) {
            notificationService.sendDecisionConfirmation(actorId, resolved);
        } else {
            removalFailed = !removeParticipant(resolved, reason);
        }

        return DecisionResult.builder()
                .communityId(communityId)
                .participantId(participantId)
                .status(outcome)
                .resolvedBy(actorId)
                .alreadyHandled(false)
                .removalFailed(removalFailed)
                .build();
    }

    /**
     * Resolve a pending entry as TIMED_OUT. A no-op when a reviewer got there first.
     *
     * @return true if this call resolved the entry
     */
    @Observed(name = "approval.timeout", contextualName = "approval-timeout")
    public boolean onTimeout(String communityId, String participantId) {
        return handleTimeout(new ApprovalKey(communityId, participantId), null);
    }

    public StatusSummary statusSummary(String communityId) {
        List<PendingApproval> pending = registry.listPending(communityId);

        List<AuditRecord> recentOutcomes;
        AuditStats stats;
        try {
            recentOutcomes = auditLogService.recentOutcomes(communityId, config.getAudit().getRecentOutcomesLimit());
            stats = auditLogService.stats(communityId);
        } catch (RuntimeException e) {
            log.warn("Audit log unavailable for status summary of community={}: {}", communityId, e.getMessage());
            recentOutcomes = Collections.emptyList();
            stats = null;
        }

        return StatusSummary.builder()
                .pendingCount(pending.size())
                .pending(pending)
                .recentOutcomes(recentOutcomes)
                .stats(stats)
                .build();
    }

    void fireTimeout(ApprovalKey key, String approvalId) {
        Span span = tracer.nextSpan()
                .name("approval.timeout.fire")
                .tag("community.id", key.communityId())
                .tag("participant.id", key.participantId())
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            handleTimeout(key, approvalId);
        } catch (Exception e) {
            span.error(e);
            log.error("Timeout handling failed for participant={} in community={}",
                    key.participantId(), key.communityId(), e);
        } finally {
            span.end();
        }
    }

    private boolean handleTimeout(ApprovalKey key, String approvalId) {
        PendingApproval resolved;
        try {
            resolved = registry.resolve(key, approvalId, ApprovalStatus.TIMED_OUT, AuditRecord.SYSTEM_ACTOR);
        } catch (AlreadyResolvedException | ApprovalNotFoundException e) {
            log.debug("Timer for participant={} in community={} fired after resolution",
                    key.participantId(), key.communityId());
            return false;
        }

        recordResolution(resolved);
        log.info("Bot {} (ID: {}) timed out in community={} without a decision",
                resolved.getParticipantName(), key.participantId(), key.communityId());

        // Audit retries and the removal call block; keep them off the timer threads.
        try {
            followUpExecutor.execute(() -> completeTimeout(resolved));
        } catch (TaskRejectedException e) {
            log.warn("Follow-up executor rejected timeout of participant={} in community={}; running inline",
                    key.participantId(), key.communityId());
            completeTimeout(resolved);
        }
        return true;
    }

    private void completeTimeout(PendingApproval resolved) {
        try {
            Map<String, String> detail = new LinkedHashMap<>();
            detail.put("reason", TIMEOUT_REASON);
            detail.put("timeoutSeconds", String.valueOf(config.getApprovalTimeoutSeconds()));
            auditLogService.record(AuditEventType.TIMED_OUT, resolved.getCommunityId(), resolved.getParticipantId(),
                    AuditRecord.SYSTEM_ACTOR, detail);
            removeParticipant(resolved, TIMEOUT_REASON);
        } catch (RuntimeException e) {
            log.error("Timeout follow-up failed for participant={} in community={}",
                    resolved.getParticipantId(), resolved.getCommunityId(), e);
        }
    }

    private void scheduleTimeout(PendingApproval approval) {
        ApprovalKey key = approval.key();
        String approvalId = approval.getApprovalId();
        try {
            ScheduledFuture<?> handle = taskScheduler.schedule(
                    () -> fireTimeout(key, approvalId), Instant.ofEpochMilli(approval.getDeadline()));
            registry.attachTimer(key, approvalId, handle);
        } catch (TaskRejectedException e) {
            // The sweeper resolves entries whose timer never ran.
            log.warn("Could not schedule timeout for participant={} in community={}: {}",
                    key.participantId(), key.communityId(), e.getMessage());
        }
    }

    private void requestReview(PendingApproval approval) {
        List<String> reviewers;
        try {
            reviewers = reviewerDirectory.findReviewers(approval.getCommunityId());
        } catch (RuntimeException e) {
            log.warn("Reviewer lookup failed for community={}: {}", approval.getCommunityId(), e.getMessage());
            reviewers = Collections.emptyList();
        }

        if (reviewers.isEmpty()) {
            log.warn("No reviewers found in community={}; bot {} will be removed when the timeout expires",
                    approval.getCommunityId(), approval.getParticipantId());
            twilioAlertService.alertNoReviewersReached(approval);
            return;
        }

        try {
            notificationService.notifyReviewers(approval, reviewers).whenComplete((delivered, error) -> {
                if (error != null) {
                    log.warn("Review request for participant={} failed: {}",
                            approval.getParticipantId(), error.getMessage());
                    return;
                }
                registry.recordNotified(approval.key(), approval.getApprovalId(), delivered);
                if (delivered == 0) {
                    twilioAlertService.alertNoReviewersReached(approval);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Could not dispatch review request for participant={}: {}",
                    approval.getParticipantId(), e.getMessage());
        }
    }

    /**
     * @return false if the participant is still in the community because removal failed
     */
    private boolean removeParticipant(PendingApproval approval, String reason) {
        try {
            gateway.removeParticipant(approval.getCommunityId(), approval.getParticipantId(), "Security Bot: " + reason);
            log.info("Bot {} (ID: {}) removed from community={} - {}",
                    approval.getParticipantName(), approval.getParticipantId(), approval.getCommunityId(), reason);
            return true;
        } catch (RuntimeException e) {
            if (e instanceof ConnectorException connectorError && connectorError.isNotFound()) {
                log.warn("Bot {} not found in community={} (may have already left)",
                        approval.getParticipantId(), approval.getCommunityId());
                return true;
            }

            metricsConfig.recordRemovalFailure();
            log.error("Cannot remove bot {} from community={}: {}",
                    approval.getParticipantId(), approval.getCommunityId(), e.getMessage());

            Map<String, String> detail = new LinkedHashMap<>();
            detail.put("reason", reason);
            detail.put("error", String.valueOf(e.getMessage()));
            if (e instanceof ConnectorException connectorError) {
                detail.put("statusCode", String.valueOf(connectorError.getStatusCode()));
            }
            auditLogService.record(AuditEventType.REMOVAL_FAILED, approval.getCommunityId(),
                    approval.getParticipantId(), AuditRecord.SYSTEM_ACTOR, detail);
            notificationService.notifyRemovalFailure(approval, String.valueOf(e.getMessage()));
            twilioAlertService.alertRemovalFailed(approval, String.valueOf(e.getMessage()));
            return false;
        }
    }

    private boolean hasReviewerCapability(String communityId, String actorId) {
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

    private void recordResolution(PendingApproval resolved) {
        metricsConfig.recordResolution(resolved.getStatus().name(),
                Duration.ofMillis(Math.max(0, resolved.getResolvedAt() - resolved.getDetectedAt())));
        metricsConfig.updatePendingCount(registry.pendingCount());
    }

    private Map<String, String> detectionDetail(ParticipantJoinedEvent event, long now) {
        Map<String, String> detail = new LinkedHashMap<>();
        detail.put("reason", "Bot detected joining server");
        if (event.getParticipantName() != null) {
            detail.put("participantName", event.getParticipantName());
        }
        detail.put("invitedBy", event.getInviterName() != null ? event.getInviterName() : "Unknown");
        if (event.getInviterId() != null) {
            detail.put("invitedById", event.getInviterId());
        }
        if (event.getAccountCreatedAt() > 0) {
            detail.put("accountAgeDays",
                    String.valueOf(Duration.ofMillis(now - event.getAccountCreatedAt()).toDays()));
        }
        return detail;
    }
}
