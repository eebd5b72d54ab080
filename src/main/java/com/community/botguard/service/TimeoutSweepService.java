package com.community.botguard.service;

import com.community.botguard.config.BotGuardConfig;
import com.community.botguard.model.PendingApproval;
import com.community.botguard.registry.ApprovalRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Safety net behind the per-entry timers. Resolves entries whose deadline passed
 * more than the grace period ago and drops expired tombstones.
 */
@Service
public class TimeoutSweepService {

    private static final Logger log = LoggerFactory.getLogger(TimeoutSweepService.class);

    private final ApprovalRegistry registry;
    private final ApprovalWorkflowService workflowService;
    private final BotGuardConfig config;
    private final Clock clock;

    public TimeoutSweepService(ApprovalRegistry registry,
                               ApprovalWorkflowService workflowService,
                               BotGuardConfig config,
                               Clock clock) {
        this.registry = registry;
        this.workflowService = workflowService;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${botguard.sweep.interval-seconds:30}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${botguard.sweep.interval-seconds:30}")
    public void sweepExpired() {
        if (!config.getSweep().isEnabled()) {
            return;
        }

        long now = clock.millis();
        List<PendingApproval> overdue = registry.overdue(now - Duration.ofSeconds(config.getSweep().getGraceSeconds()).toMillis());
        int timedOut = 0;

        for (PendingApproval approval : overdue) {
            try {
                if (workflowService.onTimeout(approval.getCommunityId(), approval.getParticipantId())) {
                    timedOut++;
                }
            } catch (RuntimeException e) {
                log.error("Sweep could not time out participant={} in community={}",
                        approval.getParticipantId(), approval.getCommunityId(), e);
            }
        }

        if (timedOut > 0) {
            log.warn("Sweep timed out {} approvals whose timer did not fire", timedOut);
        }

        int pruned = registry.pruneResolved(now - Duration.ofMinutes(config.getResolvedRetentionMinutes()).toMillis());
        if (pruned > 0) {
            log.debug("Pruned {} resolved approval tombstones", pruned);
        }
    }
}
