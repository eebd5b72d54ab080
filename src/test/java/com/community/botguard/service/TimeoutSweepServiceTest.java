package com.community.botguard.service;

import com.community.botguard.config.BotGuardConfig;
import com.community.botguard.model.ApprovalStatus;
import com.community.botguard.registry.ApprovalRegistry;
import com.community.botguard.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeoutSweepServiceTest {

    @Mock private ApprovalWorkflowService workflowService;

    private MutableClock clock;
    private ApprovalRegistry registry;
    private BotGuardConfig config;
    private TimeoutSweepService sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new ApprovalRegistry(clock);
        config = new BotGuardConfig();
        sweeper = new TimeoutSweepService(registry, workflowService, config, clock);
    }

    @Test
    void sweep_timesOutEntriesPastDeadlinePlusGrace() {
        registry.create("GUILD-1", "BOT-OLD", clock.millis() + 10_000);
        registry.create("GUILD-1", "BOT-NEW", clock.millis() + 120_000);
        clock.advance(Duration.ofSeconds(16));
        when(workflowService.onTimeout("GUILD-1", "BOT-OLD")).thenReturn(true);

        sweeper.sweepExpired();

        verify(workflowService).onTimeout("GUILD-1", "BOT-OLD");
        verify(workflowService, never()).onTimeout("GUILD-1", "BOT-NEW");
    }

    @Test
    void sweep_withinGracePeriod_leavesEntryToItsTimer() {
        registry.create("GUILD-1", "BOT-1", clock.millis() + 10_000);
        clock.advance(Duration.ofSeconds(12));

        sweeper.sweepExpired();

        verifyNoInteractions(workflowService);
    }

    @Test
    void sweep_failureOnOneEntry_continuesWithOthers() {
        registry.create("GUILD-1", "BOT-1", clock.millis());
        registry.create("GUILD-1", "BOT-2", clock.millis());
        clock.advance(Duration.ofMinutes(1));
        when(workflowService.onTimeout("GUILD-1", "BOT-1")).thenThrow(new IllegalStateException("boom"));
        when(workflowService.onTimeout("GUILD-1", "BOT-2")).thenReturn(true);

        sweeper.sweepExpired();

        verify(workflowService).onTimeout("GUILD-1", "BOT-2");
    }

    @Test
    void sweep_prunesExpiredTombstones() {
        registry.create("GUILD-1", "BOT-1", clock.millis() + 10_000);
        registry.resolve("GUILD-1", "BOT-1", ApprovalStatus.APPROVED, "REVIEWER-1");
        clock.advance(Duration.ofMinutes(11));

        sweeper.sweepExpired();

        assertThat(registry.pruneResolved(Long.MAX_VALUE)).isZero();
    }

    @Test
    void sweep_disabled_doesNothing() {
        config.getSweep().setEnabled(false);
        registry.create("GUILD-1", "BOT-1", clock.millis());
        clock.advance(Duration.ofMinutes(1));

        sweeper.sweepExpired();

        verifyNoInteractions(workflowService);
    }
}
