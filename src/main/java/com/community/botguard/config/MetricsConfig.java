package com.community.botguard.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger pendingApprovals;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.pendingApprovals = registry.gauge("approval.pending", new AtomicInteger(0));
    }

    public void recordDetection(String outcome) {
        Counter.builder("approval.detected.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordResolution(String status, Duration timeToDecision) {
        Counter.builder("approval.resolved.count")
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("approval.time_to_decision")
                .tag("status", status)
                .register(registry)
                .record(timeToDecision);
    }

    public void recordLateDecision(String source) {
        Counter.builder("approval.late_decision.count")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRemovalFailure() {
        registry.counter("approval.removal_failed.count").increment();
    }

    public void recordAuditWrite(String status) {
        Counter.builder("audit.write.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updatePendingCount(int count) {
        pendingApprovals.set(count);
    }
}
