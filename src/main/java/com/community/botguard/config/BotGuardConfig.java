package com.community.botguard.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "botguard")
public class BotGuardConfig {

    public static final int MIN_TIMEOUT_SECONDS = 5;
    public static final int MAX_TIMEOUT_SECONDS = 300;

    // Seconds a detected bot stays pending before it is removed automatically.
    private int approvalTimeoutSeconds = 10;

    // Role whose members review new bots. Administrators always qualify.
    private String reviewerRoleId;

    private String commandPrefix = "!";

    // Platform permissions this service needs in every community; checked at startup.
    private List<String> requiredBotCapabilities = List.of(
            "send_messages", "read_messages", "kick_members",
            "view_audit_log", "add_reactions", "read_message_history");

    private int schedulerPoolSize = 2;

    // How long a resolved key answers "already handled" instead of "not found".
    private int resolvedRetentionMinutes = 10;

    private Audit audit = new Audit();

    private Sweep sweep = new Sweep();

    private CapabilityCheck capabilityCheck = new CapabilityCheck();

    @PostConstruct
    public void validate() {
        if (approvalTimeoutSeconds < MIN_TIMEOUT_SECONDS || approvalTimeoutSeconds > MAX_TIMEOUT_SECONDS) {
            throw new IllegalStateException(String.format(
                    "botguard.approval-timeout-seconds must be between %d and %d, got %d",
                    MIN_TIMEOUT_SECONDS, MAX_TIMEOUT_SECONDS, approvalTimeoutSeconds));
        }
        if (audit.getLogsMaxLimit() < 1 || audit.getLogsDefaultLimit() < 1) {
            throw new IllegalStateException("botguard.audit log limits must be positive");
        }
    }

    public Duration getApprovalTimeout() {
        return Duration.ofSeconds(approvalTimeoutSeconds);
    }

    @Data
    public static class Audit {
        private int writeRetries = 3;
        private long retryBackoffMs = 200;
        private int logsDefaultLimit = 20;
        private int logsMaxLimit = 50;
        private int recentOutcomesLimit = 10;
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;
        private int intervalSeconds = 30;
        // Extra time a timer gets before the sweeper steps in.
        private int graceSeconds = 5;
    }

    @Data
    public static class CapabilityCheck {
        private boolean enabled = true;
    }
}
