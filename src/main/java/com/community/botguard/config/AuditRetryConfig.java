package com.community.botguard.config;

import com.aerospike.client.AerospikeException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

@Configuration
public class AuditRetryConfig {

    /**
     * Retry policy for audit writes: the first attempt plus
     * {@code botguard.audit.write-retries} retries, only on storage errors.
     */
    @Bean
    public RetryTemplate auditRetryTemplate(BotGuardConfig config) {
        return buildAuditRetryTemplate(config.getAudit());
    }

    public static RetryTemplate buildAuditRetryTemplate(BotGuardConfig.Audit audit) {
        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(Math.max(1, audit.getWriteRetries() + 1));

        // fixedBackoff rejects intervals below 1 ms
        if (audit.getRetryBackoffMs() > 0) {
            builder = builder.fixedBackoff(audit.getRetryBackoffMs());
        } else {
            builder = builder.noBackoff();
        }

        return builder
                .retryOn(AerospikeException.class)
                .build();
    }
}
