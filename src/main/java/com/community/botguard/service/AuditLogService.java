package com.community.botguard.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.community.botguard.config.BotGuardConfig;
import com.community.botguard.config.MetricsConfig;
import com.community.botguard.model.AuditEventType;
import com.community.botguard.model.AuditRecord;
import com.community.botguard.model.AuditStats;
import com.community.botguard.model.PagedResponse;
import com.community.botguard.repository.AuditRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Durable trail of every approval transition.
 *
 * <p>Writes never fail the workflow: a storage error is retried a bounded number of
 * times and then logged as an audit gap. The decision that triggered the write
 * stands either way.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private static final Set<AuditEventType> OUTCOME_TYPES =
            EnumSet.of(AuditEventType.APPROVED, AuditEventType.REJECTED, AuditEventType.TIMED_OUT);

    private final AuditRecordRepository repository;
    private final BotGuardConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final RetryTemplate retryTemplate;
    // Orders records written in the same millisecond.
    private final AtomicLong sequence = new AtomicLong();

    public AuditLogService(AuditRecordRepository repository,
                           BotGuardConfig config,
                           MetricsConfig metricsConfig,
                           Clock clock,
                           @Qualifier("auditRetryTemplate") RetryTemplate retryTemplate) {
        this.repository = repository;
        this.retryTemplate = retryTemplate;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Append one record.
     *
     * @return true if the record was stored, false if it was given up on
     */
    public boolean record(AuditEventType eventType, String communityId, String participantId,
                          String actorId, Map<String, String> detail) {
        AuditRecord record = AuditRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .communityId(communityId)
                .participantId(participantId)
                .eventType(eventType)
                .actorId(actorId != null ? actorId : AuditRecord.SYSTEM_ACTOR)
                .timestamp(clock.millis())
                .sequence(sequence.incrementAndGet())
                .detail(detail != null ? new LinkedHashMap<>(detail) : Map.of())
                .build();

        return retryTemplate.<Boolean, RuntimeException>execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying audit write ({}/{}) for {} community={}, participant={}: {}",
                        context.getRetryCount(), config.getAudit().getWriteRetries(), eventType,
                        communityId, participantId, context.getLastThrowable().getMessage());
            }
            try {
                repository.append(record);
            } catch (AerospikeException e) {
                // The record ID is unique per call, so an existing key is an earlier attempt that committed.
                if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) {
                    throw e;
                }
                log.debug("Audit record {} already stored by an earlier attempt", record.getRecordId());
            }
            metricsConfig.recordAuditWrite("success");
            return true;
        }, context -> {
            metricsConfig.recordAuditWrite("gap");
            Throwable last = context.getLastThrowable();
            log.error("AUDIT GAP: could not store {} for community={}, participant={}, actor={} after {} attempts: {}",
                    eventType, communityId, participantId, record.getActorId(), context.getRetryCount(),
                    last != null ? last.getMessage() : "unknown error");
            return false;
        });
    }

    public List<AuditRecord> history(String participantId, String communityId) {
        return repository.findByParticipant(participantId, communityId);
    }

    /**
     * Recent records across participants, newest first. The limit is clamped to
     * {@code botguard.audit.logs-max-limit}.
     *
     * @throws IllegalArgumentException if {@code before} is not a cursor from a previous page
     */
    public PagedResponse<AuditRecord> recent(String communityId, Integer limit, String before) {
        return repository.findRecent(communityId, null, clampLimit(limit), before);
    }

    public List<AuditRecord> recentOutcomes(String communityId, int limit) {
        return repository.findRecent(communityId, OUTCOME_TYPES, limit, null).data();
    }

    public AuditStats stats(String communityId) {
        long dayAgo = clock.millis() - Duration.ofHours(24).toMillis();
        return repository.computeStats(communityId, dayAgo);
    }

    public int clampLimit(Integer limit) {
        BotGuardConfig.Audit audit = config.getAudit();
        if (limit == null) {
            return audit.getLogsDefaultLimit();
        }
        return Math.max(1, Math.min(limit, audit.getLogsMaxLimit()));
    }
}
