package com.community.botguard.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.community.botguard.config.AerospikeConfig;
import com.community.botguard.model.AuditEventType;
import com.community.botguard.model.AuditRecord;
import com.community.botguard.model.AuditStats;
import com.community.botguard.model.PagedResponse;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only store of {@link AuditRecord}s. Records are written once with
 * CREATE_ONLY and never updated or deleted.
 */
@Repository
public class AuditRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(AuditRecordRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AuditRecordRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void append(AuditRecord record) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_RECORDS, record.getRecordId());

        Bin recordIdBin = new Bin("recordId", record.getRecordId());
        Bin communityIdBin = new Bin("communityId", record.getCommunityId());
        Bin participantIdBin = new Bin("participantId", record.getParticipantId());
        Bin eventTypeBin = new Bin("eventType", record.getEventType().name());
        Bin actorIdBin = new Bin("actorId", record.getActorId() != null ? record.getActorId() : "");
        Bin timestampBin = new Bin("timestamp", record.getTimestamp());
        Bin sequenceBin = new Bin("sequence", record.getSequence());
        Bin detailBin = new Bin("detail", serializeDetail(record.getDetail()));

        client.put(writePolicy, key,
                recordIdBin, communityIdBin, participantIdBin, eventTypeBin,
                actorIdBin, timestampBin, sequenceBin, detailBin);
    }

    /**
     * Full trail of one participant, oldest first.
     */
    public List<AuditRecord> findByParticipant(String participantId, String communityId) {
        List<AuditRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_RECORDS,
                (key, record) -> {
                    try {
                        if (!participantId.equals(record.getString("participantId"))) return;
                        if (communityId != null && !communityId.equals(record.getString("communityId"))) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit record: {}", e.getMessage());
                    }
                });

        results.sort(AuditCursor.LOG_ORDER);
        return results;
    }

    /**
     * Most recent records first, optionally limited to one community and to the given
     * event types. {@code before} is the cursor returned by the previous page.
     *
     * @throws IllegalArgumentException if {@code before} is not a valid cursor
     */
    public PagedResponse<AuditRecord> findRecent(String communityId, Set<AuditEventType> eventTypes,
                                                 int limit, String before) {
        AuditCursor cursor = before != null ? AuditCursor.parse(before) : null;
        List<AuditRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_RECORDS,
                (key, record) -> {
                    try {
                        if (communityId != null && !communityId.equals(record.getString("communityId"))) return;
                        if (eventTypes != null && !eventTypes.isEmpty()
                                && !eventTypes.contains(AuditEventType.valueOf(record.getString("eventType")))) return;
                        AuditRecord mapped = mapRecord(record);
                        if (cursor != null && !cursor.isAfter(AuditCursor.of(mapped))) return;
                        synchronized (results) {
                            results.add(mapped);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to filter audit record: {}", e.getMessage());
                    }
                });

        results.sort(AuditCursor.LOG_ORDER.reversed());
        boolean hasMore = results.size() > limit;
        List<AuditRecord> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? AuditCursor.of(page.get(page.size() - 1)).encode() : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    /**
     * Counts per event type, overall and for records at or after {@code recentSince}.
     */
    public AuditStats computeStats(String communityId, long recentSince) {
        // indexed by AuditEventType ordinal
        int[] totals = new int[AuditEventType.values().length];
        int[] recent = new int[AuditEventType.values().length];
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_RECORDS,
                (key, record) -> {
                    try {
                        if (communityId != null && !communityId.equals(record.getString("communityId"))) return;
                        int idx = AuditEventType.valueOf(record.getString("eventType")).ordinal();
                        boolean isRecent = record.getLong("timestamp") >= recentSince;
                        synchronized (totals) {
                            totals[idx]++;
                            if (isRecent) recent[idx]++;
                        }
                    } catch (Exception e) {
                        log.warn("Failed to count audit record: {}", e.getMessage());
                    }
                });

        int recentTotal = 0;
        int total = 0;
        for (int i = 0; i < totals.length; i++) {
            total += totals[i];
            recentTotal += recent[i];
        }

        return AuditStats.builder()
                .totalActions(total)
                .detectedCount(totals[AuditEventType.DETECTED.ordinal()])
                .approvedCount(totals[AuditEventType.APPROVED.ordinal()])
                .rejectedCount(totals[AuditEventType.REJECTED.ordinal()])
                .timedOutCount(totals[AuditEventType.TIMED_OUT.ordinal()])
                .removalFailedCount(totals[AuditEventType.REMOVAL_FAILED.ordinal()])
                .recentTotal(recentTotal)
                .recentApproved(recent[AuditEventType.APPROVED.ordinal()])
                .recentRejected(recent[AuditEventType.REJECTED.ordinal()])
                .recentTimedOut(recent[AuditEventType.TIMED_OUT.ordinal()])
                .build();
    }

    private AuditRecord mapRecord(Record record) {
        String actorId = record.getString("actorId");
        return AuditRecord.builder()
                .recordId(record.getString("recordId"))
                .communityId(record.getString("communityId"))
                .participantId(record.getString("participantId"))
                .eventType(AuditEventType.valueOf(record.getString("eventType")))
                .actorId(actorId != null && !actorId.isEmpty() ? actorId : null)
                .timestamp(record.getLong("timestamp"))
                .sequence(record.getLong("sequence"))
                .detail(deserializeDetail(record.getString("detail")))
                .build();
    }

    private String serializeDetail(Map<String, String> detail) {
        try {
            return objectMapper.writeValueAsString(detail != null ? detail : Collections.emptyMap());
        } catch (Exception e) {
            log.error("Failed to serialize audit detail", e);
            return "{}";
        }
    }

    private Map<String, String> deserializeDetail(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize audit detail", e);
            return Collections.emptyMap();
        }
    }
}
