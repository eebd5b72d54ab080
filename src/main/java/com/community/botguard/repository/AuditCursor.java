package com.community.botguard.repository;

import com.community.botguard.model.AuditRecord;

import java.util.Comparator;

/**
 * Position of an audit record in the log: {@code timestamp:sequence:recordId}.
 * A bare timestamp is accepted and selects everything strictly older than it.
 */
public record AuditCursor(long timestamp, long sequence, String recordId) implements Comparable<AuditCursor> {

    /** Oldest first. */
    static final Comparator<AuditRecord> LOG_ORDER = Comparator
            .comparingLong(AuditRecord::getTimestamp)
            .thenComparingLong(AuditRecord::getSequence)
            .thenComparing(AuditRecord::getRecordId, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    private static final Comparator<AuditCursor> ORDER = Comparator
            .comparingLong(AuditCursor::timestamp)
            .thenComparingLong(AuditCursor::sequence)
            .thenComparing(AuditCursor::recordId, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    public static AuditCursor of(AuditRecord record) {
        return new AuditCursor(record.getTimestamp(), record.getSequence(), record.getRecordId());
    }

    /**
     * @throws IllegalArgumentException if the value is not a cursor
     */
    public static AuditCursor parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Cursor must not be empty");
        }
        String[] parts = value.split(":", 3);
        try {
            if (parts.length == 1) {
                return new AuditCursor(Long.parseLong(parts[0]), Long.MIN_VALUE, null);
            }
            if (parts.length == 3 && !parts[2].isEmpty()) {
                return new AuditCursor(Long.parseLong(parts[0]), Long.parseLong(parts[1]), parts[2]);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor: " + value, e);
        }
        throw new IllegalArgumentException("Invalid cursor: " + value);
    }

    public boolean isAfter(AuditCursor other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(AuditCursor other) {
        return ORDER.compare(this, other);
    }

    public String encode() {
        return timestamp + ":" + sequence + ":" + recordId;
    }
}
