package com.community.botguard.model;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public AuditEventType toAuditEventType() {
        return switch (this) {
            case APPROVED -> AuditEventType.APPROVED;
            case REJECTED -> AuditEventType.REJECTED;
            case TIMED_OUT -> AuditEventType.TIMED_OUT;
            case PENDING -> AuditEventType.DETECTED;
        };
    }
}
