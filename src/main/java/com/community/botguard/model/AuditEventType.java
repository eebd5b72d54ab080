package com.community.botguard.model;

public enum AuditEventType {
    DETECTED,
    APPROVED,
    REJECTED,
    TIMED_OUT,
    REMOVAL_FAILED;

    public boolean isOutcome() {
        return this == APPROVED || this == REJECTED || this == TIMED_OUT;
    }
}
