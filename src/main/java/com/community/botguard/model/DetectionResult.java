package com.community.botguard.model;

public record DetectionResult(Outcome outcome, PendingApproval approval) {

    public enum Outcome {
        /** Human member, nothing to review. */
        IGNORED,
        /** Participant already pending in this community. */
        DUPLICATE,
        PENDING
    }

    public static DetectionResult ignored() {
        return new DetectionResult(Outcome.IGNORED, null);
    }

    public static DetectionResult duplicate(PendingApproval existing) {
        return new DetectionResult(Outcome.DUPLICATE, existing);
    }

    public static DetectionResult pending(PendingApproval approval) {
        return new DetectionResult(Outcome.PENDING, approval);
    }
}
