package com.community.botguard.model;

import java.util.Objects;

/**
 * Composite key of a pending approval: one automated participant in one community.
 */
public record ApprovalKey(String communityId, String participantId) {

    public ApprovalKey {
        Objects.requireNonNull(communityId, "communityId is required");
        Objects.requireNonNull(participantId, "participantId is required");
    }

    @Override
    public String toString() {
        return communityId + "/" + participantId;
    }
}
