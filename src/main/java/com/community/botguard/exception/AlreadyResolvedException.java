package com.community.botguard.exception;

import com.community.botguard.model.ApprovalKey;
import com.community.botguard.model.PendingApproval;

/**
 * Thrown to the loser of a resolution race. Callers treat it as
 * "someone else already handled this", not as a failure.
 */
public class AlreadyResolvedException extends BotGuardException {

    private final ApprovalKey key;
    private final PendingApproval resolved;

    public AlreadyResolvedException(ApprovalKey key, PendingApproval resolved) {
        super("Participant " + key.participantId() + " in community " + key.communityId()
                + " was already resolved" + (resolved != null ? " as " + resolved.getStatus() : ""));
        this.key = key;
        this.resolved = resolved;
    }

    public ApprovalKey getKey() {
        return key;
    }

    /**
     * Snapshot of the winning resolution, or null when a stale timer hit a newer lifecycle.
     */
    public PendingApproval getResolved() {
        return resolved;
    }
}
