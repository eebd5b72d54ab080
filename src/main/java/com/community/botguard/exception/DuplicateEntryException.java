package com.community.botguard.exception;

import com.community.botguard.model.ApprovalKey;

public class DuplicateEntryException extends BotGuardException {

    private final ApprovalKey key;

    public DuplicateEntryException(ApprovalKey key) {
        super("Participant " + key.participantId() + " is already pending in community " + key.communityId());
        this.key = key;
    }

    public ApprovalKey getKey() {
        return key;
    }
}
