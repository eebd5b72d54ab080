package com.community.botguard.exception;

import com.community.botguard.model.ApprovalKey;

public class ApprovalNotFoundException extends BotGuardException {

    private final ApprovalKey key;

    public ApprovalNotFoundException(ApprovalKey key) {
        super("No pending approval for participant " + key.participantId() + " in community " + key.communityId());
        this.key = key;
    }

    public ApprovalKey getKey() {
        return key;
    }
}
