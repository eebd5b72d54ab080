package com.community.botguard.exception;

public class NotAuthorizedException extends BotGuardException {

    private final String actorId;

    public NotAuthorizedException(String communityId, String actorId) {
        super("Actor " + actorId + " is not a reviewer in community " + communityId);
        this.actorId = actorId;
    }

    public String getActorId() {
        return actorId;
    }
}
