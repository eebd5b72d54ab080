package com.community.botguard.connector;

import java.util.List;

/**
 * Reviewer capability lookup. A reviewer holds the configured reviewer role
 * or is a community administrator.
 */
public interface ReviewerDirectory {

    boolean isReviewer(String communityId, String actorId);

    /**
     * Human members able to review bots in the community; empty when none are configured.
     */
    List<String> findReviewers(String communityId);
}
