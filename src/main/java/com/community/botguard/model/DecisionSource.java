package com.community.botguard.model;

/**
 * Where a reviewer decision came from. Stored in the audit detail.
 */
public enum DecisionSource {
    REACTION,
    COMMAND,
    API
}
