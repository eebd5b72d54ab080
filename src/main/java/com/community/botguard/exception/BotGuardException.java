package com.community.botguard.exception;

/**
 * Base type of the approval workflow's own failures.
 */
public class BotGuardException extends RuntimeException {

    public BotGuardException(String message) {
        super(message);
    }
}
