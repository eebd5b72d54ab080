package com.community.botguard.model;

/**
 * Text reply to a command or reaction. {@code success} is false for denials,
 * usage errors and lookups that found nothing.
 */
public record CommandReply(boolean success, String message) {

    public static CommandReply ok(String message) {
        return new CommandReply(true, message);
    }

    public static CommandReply error(String message) {
        return new CommandReply(false, message);
    }
}
