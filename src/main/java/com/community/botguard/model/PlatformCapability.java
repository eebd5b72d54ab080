package com.community.botguard.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Platform permissions the service may need in a community, by their wire name.
 */
public enum PlatformCapability {
    SEND_MESSAGES("send_messages"),
    READ_MESSAGES("read_messages"),
    KICK_MEMBERS("kick_members"),
    VIEW_AUDIT_LOG("view_audit_log"),
    ADD_REACTIONS("add_reactions"),
    READ_MESSAGE_HISTORY("read_message_history"),
    MANAGE_MESSAGES("manage_messages"),
    ADMINISTRATOR("administrator");

    private final String wireName;

    PlatformCapability(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<PlatformCapability> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.wireName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
