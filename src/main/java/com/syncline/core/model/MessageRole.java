package com.syncline.core.model;

import java.util.Locale;

/**
 * Author of a message within a stream.
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM;

    /**
     * Parses a wire role. Unknown or missing roles are treated as {@link #ASSISTANT}.
     */
    public static MessageRole fromWire(String role) {
        if (role == null) {
            return ASSISTANT;
        }
        return switch (role.toLowerCase(Locale.ROOT)) {
            case "user" -> USER;
            case "system" -> SYSTEM;
            default -> ASSISTANT;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
