package com.zzf.eventsync.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown or missing roles fall back to {@link #ASSISTANT}.
     */
    public static MessageRole parse(String raw) {
        if (raw == null) {
            return ASSISTANT;
        }
        return switch (raw) {
            case "user" -> USER;
            case "system" -> SYSTEM;
            default -> ASSISTANT;
        };
    }
}
