package com.example.pairprog.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/** Immutable chat line kept in a room's bounded history. */
public record ChatMessage(String id, String userId, String username, String content, String type, Instant timestamp) {

    public static final String TYPE_MESSAGE = "message";
    public static final String TYPE_SYSTEM = "system";

    public ChatMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
        type = normalizeType(type);
    }

    public static ChatMessage create(String userId, String username, String content, String type) {
        return new ChatMessage(UUID.randomUUID().toString(), userId, username, content, type, Instant.now());
    }

    private static String normalizeType(String raw) {
        if (raw == null) return TYPE_MESSAGE;
        String t = raw.trim().toLowerCase(Locale.ROOT);
        return TYPE_SYSTEM.equals(t) ? TYPE_SYSTEM : TYPE_MESSAGE;
    }
}
