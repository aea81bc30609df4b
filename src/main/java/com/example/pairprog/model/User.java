package com.example.pairprog.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Presence entry for one user in a hot room.
 * Immutable: updates replace the entry in RoomState, so snapshots can share instances.
 */
public record User(String id, String username, String color, boolean typing, Instant lastActive) {

    public User {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(color, "color");
        if (lastActive == null) lastActive = Instant.now();
    }

    public static User joined(String id, String username, String color) {
        return new User(id, username, color, false, Instant.now());
    }

    public User withTyping(boolean nowTyping) {
        return new User(id, username, color, nowTyping, lastActive);
    }

    public User touched() {
        return new User(id, username, color, typing, Instant.now());
    }
}
