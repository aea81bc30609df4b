package com.example.pairprog.service;

import com.example.pairprog.model.RetainedRoom;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Room id -> buffer, language and chat kept after a room empties, for fast reconnection.
 * Entries are never evicted, so memory grows with the number of distinct rooms ever opened.
 */
@Component
public class RetainedRoomCache {

    private final ConcurrentHashMap<String, RetainedRoom> entries = new ConcurrentHashMap<>();

    public Optional<RetainedRoom> get(String roomId) {
        if (roomId == null) return Optional.empty();
        return Optional.ofNullable(entries.get(roomId));
    }

    public void put(String roomId, RetainedRoom room) {
        entries.put(roomId, room);
    }

    /** Stores {@code room} only if nothing is cached for the id yet. Returns true if stored. */
    public boolean putIfAbsent(String roomId, RetainedRoom room) {
        return entries.putIfAbsent(roomId, room) == null;
    }

    public boolean contains(String roomId) {
        return roomId != null && entries.containsKey(roomId);
    }

    public int size() {
        return entries.size();
    }
}
