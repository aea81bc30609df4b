package com.example.pairprog.persistence;

import com.example.pairprog.model.PersistentRoom;

import java.util.List;
import java.util.Optional;

/**
 * Port for the durable room store. Rooms are created here before anybody can join them;
 * the live registry only mirrors code, language and the active-user counter back.
 */
public interface PersistentRooms {

    /** Creates a room with the starter buffer for {@code language} (python when null/blank). */
    PersistentRoom create(String language);

    Optional<PersistentRoom> get(String id);

    /** Rooms ordered newest first. */
    List<PersistentRoom> list();

    /** No-op for unknown ids. */
    void updateCode(String id, String code);

    /** No-op for unknown ids. */
    void updateLanguage(String id, String language);

    /** Adds {@code delta} to the active-user counter, clamped at 0. No-op for unknown ids. */
    void updateActiveUsers(String id, int delta);
}
