package com.example.pairprog.service;

import com.example.pairprog.config.CollabProperties;
import com.example.pairprog.message.ServerMessage;
import com.example.pairprog.model.RetainedRoom;
import com.example.pairprog.model.RoomSnapshot;
import com.example.pairprog.model.RoomState;
import com.example.pairprog.model.User;
import com.example.pairprog.session.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Owns room id -> live {@link RoomState}. Every mutation of a room runs while holding that
 * room's monitor; frames are queued inside the critical section and written after it.
 *
 * Rooms are created on first join (seeded from the retained cache) and retired when the last
 * connection leaves; a retired RoomState is never reused, joiners holding a stale reference retry.
 */
@Service
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentHashMap<String, RoomState> live = new ConcurrentHashMap<>();
    private final RetainedRoomCache retained;
    private final BroadcastDispatcher dispatcher;
    private final int chatHistoryLimit;

    @Autowired
    public RoomRegistry(RetainedRoomCache retained, BroadcastDispatcher dispatcher, CollabProperties props) {
        this(retained, dispatcher, props.getChatHistoryLimit());
    }

    public RoomRegistry(RetainedRoomCache retained, BroadcastDispatcher dispatcher, int chatHistoryLimit) {
        this.retained = Objects.requireNonNull(retained, "retained");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.chatHistoryLimit = chatHistoryLimit;
    }

    // ========================================================================
    //  JOIN / LEAVE
    // ========================================================================

    /**
     * Registers the connection, creates its user and cursor, queues the welcome {@code room_state}
     * for the joiner and {@code user_joined} for everybody else, all under the room lock.
     */
    public RoomSnapshot join(ClientConnection conn) {
        final String roomId = conn.getRoomId();
        while (true) {
            RoomState room = live.computeIfAbsent(roomId, this::openRoom);
            Set<ClientConnection> pending = new LinkedHashSet<>();
            RoomSnapshot snapshot;

            synchronized (room) {
                if (room.isRetired()) continue; // lost a race with the last leave; pick up the successor

                conn.attach(room); // throws if the connection closed before joining
                User user = User.joined(conn.getUserId(), conn.getUsername(), conn.getColor());
                room.addConnection(conn);
                room.putUser(user);

                snapshot = RoomSnapshot.of(room, conn.getUserId());
                pending.addAll(dispatcher.enqueueTo(conn, ServerMessage.roomState(snapshot)));
                pending.addAll(dispatcher.enqueue(room,
                        ServerMessage.userJoined(user, snapshot.activeUsers(), snapshot.users(), snapshot.cursors()),
                        conn));
            }

            dispatcher.flush(pending);
            log.info("ROOM JOIN room={} user={} active={}", roomId, conn.getUserId(), snapshot.activeUsers());
            return snapshot;
        }
    }

    /**
     * Removes the connection. Runs at most once per connection; later calls return empty.
     * Returns the display name of the leaving user when this call performed the leave.
     */
    public Optional<String> leave(ClientConnection conn) {
        if (!conn.markClosed()) return Optional.empty();

        RoomState room = conn.getRoom();
        if (room == null) return Optional.of(conn.getUsername()); // never got past CONNECTING

        Set<ClientConnection> pending = Set.of();
        String name = conn.getUsername();
        int remaining;

        synchronized (room) {
            room.removeConnection(conn);
            if (!room.isRetired()) {
                if (!room.hasOtherConnectionFor(conn.getUserId(), conn)) {
                    User removed = room.removeUser(conn.getUserId());
                    if (removed != null) name = removed.username();
                }
                remaining = room.connectionCount();
                if (room.isEmpty()) {
                    retireLocked(room);
                } else {
                    pending = dispatcher.enqueue(room,
                            ServerMessage.userLeft(conn.getUserId(), name, remaining), null);
                }
            } else {
                remaining = 0;
            }
        }

        dispatcher.flush(pending);
        log.info("ROOM LEAVE room={} user={} active={}", conn.getRoomId(), conn.getUserId(), remaining);
        return Optional.of(name);
    }

    /** Caller holds the room monitor. */
    private void retireLocked(RoomState room) {
        RetainedRoom keep = room.retire();
        retained.put(room.getRoomId(), keep);
        live.remove(room.getRoomId(), room);
        log.debug("ROOM RETIRE room={} (chat={} lines kept)", room.getRoomId(), keep.chatHistory().size());
    }

    private RoomState openRoom(String roomId) {
        RetainedRoom seed = retained.get(roomId).orElseGet(RetainedRoom::defaults);
        log.debug("ROOM OPEN room={} retained={}", roomId, retained.contains(roomId));
        return new RoomState(roomId, seed, chatHistoryLimit);
    }

    // ========================================================================
    //  MUTATIONS
    // ========================================================================

    /**
     * Runs {@code mutation} under the lock of the connection's room and flushes the connections it
     * returns after releasing the lock. Returns false (and does nothing) if the connection is not
     * joined, was evicted after a failed send, or its room was retired.
     */
    public boolean withRoom(ClientConnection conn, Function<RoomState, Set<ClientConnection>> mutation) {
        RoomState room = conn.getRoom();
        if (room == null) return false;

        Set<ClientConnection> pending;
        synchronized (room) {
            if (room.isRetired() || !conn.isJoined()) return false;
            pending = mutation.apply(room);
        }
        if (pending != null && !pending.isEmpty()) dispatcher.flush(pending);
        return true;
    }

    /**
     * Seeds the retained cache from the durable store unless the room is hot or already cached.
     * Returns true if the seed was stored.
     */
    public boolean primeIfAbsent(String roomId, String code, String language) {
        if (live.containsKey(roomId)) return false;
        return retained.putIfAbsent(roomId, RetainedRoom.primed(code, language));
    }

    // ========================================================================
    //  QUERIES
    // ========================================================================

    public int currentUserCount(String roomId) {
        RoomState room = (roomId == null) ? null : live.get(roomId);
        if (room == null) return 0;
        synchronized (room) {
            return room.isRetired() ? 0 : room.connectionCount();
        }
    }

    boolean isHot(String roomId) {
        return roomId != null && live.containsKey(roomId);
    }

    /** Current buffer and language: live state when hot, else retained, else empty. */
    Optional<RetainedRoom> cachedContent(String roomId) {
        RoomState room = (roomId == null) ? null : live.get(roomId);
        if (room != null) {
            synchronized (room) {
                if (!room.isRetired()) {
                    return Optional.of(new RetainedRoom(room.getCode(), room.getLanguage(), room.getChatHistory()));
                }
            }
        }
        return retained.get(roomId);
    }

    public int hotRoomCount() {
        return live.size();
    }
}
