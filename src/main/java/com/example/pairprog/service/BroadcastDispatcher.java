package com.example.pairprog.service;

import com.example.pairprog.message.ClientMessageCodec;
import com.example.pairprog.message.ServerMessage;
import com.example.pairprog.model.RoomState;
import com.example.pairprog.session.ClientConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out of server frames to the connections of a room.
 *
 * Two phases: {@link #enqueue} runs while the caller holds the room monitor and only appends to
 * per-connection queues; {@link #flush} runs after the monitor is released and hands each
 * connection to the sender pool, so a stalled socket only ever holds a pool thread. A recipient
 * whose write fails is dropped from the room's connections and its socket is closed; the
 * container's close callback takes care of the user-visible leave.
 */
@Service
public class BroadcastDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final ClientMessageCodec codec;
    private final Executor sender;
    private final ExecutorService ownedPool;

    @Autowired
    public BroadcastDispatcher(ClientMessageCodec codec) {
        this(codec, null, Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "ws-sender-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        }));
    }

    /** {@code sender} runs the socket writes; a direct executor makes flushes synchronous. */
    public BroadcastDispatcher(ClientMessageCodec codec, Executor sender) {
        this(codec, sender, null);
    }

    private BroadcastDispatcher(ClientMessageCodec codec, Executor sender, ExecutorService ownedPool) {
        this.codec = codec;
        this.sender = (sender != null) ? sender : ownedPool;
        this.ownedPool = ownedPool;
    }

    /**
     * Queues {@code message} for every connection in the room except {@code exclude} (may be null).
     * Caller must hold the room's monitor. Returns the connections to flush.
     */
    public Set<ClientConnection> enqueue(RoomState room, ServerMessage message, ClientConnection exclude) {
        Set<ClientConnection> touched = new LinkedHashSet<>();
        TextMessage frame = frame(message);
        if (frame == null) return touched;
        for (ClientConnection c : room.getConnections()) {
            if (c == exclude) continue;
            if (c.enqueue(frame)) touched.add(c);
        }
        return touched;
    }

    /** Queues {@code message} for a single connection. Returns the connection if it needs a flush. */
    public Set<ClientConnection> enqueueTo(ClientConnection target, ServerMessage message) {
        TextMessage frame = frame(message);
        if (frame == null || !target.enqueue(frame)) return Set.of();
        return Set.of(target);
    }

    /** Queues and writes immediately. Must not be called while holding a room monitor. */
    public void sendTo(ClientConnection target, ServerMessage message) {
        flush(enqueueTo(target, message));
    }

    /** Hands each connection to the sender pool. Must not be called while holding a room monitor. */
    public void flush(Collection<ClientConnection> connections) {
        for (ClientConnection c : connections) {
            try {
                sender.execute(() -> flushOne(c));
            } catch (RejectedExecutionException e) {
                log.debug("WS SEND skipped, sender pool stopped (sid={})", c.getSessionId());
            }
        }
    }

    private void flushOne(ClientConnection c) {
        try {
            c.flush();
        } catch (IOException e) {
            log.warn("WS SEND failed (room={}, user={}, sid={}): {}",
                    c.getRoomId(), c.getUserId(), c.getSessionId(), e.toString());
            evict(c);
        }
    }

    /**
     * Lazy disconnect: removes a broken connection from its room's recipients and closes its
     * socket. User, cursor and user_left are handled by the leave the close callback triggers.
     */
    private void evict(ClientConnection c) {
        RoomState room = c.getRoom();
        if (room != null) {
            synchronized (room) {
                if (room.removeConnection(c)) {
                    log.debug("WS EVICT room={} user={} sid={}", c.getRoomId(), c.getUserId(), c.getSessionId());
                }
            }
        }
        try {
            c.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException | RuntimeException e) {
            log.debug("WS EVICT close failed (sid={}): {}", c.getSessionId(), e.toString());
        }
    }

    @PreDestroy
    public void shutdown() {
        if (ownedPool != null) ownedPool.shutdownNow();
    }

    private TextMessage frame(ServerMessage message) {
        try {
            return new TextMessage(codec.encode(message));
        } catch (JsonProcessingException e) {
            log.error("Could not encode {} frame", message.type(), e);
            return null;
        }
    }
}
