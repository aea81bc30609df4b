package com.example.pairprog.session;

import com.example.pairprog.model.RoomState;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One client's binding to a room and user identity.
 *
 * Outbound frames are appended to a FIFO queue (cheap, safe while a room lock is held) and
 * written to the socket by {@link #flush()}, which only one thread runs at a time. The socket is
 * wrapped in a {@link ConcurrentWebSocketSessionDecorator}; a flush that finds another thread
 * stuck in a send longer than the send time limit, or more queued bytes than the buffer limit,
 * gives up on the connection.
 */
public class ClientConnection {

    public enum State { CONNECTING, JOINED, CLOSED }

    public static final int DEFAULT_SEND_TIME_LIMIT_MS = 10_000;
    public static final int DEFAULT_BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ConcurrentWebSocketSessionDecorator session;
    private final String roomId;
    private final String userId;
    private final String username;
    private final String color;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    private final Queue<TextMessage> outbox = new ConcurrentLinkedQueue<>();
    private final AtomicLong queuedBytes = new AtomicLong();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);

    private volatile RoomState room;
    private volatile boolean broken = false;

    public ClientConnection(WebSocketSession session, String roomId, String userId, String username, String color) {
        this(session, roomId, userId, username, color, DEFAULT_SEND_TIME_LIMIT_MS, DEFAULT_BUFFER_SIZE_LIMIT);
    }

    public ClientConnection(WebSocketSession session, String roomId, String userId, String username, String color,
                            int sendTimeLimitMs, int bufferSizeLimit) {
        Objects.requireNonNull(session, "session");
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.username = Objects.requireNonNull(username, "username");
        this.color = Objects.requireNonNull(color, "color");
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    // identity
    public String getSessionId() { return session.getId(); }
    public String getRoomId() { return roomId; }
    public String getUserId() { return userId; }
    public String getUsername() { return username; }
    public String getColor() { return color; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    public State getState() { return state.get(); }

    /** Joined and still receiving frames. */
    public boolean isJoined() { return state.get() == State.JOINED && !broken; }

    /** Room this connection joined; null until joined. */
    public RoomState getRoom() { return room; }

    /** CONNECTING -> JOINED. Called by the registry while holding the room lock. */
    public void attach(RoomState joinedRoom) {
        if (!state.compareAndSet(State.CONNECTING, State.JOINED)) {
            throw new IllegalStateException("connection " + getSessionId() + " is " + state.get());
        }
        this.room = joinedRoom;
    }

    /**
     * Moves to CLOSED. Returns true only for the first caller, so the leave sequence runs
     * exactly once however the disconnect was detected.
     */
    public boolean markClosed() {
        State prev = state.getAndSet(State.CLOSED);
        return prev != State.CLOSED;
    }

    /** Closes the socket; the container's close callback then runs the leave. */
    public void close(CloseStatus status) throws IOException {
        session.close(status);
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    public boolean isBroken() { return broken; }

    /** Appends a frame to the outbound queue. Returns false if the connection is already broken. */
    public boolean enqueue(TextMessage message) {
        if (broken) return false;
        queuedBytes.addAndGet(message.getPayloadLength());
        outbox.add(message);
        return true;
    }

    /**
     * Writes queued frames in order. If another thread is already flushing this connection,
     * returns immediately and leaves the queue to that thread, unless that thread has been stuck
     * in one send past the time limit or the queue has outgrown the buffer limit.
     */
    public void flush() throws IOException {
        while (!outbox.isEmpty() && !broken) {
            if (!flushLock.tryLock()) {
                checkLimits();
                return;
            }
            try {
                TextMessage next;
                while ((next = outbox.poll()) != null) {
                    queuedBytes.addAndGet(-next.getPayloadLength());
                    if (!session.isOpen()) throw new IOException("session " + session.getId() + " is closed");
                    session.sendMessage(next);
                }
            } catch (IOException e) {
                markBroken();
                throw e;
            } catch (RuntimeException e) {
                markBroken();
                throw new IOException("send failed on session " + session.getId(), e);
            } finally {
                flushLock.unlock();
            }
        }
    }

    private void checkLimits() throws IOException {
        long stuckMs = session.getTimeSinceSendStarted();
        if (stuckMs > sendTimeLimitMs) {
            markBroken();
            throw new IOException("send on session " + session.getId() + " stuck for " + stuckMs + " ms");
        }
        long queued = queuedBytes.get();
        if (queued > bufferSizeLimit) {
            markBroken();
            throw new IOException("session " + session.getId() + " has " + queued + " bytes queued");
        }
    }

    private void markBroken() {
        broken = true;
        outbox.clear();
        queuedBytes.set(0);
    }

    @Override
    public String toString() {
        return "ClientConnection{" +
                "sid='" + getSessionId() + '\'' +
                ", room='" + roomId + '\'' +
                ", userId='" + userId + '\'' +
                ", username='" + username + '\'' +
                ", state=" + state.get() +
                '}';
    }
}
