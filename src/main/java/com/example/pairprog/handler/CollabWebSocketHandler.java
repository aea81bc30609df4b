package com.example.pairprog.handler;

import com.example.pairprog.config.CollabProperties;
import com.example.pairprog.message.ClientMessageCodec;
import com.example.pairprog.message.ServerMessage;
import com.example.pairprog.service.MessageRouter;
import com.example.pairprog.service.PersistenceBridge;
import com.example.pairprog.service.UserColors;
import com.example.pairprog.session.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * WebSocket handler for /ws/{roomId}?username=..&userId=..
 * - Rejects rooms unknown to the durable store (error frame, close 4004)
 * - Joins the live room; the registry sends room_state to the joiner and user_joined to the rest
 * - Routes JSON frames to {@link MessageRouter}
 * - On close: leave + user_left, exactly once
 */
@Component
public class CollabWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(CollabWebSocketHandler.class);

    public static final CloseStatus ROOM_NOT_FOUND = new CloseStatus(4004, "Room not found");

    private final MessageRouter router;
    private final PersistenceBridge persistence;
    private final ClientMessageCodec codec;
    private final CollabProperties props;

    /** Per WebSocket session id → connection */
    private final Map<String, ClientConnection> bySession = new ConcurrentHashMap<>();

    public CollabWebSocketHandler(MessageRouter router, PersistenceBridge persistence,
                                  ClientMessageCodec codec, CollabProperties props) {
        this.router = router;
        this.persistence = persistence;
        this.codec = codec;
        this.props = props;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        final String roomId = roomIdFrom(session.getUri());
        Map<String, String> q = parseQuery(session.getUri());
        final String userId = nonBlank(q.get("userId"), () -> UUID.randomUUID().toString().substring(0, 8));
        final String username = nonBlank(q.get("username"), () -> "User_" + userId.substring(0, Math.min(4, userId.length())));

        log.info("WS OPEN room={} user={} name={} sid={}", roomId, userId, username, session.getId());

        if (roomId == null || persistence.loadForJoin(roomId).isEmpty()) {
            log.warn("WS REJECT room={} sid={} : room not found", roomId, session.getId());
            rejectAndClose(session, "Room not found");
            return;
        }

        ClientConnection conn = new ClientConnection(session, roomId, userId, username, UserColors.forUser(userId),
                props.getSendTimeLimitMs(), props.getSendBufferSizeLimit());
        bySession.put(session.getId(), conn);
        try {
            router.connect(conn);
        } catch (RuntimeException e) {
            bySession.remove(session.getId());
            if (conn.getState() == ClientConnection.State.CLOSED && !session.isOpen()) {
                log.debug("WS join abandoned, session already closed (room={}, sid={})", roomId, session.getId());
                return;
            }
            log.error("WS join failed (room={}, user={}, sid={})", roomId, userId, session.getId(), e);
            try { session.close(CloseStatus.SERVER_ERROR); } catch (Exception ce) { log.debug("close after failed join: {}", ce.toString()); }
            throw e;
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        ClientConnection conn = bySession.get(session.getId());
        if (conn == null) {
            log.warn("WS message from unknown session sid={}", session.getId());
            return;
        }
        try {
            router.handleFrame(conn, message.getPayload());
        } catch (RuntimeException e) {
            log.error("WS frame handling failed (room={}, user={}, sid={})",
                    conn.getRoomId(), conn.getUserId(), session.getId(), e);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        ClientConnection conn = bySession.get(session.getId());
        log.warn("WS ERROR sid={} room={} : {}", session.getId(),
                conn == null ? "n/a" : conn.getRoomId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        ClientConnection conn = bySession.remove(session.getId());
        if (conn == null) {
            log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
            return;
        }
        log.info("WS CLOSE room={} user={} code={} reason={}",
                conn.getRoomId(), conn.getUserId(), status.getCode(), status.getReason());
        try {
            router.disconnect(conn);
        } catch (RuntimeException e) {
            log.error("WS disconnect handling failed (room={}, user={})", conn.getRoomId(), conn.getUserId(), e);
        }
    }

    /** Number of sessions currently bound to a room connection. */
    public int openConnections() {
        return bySession.size();
    }

    /* ---------------- helpers ---------------- */

    private void rejectAndClose(WebSocketSession session, String reason) {
        try {
            if (session.isOpen()) {
                session.sendMessage(new TextMessage(codec.encode(ServerMessage.error(reason))));
            }
        } catch (Exception e) {
            log.debug("WS REJECT error frame not delivered (sid={}): {}", session.getId(), e.toString());
        }
        try {
            session.close(ROOM_NOT_FOUND);
        } catch (Exception e) {
            log.debug("WS REJECT close failed (sid={}): {}", session.getId(), e.toString());
        }
    }

    /** Last non-empty path segment, e.g. {@code /ws/abc} → {@code abc}. */
    static String roomIdFrom(URI uri) {
        if (uri == null || uri.getPath() == null) return null;
        String path = uri.getPath();
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        int i = path.lastIndexOf('/');
        String id = path.substring(i + 1).trim();
        return (id.isEmpty() || "ws".equals(id)) ? null : id;
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new HashMap<>();
        if (uri == null || uri.getRawQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    private static String nonBlank(String value, Supplier<String> fallback) {
        return (value == null || value.isBlank()) ? fallback.get() : value.trim();
    }
}
