package com.example.pairprog.service;

import com.example.pairprog.message.ClientMessage;
import com.example.pairprog.message.ClientMessageCodec;
import com.example.pairprog.message.ProtocolException;
import com.example.pairprog.message.ServerMessage;
import com.example.pairprog.model.ChatMessage;
import com.example.pairprog.model.RoomSnapshot;
import com.example.pairprog.model.User;
import com.example.pairprog.session.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;

/**
 * Connection lifecycle and inbound frame handling for one room member.
 *
 * - connect: durable counter +1, join (welcome + user_joined)
 * - frames: decode, mutate under the room lock, fan out, mirror to the store
 * - disconnect: leave exactly once, durable counter -1 exactly once
 */
@Service
public class MessageRouter implements ClientMessage.Handler {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final RoomRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final ClientMessageCodec codec;
    private final PersistenceBridge persistence;

    public MessageRouter(RoomRegistry registry,
                         BroadcastDispatcher dispatcher,
                         ClientMessageCodec codec,
                         PersistenceBridge persistence) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.codec = codec;
        this.persistence = persistence;
    }

    /* ---------------- lifecycle ---------------- */

    public RoomSnapshot connect(ClientConnection conn) {
        persistence.adjustActiveUsers(conn.getRoomId(), +1);
        try {
            return registry.join(conn);
        } catch (RuntimeException e) {
            // the join never happened; give the increment back through the normal leave path
            disconnect(conn);
            throw e;
        }
    }

    /** Safe to call more than once; only the first call has any effect. */
    public void disconnect(ClientConnection conn) {
        Optional<String> left = registry.leave(conn);
        if (left.isPresent()) {
            persistence.adjustActiveUsers(conn.getRoomId(), -1);
            log.debug("Disconnect handled (room={}, user={}, name={})", conn.getRoomId(), conn.getUserId(), left.get());
        }
    }

    /** Decodes and dispatches one text frame. Protocol problems are answered with an error frame. */
    public void handleFrame(ClientConnection from, String text) {
        ClientMessage message;
        try {
            message = codec.decode(text);
        } catch (ProtocolException e) {
            log.debug("Rejected frame (room={}, user={}): {}", from.getRoomId(), from.getUserId(), e.getMessage());
            dispatcher.sendTo(from, ServerMessage.error(e.getMessage()));
            return;
        }
        message.dispatch(this, from);
    }

    /* ---------------- kinds ---------------- */

    @Override
    public void onCodeUpdate(ClientConnection from, ClientMessage.CodeUpdate m) {
        boolean applied = registry.withRoom(from, room -> {
            room.setCode(m.code());
            room.moveCursor(from.getUserId(), m.cursorPosition(), null);
            room.touchUser(from.getUserId());
            return dispatcher.enqueue(room,
                    ServerMessage.codeUpdate(m.code(), m.cursorPosition(), from.getUserId(), nameOf(room.getUser(from.getUserId()), from)),
                    from);
        });
        if (applied) persistence.persistCode(from.getRoomId(), m.code());
    }

    @Override
    public void onCursorUpdate(ClientConnection from, ClientMessage.CursorUpdate m) {
        registry.withRoom(from, room -> {
            room.moveCursor(from.getUserId(), m.cursorPosition(), m.selection());
            return dispatcher.enqueue(room,
                    ServerMessage.cursorUpdate(from.getUserId(), nameOf(room.getUser(from.getUserId()), from),
                            m.cursorPosition(), m.selection()),
                    from);
        });
    }

    @Override
    public void onChatMessage(ClientConnection from, ClientMessage.ChatSend m) {
        if (m.content() == null || m.content().isBlank()) return;
        registry.withRoom(from, room -> {
            ChatMessage chat = ChatMessage.create(from.getUserId(),
                    nameOf(room.getUser(from.getUserId()), from), m.content(), m.messageType());
            room.appendChat(chat);
            return dispatcher.enqueue(room, ServerMessage.chatMessage(chat), null);
        });
    }

    @Override
    public void onTypingStart(ClientConnection from) {
        typing(from, true);
    }

    @Override
    public void onTypingStop(ClientConnection from) {
        typing(from, false);
    }

    private void typing(ClientConnection from, boolean started) {
        registry.withRoom(from, room -> {
            room.setTyping(from.getUserId(), started);
            return dispatcher.enqueue(room,
                    ServerMessage.typing(started, from.getUserId(), nameOf(room.getUser(from.getUserId()), from)),
                    from);
        });
    }

    @Override
    public void onLanguageChange(ClientConnection from, ClientMessage.LanguageChange m) {
        boolean applied = registry.withRoom(from, room -> {
            room.setLanguage(m.language());
            return dispatcher.enqueue(room,
                    ServerMessage.languageChange(m.language(), from.getUserId(), nameOf(room.getUser(from.getUserId()), from)),
                    null);
        });
        if (applied) persistence.persistLanguage(from.getRoomId(), m.language());
    }

    @Override
    public void onPing(ClientConnection from) {
        registry.withRoom(from, room -> {
            room.touchUser(from.getUserId());
            return Set.of();
        });
        dispatcher.sendTo(from, ServerMessage.pong());
    }

    private static String nameOf(User user, ClientConnection from) {
        return (user != null) ? user.username() : from.getUsername();
    }
}
