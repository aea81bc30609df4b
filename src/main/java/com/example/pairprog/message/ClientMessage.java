package com.example.pairprog.message;

import com.example.pairprog.model.CursorState;
import com.example.pairprog.session.ClientConnection;

/**
 * Decoded inbound frame. Each kind is one record; {@link Handler} has one method per kind,
 * so adding a kind does not compile until every handler covers it.
 */
public sealed interface ClientMessage {

    MessageType type();

    void dispatch(Handler handler, ClientConnection from);

    interface Handler {
        void onCodeUpdate(ClientConnection from, CodeUpdate message);
        void onCursorUpdate(ClientConnection from, CursorUpdate message);
        void onChatMessage(ClientConnection from, ChatSend message);
        void onTypingStart(ClientConnection from);
        void onTypingStop(ClientConnection from);
        void onLanguageChange(ClientConnection from, LanguageChange message);
        void onPing(ClientConnection from);
    }

    record CodeUpdate(String code, int cursorPosition) implements ClientMessage {
        @Override public MessageType type() { return MessageType.CODE_UPDATE; }
        @Override public void dispatch(Handler h, ClientConnection from) { h.onCodeUpdate(from, this); }
    }

    record CursorUpdate(int cursorPosition, CursorState.Selection selection) implements ClientMessage {
        @Override public MessageType type() { return MessageType.CURSOR_UPDATE; }
        @Override public void dispatch(Handler h, ClientConnection from) { h.onCursorUpdate(from, this); }
    }

    /** Content may be blank; blank messages are dropped by the router. */
    record ChatSend(String content, String messageType) implements ClientMessage {
        @Override public MessageType type() { return MessageType.CHAT_MESSAGE; }
        @Override public void dispatch(Handler h, ClientConnection from) { h.onChatMessage(from, this); }
    }

    record TypingStart() implements ClientMessage {
        @Override public MessageType type() { return MessageType.TYPING_START; }
        @Override public void dispatch(Handler h, ClientConnection from) { h.onTypingStart(from); }
    }

    record TypingStop() implements ClientMessage {
        @Override public MessageType type() { return MessageType.TYPING_STOP; }
        @Override public void dispatch(Handler h, ClientConnection from) { h.onTypingStop(from); }
    }

    record LanguageChange(String language) implements ClientMessage {
        @Override public MessageType type() { return MessageType.LANGUAGE_CHANGE; }
        @Override public void dispatch(Handler h, ClientConnection from) { h.onLanguageChange(from, this); }
    }

    record Ping() implements ClientMessage {
        @Override public MessageType type() { return MessageType.PING; }
        @Override public void dispatch(Handler h, ClientConnection from) { h.onPing(from); }
    }
}
