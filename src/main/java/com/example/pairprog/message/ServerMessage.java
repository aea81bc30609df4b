package com.example.pairprog.message;

import com.example.pairprog.model.ChatMessage;
import com.example.pairprog.model.CursorState;
import com.example.pairprog.model.RoomSnapshot;
import com.example.pairprog.model.User;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Outbound frame: {@code {"type": ..., "payload": {...}}}. */
public record ServerMessage(String type, Map<String, Object> payload) {

    public static ServerMessage roomState(RoomSnapshot s) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("code", s.code());
        p.put("language", s.language());
        p.put("activeUsers", s.activeUsers());
        p.put("users", usersView(s.users()));
        p.put("cursors", cursorsView(s.cursors()));
        p.put("userId", s.userId());
        List<Map<String, Object>> chat = new ArrayList<>();
        for (ChatMessage m : s.chatHistory()) chat.add(chatView(m));
        p.put("chatHistory", chat);
        return new ServerMessage("room_state", p);
    }

    public static ServerMessage userJoined(User user, int activeUsers,
                                           Map<String, User> users, Map<String, CursorState> cursors) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("userId", user.id());
        p.put("username", user.username());
        p.put("color", user.color());
        p.put("activeUsers", activeUsers);
        p.put("users", usersView(users));
        p.put("cursors", cursorsView(cursors));
        return new ServerMessage("user_joined", p);
    }

    public static ServerMessage userLeft(String userId, String username, int activeUsers) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("userId", userId);
        p.put("username", username);
        p.put("activeUsers", activeUsers);
        return new ServerMessage("user_left", p);
    }

    public static ServerMessage codeUpdate(String code, int cursorPosition, String userId, String username) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("code", code);
        p.put("cursorPosition", cursorPosition);
        p.put("userId", userId);
        p.put("username", username);
        p.put("timestamp", Instant.now().toString());
        return new ServerMessage("code_update", p);
    }

    public static ServerMessage cursorUpdate(String userId, String username, int cursorPosition,
                                             CursorState.Selection selection) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("userId", userId);
        p.put("username", username);
        p.put("cursorPosition", cursorPosition);
        p.put("selection", selectionView(selection));
        return new ServerMessage("cursor_update", p);
    }

    public static ServerMessage chatMessage(ChatMessage message) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("message", chatView(message));
        return new ServerMessage("chat_message", p);
    }

    public static ServerMessage typing(boolean started, String userId, String username) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("userId", userId);
        p.put("username", username);
        return new ServerMessage(started ? "typing_start" : "typing_stop", p);
    }

    public static ServerMessage languageChange(String language, String userId, String username) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("language", language);
        p.put("userId", userId);
        p.put("username", username);
        return new ServerMessage("language_change", p);
    }

    public static ServerMessage pong() {
        return new ServerMessage("pong", Map.of());
    }

    public static ServerMessage error(String message) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("message", message);
        return new ServerMessage("error", p);
    }

    // ---------------------------------------------------------------------
    // Views (plain maps so Jackson needs no extra modules)
    // ---------------------------------------------------------------------

    private static Map<String, Object> usersView(Map<String, User> users) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (User u : users.values()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", u.id());
            m.put("username", u.username());
            m.put("color", u.color());
            m.put("isTyping", u.typing());
            m.put("lastActive", u.lastActive().toString());
            out.put(u.id(), m);
        }
        return out;
    }

    private static Map<String, Object> cursorsView(Map<String, CursorState> cursors) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, CursorState> e : cursors.entrySet()) {
            CursorState c = e.getValue();
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("position", c.position());
            m.put("selection", selectionView(c.selection()));
            m.put("username", c.username());
            m.put("color", c.color());
            out.put(e.getKey(), m);
        }
        return out;
    }

    private static Map<String, Object> selectionView(CursorState.Selection s) {
        if (s == null) return null;
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("start", s.start());
        m.put("end", s.end());
        return m;
    }

    static Map<String, Object> chatView(ChatMessage msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", msg.id());
        m.put("userId", msg.userId());
        m.put("username", msg.username());
        m.put("content", msg.content());
        m.put("timestamp", msg.timestamp().toString());
        m.put("type", msg.type());
        return m;
    }
}
