package com.example.pairprog.model;

import com.example.pairprog.session.ClientConnection;

import java.util.*;

/**
 * Live collaboration state of one hot room: connections, buffer, presence, cursors, chat and typing.
 * RoomRegistry synchronizes on RoomState instances, so this class itself does not add extra locking.
 */
public class RoomState {

    public static final int DEFAULT_CHAT_HISTORY_LIMIT = 50;

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String roomId;
    private final int chatHistoryLimit;

    /** Set once the room emptied and its cached fields moved to the retained cache. */
    private boolean retired = false;

    // ---------------------------------------------------------------------
    // Shared buffer
    // ---------------------------------------------------------------------

    private String code;
    private String language;

    // ---------------------------------------------------------------------
    // Presence
    // ---------------------------------------------------------------------

    private final Set<ClientConnection> connections = new LinkedHashSet<>();
    private final Map<String, User> users = new LinkedHashMap<>();
    private final Map<String, CursorState> cursors = new LinkedHashMap<>();
    private final Set<String> typingUsers = new LinkedHashSet<>();

    // ---------------------------------------------------------------------
    // Chat (bounded FIFO, oldest evicted first)
    // ---------------------------------------------------------------------

    private final Deque<ChatMessage> chatHistory = new ArrayDeque<>();

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public RoomState(String roomId, RetainedRoom seed, int chatHistoryLimit) {
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.chatHistoryLimit = Math.max(1, chatHistoryLimit);
        RetainedRoom s = (seed != null) ? seed : RetainedRoom.defaults();
        this.code = s.code();
        this.language = s.language();
        for (ChatMessage m : s.chatHistory()) appendChat(m);
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getRoomId() { return roomId; }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = (code == null) ? "" : code; }

    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }

    public boolean isRetired() { return retired; }

    /** Marks the room retired and returns what should survive in the retained cache. */
    public RetainedRoom retire() {
        retired = true;
        users.clear();
        cursors.clear();
        typingUsers.clear();
        return new RetainedRoom(code, language, new ArrayList<>(chatHistory));
    }

    // ---------------------------------------------------------------------
    // Connections
    // ---------------------------------------------------------------------

    public void addConnection(ClientConnection c) { connections.add(c); }

    public boolean removeConnection(ClientConnection c) { return connections.remove(c); }

    public boolean hasConnection(ClientConnection c) { return connections.contains(c); }

    /** Snapshot of the current connections. */
    public List<ClientConnection> getConnections() { return new ArrayList<>(connections); }

    public int connectionCount() { return connections.size(); }

    public boolean isEmpty() { return connections.isEmpty(); }

    /** True if some connection other than {@code except} is bound to this user id. */
    public boolean hasOtherConnectionFor(String userId, ClientConnection except) {
        for (ClientConnection c : connections) {
            if (c != except && c.getUserId().equals(userId)) return true;
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Users & cursors
    // ---------------------------------------------------------------------

    /** Adds (or replaces) a user with a fresh cursor at position 0. */
    public void putUser(User user) {
        users.put(user.id(), user);
        cursors.put(user.id(), CursorState.initial(user));
    }

    public User getUser(String userId) { return users.get(userId); }

    /** Removes the user, their cursor and typing flag. Returns the removed user or null. */
    public User removeUser(String userId) {
        cursors.remove(userId);
        typingUsers.remove(userId);
        return users.remove(userId);
    }

    public Map<String, User> getUsers() { return new LinkedHashMap<>(users); }

    public Map<String, CursorState> getCursors() { return new LinkedHashMap<>(cursors); }

    public CursorState getCursor(String userId) { return cursors.get(userId); }

    /** Overwrites the user's cursor; denormalized name/color come from the user entry. */
    public CursorState moveCursor(String userId, int position, CursorState.Selection selection) {
        CursorState cur = cursors.get(userId);
        if (cur == null) {
            User u = users.get(userId);
            if (u == null) return null;
            cur = CursorState.initial(u);
        }
        CursorState next = cur.moveTo(position, selection);
        cursors.put(userId, next);
        return next;
    }

    public void touchUser(String userId) {
        users.computeIfPresent(userId, (id, u) -> u.touched());
    }

    // ---------------------------------------------------------------------
    // Typing
    // ---------------------------------------------------------------------

    public void setTyping(String userId, boolean typing) {
        if (typing) typingUsers.add(userId);
        else typingUsers.remove(userId);
        users.computeIfPresent(userId, (id, u) -> u.withTyping(typing));
    }

    public Set<String> getTypingUsers() { return new LinkedHashSet<>(typingUsers); }

    // ---------------------------------------------------------------------
    // Chat
    // ---------------------------------------------------------------------

    /** Appends a message and evicts the oldest entries beyond the limit. */
    public void appendChat(ChatMessage message) {
        chatHistory.addLast(Objects.requireNonNull(message, "message"));
        while (chatHistory.size() > chatHistoryLimit) chatHistory.removeFirst();
    }

    public List<ChatMessage> getChatHistory() { return new ArrayList<>(chatHistory); }

    public int getChatHistoryLimit() { return chatHistoryLimit; }
}
