package com.example.pairprog.model;

import java.util.List;
import java.util.Map;

/** Point-in-time read of a room, taken under the room lock for a newly joined session. */
public record RoomSnapshot(
        String roomId,
        String userId,
        String code,
        String language,
        int activeUsers,
        Map<String, User> users,
        Map<String, CursorState> cursors,
        List<ChatMessage> chatHistory
) {
    /** Caller must hold the room's monitor. */
    public static RoomSnapshot of(RoomState room, String forUserId) {
        return new RoomSnapshot(
                room.getRoomId(),
                forUserId,
                room.getCode(),
                room.getLanguage(),
                room.connectionCount(),
                room.getUsers(),
                room.getCursors(),
                room.getChatHistory());
    }
}
