package com.example.pairprog.model;

import java.util.List;

/** Buffer, language and chat kept for a room after its last connection leaves. */
public record RetainedRoom(String code, String language, List<ChatMessage> chatHistory) {

    public static final String DEFAULT_CODE = "# Welcome to Pair Programming!\n# Start coding together...\n\n";
    public static final String DEFAULT_LANGUAGE = "python";

    public RetainedRoom {
        code = (code == null) ? DEFAULT_CODE : code;
        language = (language == null || language.isBlank()) ? DEFAULT_LANGUAGE : language;
        chatHistory = (chatHistory == null) ? List.of() : List.copyOf(chatHistory);
    }

    public static RetainedRoom defaults() {
        return new RetainedRoom(DEFAULT_CODE, DEFAULT_LANGUAGE, List.of());
    }

    public static RetainedRoom primed(String code, String language) {
        return new RetainedRoom(code, language, List.of());
    }
}
