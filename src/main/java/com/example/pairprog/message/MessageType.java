package com.example.pairprog.message;

import java.util.Optional;

/** Inbound frame kinds, by wire name. */
public enum MessageType {
    CODE_UPDATE("code_update"),
    CURSOR_UPDATE("cursor_update"),
    CHAT_MESSAGE("chat_message"),
    TYPING_START("typing_start"),
    TYPING_STOP("typing_stop"),
    LANGUAGE_CHANGE("language_change"),
    PING("ping");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public static Optional<MessageType> fromWire(String name) {
        if (name == null) return Optional.empty();
        for (MessageType t : values()) {
            if (t.wireName.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
