package com.example.pairprog.service;

import java.util.List;

/** Deterministic user id -> display color. */
public final class UserColors {
    private UserColors() {}

    public static final List<String> PALETTE = List.of(
            "#ff6b6b", "#4ecdc4", "#45b7d1", "#96c93d", "#f9ca24",
            "#f0932b", "#eb4d4b", "#6c5ce7", "#a29bfe", "#fd79a8",
            "#00b894", "#0984e3", "#e17055", "#fdcb6e"
    );

    /** Sum of the id's chars, modulo the palette size. */
    public static String forUser(String userId) {
        if (userId == null) return PALETTE.get(0);
        long sum = 0;
        for (int i = 0; i < userId.length(); i++) sum += userId.charAt(i);
        return PALETTE.get((int) (sum % PALETTE.size()));
    }
}
