package com.example.pairprog.model;

/**
 * Last reported cursor of one user. Positions are opaque client state and are not
 * checked against the buffer length.
 */
public record CursorState(int position, Selection selection, String username, String color) {

    public CursorState {
        if (position < 0) throw new IllegalArgumentException("position must be >= 0");
    }

    public static CursorState initial(User user) {
        return new CursorState(0, null, user.username(), user.color());
    }

    public CursorState moveTo(int newPosition, Selection newSelection) {
        return new CursorState(newPosition, newSelection, username, color);
    }

    /** Selected range as reported by the editor. */
    public record Selection(int start, int end) { }
}
