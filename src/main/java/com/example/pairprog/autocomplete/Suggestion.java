package com.example.pairprog.autocomplete;

/** Text to insert over {@code [startPosition, endPosition)} of the buffer. */
public record Suggestion(String suggestion, int startPosition, int endPosition, String description) {

    public static final String NONE = "No suggestion available";
}
