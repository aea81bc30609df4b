package com.example.pairprog.config;

import com.example.pairprog.handler.CollabWebSocketHandler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class WebSocketConfigTest {

    private final CollabWebSocketHandler handler = mock(CollabWebSocketHandler.class);

    @Test
    void localhostOrigins_expandToAnyPort() {
        WebSocketConfig cfg = new WebSocketConfig(handler, "/ws/*", "http://localhost:3000, https://pair.example", false);

        List<String> patterns = cfg.getOriginPatterns();
        assertTrue(patterns.contains("http://localhost:3000"));
        assertTrue(patterns.contains("http://localhost:*"));
        assertTrue(patterns.contains("http://127.0.0.1:*"));
        assertTrue(patterns.contains("https://pair.example"));
    }

    @Test
    void debugOpen_allowsEverything() {
        WebSocketConfig cfg = new WebSocketConfig(handler, "/ws/*", "https://pair.example", true);

        assertEquals(List.of("*"), cfg.getOriginPatterns());
    }

    @Test
    void emptyList_fallsBackToWildcard() {
        WebSocketConfig cfg = new WebSocketConfig(handler, "/ws/*", " , ", false);

        assertEquals(List.of("*"), cfg.getOriginPatterns());
    }

    @Test
    void duplicates_collapsedInOrder() {
        assertArrayEquals(
                new String[] {"http://localhost:3000", "http://localhost:*", "http://127.0.0.1:*", "http://localhost:5173"},
                WebSocketConfig.toPatterns("http://localhost:3000,http://localhost:5173,http://localhost:3000"));
    }
}
