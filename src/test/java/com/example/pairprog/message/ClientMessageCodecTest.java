package com.example.pairprog.message;

import com.example.pairprog.model.CursorState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClientMessageCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ClientMessageCodec codec = new ClientMessageCodec(mapper);

    @Test
    void decodesCodeUpdate_withDefaultCursor() throws Exception {
        ClientMessage m = codec.decode("{\"type\":\"code_update\",\"payload\":{\"code\":\"x = 1\"}}");

        ClientMessage.CodeUpdate cu = assertInstanceOf(ClientMessage.CodeUpdate.class, m);
        assertEquals("x = 1", cu.code());
        assertEquals(0, cu.cursorPosition());
    }

    @Test
    void decodesCursorUpdate_withSelection() throws Exception {
        ClientMessage m = codec.decode(
                "{\"type\":\"cursor_update\",\"payload\":{\"cursorPosition\":7,\"selection\":{\"start\":2,\"end\":7}}}");

        ClientMessage.CursorUpdate cu = assertInstanceOf(ClientMessage.CursorUpdate.class, m);
        assertEquals(7, cu.cursorPosition());
        assertEquals(new CursorState.Selection(2, 7), cu.selection());
    }

    @Test
    void decodesChat_typingLanguageAndPing() throws Exception {
        ClientMessage.ChatSend chat = assertInstanceOf(ClientMessage.ChatSend.class,
                codec.decode("{\"type\":\"chat_message\",\"payload\":{\"content\":\"hi\"}}"));
        assertEquals("hi", chat.content());
        assertEquals("message", chat.messageType());

        assertEquals(MessageType.TYPING_START, codec.decode("{\"type\":\"typing_start\"}").type());
        assertEquals(MessageType.TYPING_STOP, codec.decode("{\"type\":\"typing_stop\",\"payload\":{}}").type());
        assertEquals(MessageType.PING, codec.decode("{\"type\":\"ping\"}").type());

        ClientMessage.LanguageChange lc = assertInstanceOf(ClientMessage.LanguageChange.class,
                codec.decode("{\"type\":\"language_change\",\"payload\":{\"language\":\" go \"}}"));
        assertEquals("go", lc.language());
    }

    @Test
    void rejectsMalformedJson() {
        ProtocolException e = assertThrows(ProtocolException.class, () -> codec.decode("{not json"));
        assertEquals("Invalid JSON format", e.getMessage());
    }

    @Test
    void rejectsUnknownAndMissingType() {
        ProtocolException unknown = assertThrows(ProtocolException.class,
                () -> codec.decode("{\"type\":\"dance\",\"payload\":{}}"));
        assertEquals("Unknown message type: dance", unknown.getMessage());

        ProtocolException missing = assertThrows(ProtocolException.class, () -> codec.decode("{\"payload\":{}}"));
        assertEquals("Missing message type", missing.getMessage());
    }

    @Test
    void rejectsBadPayloads() {
        assertThrows(ProtocolException.class,
                () -> codec.decode("{\"type\":\"code_update\",\"payload\":{\"code\":42}}"));
        assertThrows(ProtocolException.class,
                () -> codec.decode("{\"type\":\"code_update\",\"payload\":{\"code\":\"x\",\"cursorPosition\":-1}}"));
        assertThrows(ProtocolException.class,
                () -> codec.decode("{\"type\":\"cursor_update\",\"payload\":{\"cursorPosition\":\"3\"}}"));
        assertThrows(ProtocolException.class,
                () -> codec.decode("{\"type\":\"language_change\",\"payload\":{\"language\":\"  \"}}"));
        assertThrows(ProtocolException.class,
                () -> codec.decode("{\"type\":\"chat_message\",\"payload\":[1,2]}"));
    }

    @Test
    void encode_writesTypeAndPayloadEnvelope() throws Exception {
        JsonNode n = mapper.readTree(codec.encode(ServerMessage.userLeft("u1", "alice", 2)));

        assertEquals("user_left", n.path("type").asText());
        assertEquals("u1", n.path("payload").path("userId").asText());
        assertEquals("alice", n.path("payload").path("username").asText());
        assertEquals(2, n.path("payload").path("activeUsers").asInt());
    }

    @Test
    void encode_pongHasEmptyPayload() throws Exception {
        JsonNode n = mapper.readTree(codec.encode(ServerMessage.pong()));

        assertEquals("pong", n.path("type").asText());
        assertTrue(n.path("payload").isObject());
        assertEquals(0, n.path("payload").size());
    }
}
