package com.example.pairprog.message;

import com.example.pairprog.model.CursorState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * JSON envelope codec: decodes {@code {"type", "payload"}} frames into {@link ClientMessage}s
 * and encodes {@link ServerMessage}s.
 */
@Component
public class ClientMessageCodec {

    private final ObjectMapper objectMapper;

    public ClientMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public ClientMessage decode(String text) throws ProtocolException {
        JsonNode root;
        try {
            root = objectMapper.readTree(text == null ? "" : text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON format", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Invalid JSON format");
        }

        JsonNode typeNode = root.path("type");
        if (!typeNode.isTextual()) {
            throw new ProtocolException("Missing message type");
        }
        String typeName = typeNode.asText();
        MessageType type = MessageType.fromWire(typeName)
                .orElseThrow(() -> new ProtocolException("Unknown message type: " + typeName));

        JsonNode payload = root.path("payload");
        if (payload.isMissingNode() || payload.isNull()) {
            payload = MissingNode.getInstance();
        } else if (!payload.isObject()) {
            throw new ProtocolException("Payload must be an object");
        }

        return switch (type) {
            case CODE_UPDATE -> new ClientMessage.CodeUpdate(
                    requiredText(payload, "code"),
                    cursorPosition(payload));
            case CURSOR_UPDATE -> new ClientMessage.CursorUpdate(
                    cursorPosition(payload),
                    selection(payload.path("selection")));
            case CHAT_MESSAGE -> new ClientMessage.ChatSend(
                    optionalText(payload, "content", ""),
                    optionalText(payload, "messageType", "message"));
            case TYPING_START -> new ClientMessage.TypingStart();
            case TYPING_STOP -> new ClientMessage.TypingStop();
            case LANGUAGE_CHANGE -> new ClientMessage.LanguageChange(requiredLanguage(payload));
            case PING -> new ClientMessage.Ping();
        };
    }

    public String encode(ServerMessage message) throws JsonProcessingException {
        return objectMapper.writeValueAsString(message);
    }

    /* ---------------- helpers ---------------- */

    private static String requiredText(JsonNode payload, String field) throws ProtocolException {
        JsonNode n = payload.path(field);
        if (!n.isTextual()) throw new ProtocolException("Field '" + field + "' must be a string");
        return n.asText();
    }

    private static String optionalText(JsonNode payload, String field, String fallback) throws ProtocolException {
        JsonNode n = payload.path(field);
        if (n.isMissingNode() || n.isNull()) return fallback;
        if (!n.isTextual()) throw new ProtocolException("Field '" + field + "' must be a string");
        return n.asText();
    }

    private static String requiredLanguage(JsonNode payload) throws ProtocolException {
        String language = requiredText(payload, "language").trim();
        if (language.isEmpty()) throw new ProtocolException("Field 'language' must not be blank");
        return language;
    }

    /** Missing cursor defaults to 0; anything else must be a non-negative integer. */
    private static int cursorPosition(JsonNode payload) throws ProtocolException {
        JsonNode n = payload.path("cursorPosition");
        if (n.isMissingNode() || n.isNull()) return 0;
        if (!n.canConvertToInt() || !n.isIntegralNumber()) {
            throw new ProtocolException("Field 'cursorPosition' must be an integer");
        }
        int pos = n.asInt();
        if (pos < 0) throw new ProtocolException("Field 'cursorPosition' must be >= 0");
        return pos;
    }

    private static CursorState.Selection selection(JsonNode n) throws ProtocolException {
        if (n.isMissingNode() || n.isNull()) return null;
        if (!n.isObject() || !n.path("start").isIntegralNumber() || !n.path("end").isIntegralNumber()) {
            throw new ProtocolException("Field 'selection' must be {start, end}");
        }
        return new CursorState.Selection(n.path("start").asInt(), n.path("end").asInt());
    }
}
