package com.example.pairprog.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.*;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.security.Principal;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory WebSocketSession that records every frame it is asked to send.
 * Fails the send when {@link #failSends(boolean)} is on, like a dropped TCP peer, and can
 * hold every send until a latch opens, like a peer that stopped reading.
 */
public class FakeSession implements WebSocketSession {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final URI uri;
    private final List<String> sent = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    private volatile boolean open = true;
    private volatile boolean failSends = false;
    private volatile CloseStatus closeStatus;
    private volatile CountDownLatch sendGate;
    private final AtomicReference<RuntimeException> failOnce = new AtomicReference<>();
    private final CountDownLatch sendEntered = new CountDownLatch(1);

    public FakeSession(String id) {
        this(id, URI.create("ws://localhost/ws/room-1"));
    }

    public FakeSession(String id, URI uri) {
        this.id = id;
        this.uri = uri;
    }

    public FakeSession failSends(boolean fail) {
        this.failSends = fail;
        return this;
    }

    /** The next send throws {@code e}; later sends succeed. */
    public FakeSession failNextSendWith(RuntimeException e) {
        failOnce.set(e);
        return this;
    }

    /** Sends block until {@code gate} opens (or the session is closed). */
    public FakeSession blockSendsUntil(CountDownLatch gate) {
        this.sendGate = gate;
        return this;
    }

    /** Waits until some thread has entered {@link #sendMessage}. */
    public boolean awaitSendEntered(long timeout, TimeUnit unit) throws InterruptedException {
        return sendEntered.await(timeout, unit);
    }

    /** Raw payloads in send order. */
    public List<String> sent() {
        synchronized (sent) {
            return new ArrayList<>(sent);
        }
    }

    public List<JsonNode> frames() {
        return sent().stream().map(FakeSession::parse).collect(Collectors.toList());
    }

    public List<String> types() {
        return frames().stream().map(f -> f.path("type").asText()).collect(Collectors.toList());
    }

    public List<JsonNode> framesOfType(String type) {
        return frames().stream().filter(f -> type.equals(f.path("type").asText())).collect(Collectors.toList());
    }

    public void clear() {
        sent.clear();
    }

    public CloseStatus closeStatus() {
        return closeStatus;
    }

    private static JsonNode parse(String s) {
        try {
            return MAPPER.readTree(s);
        } catch (IOException e) {
            throw new IllegalStateException("not JSON: " + s, e);
        }
    }

    // ---------------------------------------------------------------------
    // WebSocketSession
    // ---------------------------------------------------------------------

    @Override public String getId() { return id; }
    @Override public URI getUri() { return uri; }
    @Override public HttpHeaders getHandshakeHeaders() { return new HttpHeaders(); }
    @Override public Map<String, Object> getAttributes() { return attributes; }
    @Override public Principal getPrincipal() { return null; }
    @Override public InetSocketAddress getLocalAddress() { return null; }
    @Override public InetSocketAddress getRemoteAddress() { return null; }
    @Override public String getAcceptedProtocol() { return null; }
    @Override public void setTextMessageSizeLimit(int messageSizeLimit) { }
    @Override public int getTextMessageSizeLimit() { return 64 * 1024; }
    @Override public void setBinaryMessageSizeLimit(int messageSizeLimit) { }
    @Override public int getBinaryMessageSizeLimit() { return 64 * 1024; }
    @Override public List<WebSocketExtension> getExtensions() { return List.of(); }

    @Override
    public void sendMessage(WebSocketMessage<?> message) throws IOException {
        sendEntered.countDown();
        CountDownLatch gate = sendGate;
        if (gate != null) {
            try {
                while (open && !gate.await(50, TimeUnit.MILLISECONDS)) {
                    // peer not reading
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
        }
        RuntimeException once = failOnce.getAndSet(null);
        if (once != null) throw once;
        if (failSends) throw new IOException("Broken pipe");
        if (!open) throw new IOException("closed");
        sent.add(String.valueOf(message.getPayload()));
    }

    @Override public boolean isOpen() { return open; }

    @Override
    public void close() {
        close(CloseStatus.NORMAL);
    }

    @Override
    public void close(CloseStatus status) {
        this.closeStatus = status;
        this.open = false;
    }
}
