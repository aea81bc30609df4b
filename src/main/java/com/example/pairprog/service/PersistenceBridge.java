package com.example.pairprog.service;

import com.example.pairprog.config.CollabProperties;
import com.example.pairprog.model.PersistentRoom;
import com.example.pairprog.persistence.PersistentRooms;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mirrors code, language and the active-user counter to the durable store, off the broadcast path.
 *
 * All writes run on one thread. Language and active-user writes reach the store in submission
 * order; code writes wait out the debounce window, so a later language or counter write can land
 * before them. Code writes are coalesced per room: a newer buffer replaces one still waiting.
 * Failures are logged and dropped.
 */
@Service
public class PersistenceBridge {

    private static final Logger log = LoggerFactory.getLogger(PersistenceBridge.class);

    private final PersistentRooms store;
    private final RoomRegistry registry;
    private final long debounceMs;

    private final ScheduledExecutorService writer;
    /** room id -> newest buffer not yet written; an entry means a write is scheduled */
    private final ConcurrentMap<String, String> latestCode = new ConcurrentHashMap<>();

    @Autowired
    public PersistenceBridge(PersistentRooms store, RoomRegistry registry, CollabProperties props) {
        this(store, registry, props.getPersistDebounceMs());
    }

    public PersistenceBridge(PersistentRooms store, RoomRegistry registry, long debounceMs) {
        this.store = store;
        this.registry = registry;
        this.debounceMs = Math.max(0, debounceMs);
        this.writer = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "room-store-writer-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
        log.info("PersistenceBridge initialized (debounceMs={})", this.debounceMs);
    }

    // ------------------------------------------------------------------------
    // Join path (synchronous)
    // ------------------------------------------------------------------------

    /**
     * Looks the room up in the store and, if it exists and is not cached yet, seeds the registry's
     * retained cache with its code and language. Empty means the room does not exist.
     */
    public Optional<PersistentRoom> loadForJoin(String roomId) {
        Optional<PersistentRoom> found = store.get(roomId);
        found.ifPresent(r -> {
            if (registry.primeIfAbsent(roomId, r.getCodeContent(), r.getLanguage())) {
                log.debug("Primed room cache from store (room={}, language={})", roomId, r.getLanguage());
            }
        });
        return found;
    }

    // ------------------------------------------------------------------------
    // Fire-and-forget writes
    // ------------------------------------------------------------------------

    /**
     * Queues the buffer for writing. The first call for a room schedules a write after the debounce
     * window; calls inside the window only replace the buffer that write will pick up.
     */
    public void persistCode(String roomId, String code) {
        if (latestCode.put(roomId, code == null ? "" : code) == null
                && !schedule(() -> writeLatestCode(roomId), debounceMs)) {
            latestCode.remove(roomId);
        }
    }

    private void writeLatestCode(String roomId) {
        String code = latestCode.remove(roomId);
        if (code == null) return;
        try {
            store.updateCode(roomId, code);
            log.debug("Code persisted (room={}, length={})", roomId, code.length());
        } catch (Exception e) {
            log.warn("Code persist failed (room={}): {}", roomId, e.toString());
        }
    }

    public void persistLanguage(String roomId, String language) {
        schedule(() -> {
            try {
                store.updateLanguage(roomId, language);
                log.debug("Language persisted (room={}, language={})", roomId, language);
            } catch (Exception e) {
                log.warn("Language persist failed (room={}): {}", roomId, e.toString());
            }
        }, 0);
    }

    public void adjustActiveUsers(String roomId, int delta) {
        schedule(() -> {
            try {
                store.updateActiveUsers(roomId, delta);
            } catch (Exception e) {
                log.warn("Active-user update failed (room={}, delta={}): {}", roomId, delta, e.toString());
            }
        }, 0);
    }

    private boolean schedule(Runnable task, long delayMs) {
        try {
            writer.schedule(task, delayMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Store write rejected (shutting down): {}", e.toString());
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Store writer did not drain in time; {} write(s) dropped", writer.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
