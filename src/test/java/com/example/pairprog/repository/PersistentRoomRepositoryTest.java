package com.example.pairprog.repository;

import com.example.pairprog.model.PersistentRoom;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class PersistentRoomRepositoryTest {

    @Autowired
    private PersistentRoomRepository repo;

    @Test
    void save_assignsUuidAndTimestamps() {
        PersistentRoom saved = repo.saveAndFlush(new PersistentRoom("python", "print(1)"));

        assertNotNull(saved.getId());
        assertEquals(36, saved.getId().length());
        assertNotNull(saved.getCreatedAt());
        assertNotNull(saved.getUpdatedAt());
        assertEquals("print(1)", repo.findById(saved.getId()).orElseThrow().getCodeContent());
    }

    @Test
    void findAll_newestFirst() {
        PersistentRoom older = new PersistentRoom("python", "");
        older.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        PersistentRoom newer = new PersistentRoom("go", "");
        newer.setCreatedAt(Instant.parse("2025-01-01T00:00:00Z"));
        repo.saveAndFlush(older);
        repo.saveAndFlush(newer);

        List<String> langs = repo.findAllByOrderByCreatedAtDesc().stream()
                .map(PersistentRoom::getLanguage)
                .collect(Collectors.toList());

        assertEquals(List.of("go", "python"), langs);
    }

    @Test
    void largeBuffer_roundTrips() {
        String big = "x".repeat(100_000);
        PersistentRoom saved = repo.saveAndFlush(new PersistentRoom("python", big));

        assertEquals(big.length(), repo.findById(saved.getId()).orElseThrow().getCodeContent().length());
    }
}
