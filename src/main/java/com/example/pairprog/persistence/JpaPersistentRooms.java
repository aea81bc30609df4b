package com.example.pairprog.persistence;

import com.example.pairprog.model.PersistentRoom;
import com.example.pairprog.repository.PersistentRoomRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Adapter onto the JPA repository.
 */
@Component
public class JpaPersistentRooms implements PersistentRooms {

    private final PersistentRoomRepository repo;

    public JpaPersistentRooms(PersistentRoomRepository repo) {
        this.repo = repo;
    }

    @Override
    @Transactional
    public PersistentRoom create(String language) {
        String lang = (language == null || language.isBlank()) ? "python" : language.trim();
        return repo.save(new PersistentRoom(lang, StarterCode.forLanguage(lang)));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PersistentRoom> get(String id) {
        if (id == null) return Optional.empty();
        String n = id.trim();
        if (n.isEmpty()) return Optional.empty();
        return repo.findById(n);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PersistentRoom> list() {
        return repo.findAllByOrderByCreatedAtDesc();
    }

    @Override
    @Transactional
    public void updateCode(String id, String code) {
        get(id).ifPresent(r -> {
            r.setCodeContent(code);
            repo.save(r);
        });
    }

    @Override
    @Transactional
    public void updateLanguage(String id, String language) {
        get(id).ifPresent(r -> {
            r.setLanguage(language);
            repo.save(r);
        });
    }

    @Override
    @Transactional
    public void updateActiveUsers(String id, int delta) {
        get(id).ifPresent(r -> {
            r.adjustActiveUsers(delta);
            repo.save(r);
        });
    }
}
