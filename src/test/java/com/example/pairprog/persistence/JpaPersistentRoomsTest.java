package com.example.pairprog.persistence;

import com.example.pairprog.model.PersistentRoom;
import com.example.pairprog.repository.PersistentRoomRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JpaPersistentRoomsTest {

    private PersistentRoomRepository repo;
    private JpaPersistentRooms rooms;

    @BeforeEach
    void setUp() {
        repo = mock(PersistentRoomRepository.class);
        rooms = new JpaPersistentRooms(repo);
        when(repo.save(any(PersistentRoom.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void create_usesStarterCodeForLanguage() {
        PersistentRoom r = rooms.create("javascript");

        assertEquals("javascript", r.getLanguage());
        assertTrue(r.getCodeContent().contains("console.log"));
        assertEquals(0, r.getActiveUsers());
    }

    @Test
    void create_defaultsToPython() {
        PersistentRoom r = rooms.create("  ");

        assertEquals("python", r.getLanguage());
        assertEquals(StarterCode.forLanguage("python"), r.getCodeContent());
    }

    @Test
    void create_unknownLanguage_keepsLanguage_butUsesPythonTemplate() {
        PersistentRoom r = rooms.create("cobol");

        assertEquals("cobol", r.getLanguage());
        assertEquals(StarterCode.forLanguage("python"), r.getCodeContent());
    }

    @Test
    void updateActiveUsers_clampsAtZero() {
        PersistentRoom r = new PersistentRoom("python", "");
        r.setId("r1");
        when(repo.findById("r1")).thenReturn(Optional.of(r));

        rooms.updateActiveUsers("r1", +1);
        rooms.updateActiveUsers("r1", -1);
        rooms.updateActiveUsers("r1", -1);

        assertEquals(0, r.getActiveUsers());
        verify(repo, times(3)).save(r);
    }

    @Test
    void updateCodeAndLanguage_saveTheEntity() {
        PersistentRoom r = new PersistentRoom("python", "old");
        r.setId("r1");
        when(repo.findById("r1")).thenReturn(Optional.of(r));

        rooms.updateCode("r1", "new");
        rooms.updateLanguage("r1", "go");

        ArgumentCaptor<PersistentRoom> cap = ArgumentCaptor.forClass(PersistentRoom.class);
        verify(repo, times(2)).save(cap.capture());
        assertEquals("new", cap.getValue().getCodeContent());
        assertEquals("go", cap.getValue().getLanguage());
    }

    @Test
    void updates_onUnknownRoom_areNoOps() {
        when(repo.findById("missing")).thenReturn(Optional.empty());

        rooms.updateCode("missing", "x");
        rooms.updateActiveUsers("missing", 1);

        verify(repo, never()).save(any());
    }

    @Test
    void get_blankId_doesNotHitRepository() {
        assertTrue(rooms.get("  ").isEmpty());
        assertTrue(rooms.get(null).isEmpty());
        verifyNoInteractions(repo);
    }
}
