package com.example.pairprog.controller;

import com.example.pairprog.model.PersistentRoom;
import com.example.pairprog.persistence.PersistentRooms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/rooms")
public class RoomsController {

  private static final Logger log = LoggerFactory.getLogger(RoomsController.class);

  private final PersistentRooms rooms;

  public RoomsController(PersistentRooms rooms) {
    this.rooms = rooms;
  }

  // --- Create ---------------------------------------------------------------

  @PostMapping
  public ResponseEntity<RoomView> create(@RequestBody(required = false) CreateRequest body) {
    String language = (body == null) ? null : body.language;
    PersistentRoom r = rooms.create(language);
    log.info("ROOM CREATE id={} language={}", r.getId(), r.getLanguage());
    return ResponseEntity.status(HttpStatus.CREATED).body(RoomView.from(r));
  }

  // --- Read -----------------------------------------------------------------

  @GetMapping
  public List<RoomView> list() {
    return rooms.list().stream().map(RoomView::from).collect(Collectors.toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<?> get(@PathVariable String id) {
    return rooms.get(id)
        .<ResponseEntity<?>>map(r -> ResponseEntity.ok(RoomView.from(r)))
        .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorView("Room with ID '" + id + "' not found")));
  }

  // ===== DTOs (Views/Requests) ============================================

  /** POST body; language defaults to python */
  public static final class CreateRequest {
    public String language;
  }

  public static final class RoomView {
    public String roomId;
    public String language;
    public String codeContent;
    public int activeUsers;
    public Instant createdAt;

    public static RoomView from(PersistentRoom r) {
      Objects.requireNonNull(r, "r");
      RoomView v = new RoomView();
      v.roomId = r.getId();
      v.language = r.getLanguage();
      v.codeContent = r.getCodeContent();
      v.activeUsers = r.getActiveUsers();
      v.createdAt = r.getCreatedAt();
      return v;
    }
  }
}
