package com.example.pairprog.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "rooms",
    indexes = {
        @Index(name = "idx_rooms_created_at", columnList = "createdAt"),
        @Index(name = "idx_rooms_updated_at", columnList = "updatedAt")
    }
)
public class PersistentRoom {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String codeContent = "";

    @NotBlank
    @Size(max = 50)
    @Column(nullable = false, length = 50)
    private String language = RetainedRoom.DEFAULT_LANGUAGE;

    @Column(nullable = false)
    private int activeUsers = 0;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    protected PersistentRoom() {}

    public PersistentRoom(String language, String codeContent) {
        this.language = (language == null || language.isBlank()) ? RetainedRoom.DEFAULT_LANGUAGE : language.trim();
        this.codeContent = (codeContent == null) ? "" : codeContent;
    }

    @PrePersist
    protected void onCreate() {
        if (this.id == null || this.id.isBlank()) {
            this.id = UUID.randomUUID().toString();
        }
        Instant now = Instant.now();
        if (this.createdAt == null) this.createdAt = now;
        if (this.updatedAt == null) this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; } // tests only

    public String getCodeContent() { return codeContent; }
    public void setCodeContent(String codeContent) { this.codeContent = (codeContent == null ? "" : codeContent); }

    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }

    public int getActiveUsers() { return activeUsers; }
    public void setActiveUsers(int activeUsers) { this.activeUsers = Math.max(0, activeUsers); }

    /** Applies a signed change, never going below zero. */
    public void adjustActiveUsers(int delta) {
        this.activeUsers = Math.max(0, this.activeUsers + delta);
    }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "PersistentRoom{" +
                "id='" + id + '\'' +
                ", language='" + language + '\'' +
                ", activeUsers=" + activeUsers +
                ", createdAt=" + createdAt +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
