package com.example.storyboard_matcher.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "storyboard_event",
        indexes = @Index(name = "idx_storyboard_event_session_created", columnList = "session_id, created_at")
)
public class StoryboardEvent {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "type", nullable = false, length = 64)
    private String type;

    @Column(name = "payload", columnDefinition = "text")
    private String payload;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected StoryboardEvent() {
    }

    public StoryboardEvent(String sessionId, String type, String payload) {
        this.id = UUID.randomUUID();
        this.sessionId = sessionId;
        this.type = type;
        this.payload = payload;
    }

    public UUID getId() { return id; }
    public String getSessionId() { return sessionId; }
    public String getType() { return type; }
    public String getPayload() { return payload; }
    public Instant getCreatedAt() { return createdAt; }
}
