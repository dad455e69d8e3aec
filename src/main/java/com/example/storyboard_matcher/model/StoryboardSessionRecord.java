package com.example.storyboard_matcher.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Persisted scene list of one storyboard session. Scenes are stored as a JSON document.
 */
@Entity
@Table(name = "storyboard_session")
public class StoryboardSessionRecord {
    @Id
    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    @Column(name = "scenes", nullable = false, columnDefinition = "text")
    private String scenesJson;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected StoryboardSessionRecord() {
    }

    public StoryboardSessionRecord(String sessionId, String tenantId, String scenesJson) {
        this.sessionId = sessionId;
        this.tenantId = tenantId;
        this.scenesJson = scenesJson;
    }

    public String getSessionId() { return sessionId; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getScenesJson() { return scenesJson; }
    public void setScenesJson(String scenesJson) { this.scenesJson = scenesJson; }

    public long getVersion() { return version; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
