package com.example.storyboard_matcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One proposed source-video sub-clip for a scene. Rank 1 is the best.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SceneCandidate {
    private String candidateId;
    private String sourceVideoId;
    private double startTime;
    private double endTime;
    private String description = "";
    private String rationale = "";
    private boolean keepOriginalAudio;
    private int rank;
    private boolean shortlisted = true;
    private Instant createdAt;
    private Instant updatedAt;

    public SceneCandidate() {
    }

    public SceneCandidate(String candidateId, String sourceVideoId, double startTime, double endTime, int rank) {
        this.candidateId = candidateId;
        this.sourceVideoId = sourceVideoId;
        this.startTime = startTime;
        this.endTime = endTime;
        this.rank = rank;
    }

    public String getCandidateId() { return candidateId; }
    public void setCandidateId(String candidateId) { this.candidateId = candidateId; }

    public String getSourceVideoId() { return sourceVideoId; }
    public void setSourceVideoId(String sourceVideoId) { this.sourceVideoId = sourceVideoId; }

    public double getStartTime() { return startTime; }
    public void setStartTime(double startTime) { this.startTime = startTime; }

    public double getEndTime() { return endTime; }
    public void setEndTime(double endTime) { this.endTime = endTime; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getRationale() { return rationale; }
    public void setRationale(String rationale) { this.rationale = rationale; }

    public boolean isKeepOriginalAudio() { return keepOriginalAudio; }
    public void setKeepOriginalAudio(boolean keepOriginalAudio) { this.keepOriginalAudio = keepOriginalAudio; }

    public int getRank() { return rank; }
    public void setRank(int rank) { this.rank = rank; }

    public boolean isShortlisted() { return shortlisted; }
    public void setShortlisted(boolean shortlisted) { this.shortlisted = shortlisted; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public double duration() {
        return endTime - startTime;
    }
}
