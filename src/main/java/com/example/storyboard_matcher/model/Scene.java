package com.example.storyboard_matcher.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A storyboard unit awaiting a matched clip.
 * <p>
 * Candidate and selection fields are mutated through
 * {@link com.example.storyboard_matcher.service.CandidateSelectionService} only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Scene {
    private String sceneId;
    private String title = "";
    private String purpose = "";
    private String script = "";
    private boolean useVoiceOver = true;
    private int order;
    private VoiceOver voiceOver;
    private MatchedScene matchedScene;
    private List<SceneCandidate> candidates = new ArrayList<>();
    private String selectedCandidateId;
    private List<SelectionHistoryEntry> selectionHistory = new ArrayList<>();

    public Scene() {
    }

    public Scene(String sceneId, String title, String purpose, String script, boolean useVoiceOver) {
        this.sceneId = sceneId;
        this.title = title;
        this.purpose = purpose;
        this.script = script;
        this.useVoiceOver = useVoiceOver;
    }

    public String getSceneId() { return sceneId; }
    public void setSceneId(String sceneId) { this.sceneId = sceneId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getPurpose() { return purpose; }
    public void setPurpose(String purpose) { this.purpose = purpose; }

    public String getScript() { return script; }
    public void setScript(String script) { this.script = script; }

    public boolean isUseVoiceOver() { return useVoiceOver; }
    public void setUseVoiceOver(boolean useVoiceOver) { this.useVoiceOver = useVoiceOver; }

    public int getOrder() { return order; }
    public void setOrder(int order) { this.order = order; }

    public VoiceOver getVoiceOver() { return voiceOver; }
    public void setVoiceOver(VoiceOver voiceOver) { this.voiceOver = voiceOver; }

    public MatchedScene getMatchedScene() { return matchedScene; }
    public void setMatchedScene(MatchedScene matchedScene) { this.matchedScene = matchedScene; }

    public List<SceneCandidate> getCandidates() { return candidates; }
    public void setCandidates(List<SceneCandidate> candidates) {
        this.candidates = candidates == null ? new ArrayList<>() : new ArrayList<>(candidates);
    }

    public String getSelectedCandidateId() { return selectedCandidateId; }
    public void setSelectedCandidateId(String selectedCandidateId) { this.selectedCandidateId = selectedCandidateId; }

    public List<SelectionHistoryEntry> getSelectionHistory() { return selectionHistory; }
    public void setSelectionHistory(List<SelectionHistoryEntry> selectionHistory) {
        this.selectionHistory = selectionHistory == null ? new ArrayList<>() : new ArrayList<>(selectionHistory);
    }

    public Optional<SceneCandidate> findCandidate(String candidateId) {
        if (candidateId == null) return Optional.empty();
        return candidates.stream()
                .filter(c -> Objects.equals(c.getCandidateId(), candidateId))
                .findFirst();
    }

    @JsonIgnore
    public Optional<SceneCandidate> getSelectedCandidate() {
        return findCandidate(selectedCandidateId);
    }

    /**
     * @return true when a selection id is set but no longer names a candidate of this scene.
     */
    @JsonIgnore
    public boolean isSelectionDangling() {
        return selectedCandidateId != null && findCandidate(selectedCandidateId).isEmpty();
    }

    /**
     * Measured voice-over duration, if any.
     */
    @JsonIgnore
    public Optional<Double> getVoiceOverDuration() {
        return voiceOver != null && voiceOver.hasDuration() ? Optional.of(voiceOver.duration()) : Optional.empty();
    }
}
