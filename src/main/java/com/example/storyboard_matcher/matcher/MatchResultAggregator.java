package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.dto.CandidateClip;
import com.example.storyboard_matcher.dto.MatchError;
import com.example.storyboard_matcher.dto.SceneMatchBatchResponse;
import com.example.storyboard_matcher.dto.SceneResult;
import com.example.storyboard_matcher.dto.ShortlistClip;
import com.example.storyboard_matcher.util.MessageText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects job outcomes of one batch into per-scene buckets. Not thread-safe: feed it after fan-in.
 * <p>
 * Every scene registered up front appears in the response, in registration order, even without candidates.
 */
public class MatchResultAggregator {
    static final String NO_CANDIDATES_AFTER_ERRORS = "No candidates for this scene; see errors for details.";
    static final String NO_CANDIDATES = "No candidates matched the requirements for this scene.";

    private final Map<String, List<CandidateClip>> candidatesByScene = new LinkedHashMap<>();
    private final Map<String, List<String>> warningsByScene = new LinkedHashMap<>();
    private final Map<String, List<String>> notesByScene = new LinkedHashMap<>();
    private final Map<String, List<ShortlistClip>> shortlistByScene = new LinkedHashMap<>();
    private final List<MatchError> errors = new ArrayList<>();

    public MatchResultAggregator(List<String> sceneOrder) {
        for (String sceneId : sceneOrder) {
            candidatesByScene.putIfAbsent(sceneId, new ArrayList<>());
        }
    }

    public void accept(AnalysisOutcome outcome) {
        String sceneId = outcome.sceneId();
        bucket(sceneId);
        switch (outcome.kind()) {
            case FAILED -> errors.add(new MatchError(sceneId, outcome.videoId(), outcome.error()));
            case OK, FILTERED -> {
                candidatesByScene.get(sceneId).addAll(outcome.candidates());
                if (outcome.notes() != null && !outcome.notes().isBlank()) {
                    addNote(sceneId, "[" + outcome.videoId() + "] " + outcome.notes().trim());
                }
                outcome.droppedReasons().forEach(reason -> addWarning(sceneId, reason));
            }
        }
    }

    public void addError(MatchError error) {
        if (error.sceneId() != null) bucket(error.sceneId());
        errors.add(error);
    }

    public void addErrors(List<MatchError> batchErrors) {
        batchErrors.forEach(this::addError);
    }

    public void addWarning(String sceneId, String warning) {
        warningsByScene.computeIfAbsent(sceneId, k -> new ArrayList<>()).add(warning);
    }

    public void addWarnings(Map<String, List<String>> warnings) {
        warnings.forEach((sceneId, messages) -> messages.forEach(m -> addWarning(sceneId, m)));
    }

    public void addNote(String sceneId, String note) {
        notesByScene.computeIfAbsent(sceneId, k -> new ArrayList<>()).add(note);
    }

    public void setShortlistClips(String sceneId, List<ShortlistClip> clips) {
        shortlistByScene.put(sceneId, List.copyOf(clips));
    }

    public SceneMatchBatchResponse build() {
        List<SceneResult> results = new ArrayList<>();
        for (Map.Entry<String, List<CandidateClip>> entry : candidatesByScene.entrySet()) {
            String sceneId = entry.getKey();
            if (entry.getValue().isEmpty()) {
                boolean hasErrors = errors.stream().anyMatch(e -> sceneId.equals(e.sceneId()));
                addWarning(sceneId, hasErrors ? NO_CANDIDATES_AFTER_ERRORS : NO_CANDIDATES);
            }
            results.add(new SceneResult(sceneId, entry.getValue()));
        }
        return new SceneMatchBatchResponse(
                results,
                dedupeAll(warningsByScene),
                List.copyOf(errors),
                dedupeAll(notesByScene),
                new LinkedHashMap<>(shortlistByScene));
    }

    private void bucket(String sceneId) {
        candidatesByScene.computeIfAbsent(sceneId, k -> new ArrayList<>());
    }

    private static Map<String, List<String>> dedupeAll(Map<String, List<String>> messages) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        messages.forEach((sceneId, list) -> {
            List<String> deduped = MessageText.dedupe(list);
            if (!deduped.isEmpty()) out.put(sceneId, deduped);
        });
        return out;
    }
}
