package com.example.storyboard_matcher.service;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.CandidateClip;
import com.example.storyboard_matcher.dto.HandpickedCandidate;
import com.example.storyboard_matcher.exception.InvalidStateException;
import com.example.storyboard_matcher.exception.NotFoundException;
import com.example.storyboard_matcher.model.ChangeSource;
import com.example.storyboard_matcher.model.MatchedScene;
import com.example.storyboard_matcher.model.Scene;
import com.example.storyboard_matcher.model.SceneCandidate;
import com.example.storyboard_matcher.model.SelectionHistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the ranked candidate list, the active selection and the selection history of a scene.
 * <p>
 * All operations mutate the given scene in place. {@code matched_scene} is only ever written here,
 * as a projection of the selected candidate.
 */
@Service
public class CandidateSelectionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CandidateSelectionService.class);

    private final MatcherProperties props;
    private final Clock clock;

    public CandidateSelectionService(MatcherProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    /**
     * Makes {@code candidateId} the active selection, recording the outgoing one in the history.
     *
     * @return false when the candidate was already selected.
     * @throws NotFoundException when the scene has no such candidate.
     */
    public boolean select(Scene scene, String candidateId, ChangeSource changedBy, String reason) {
        Objects.requireNonNull(scene, "scene");
        SceneCandidate candidate = scene.findCandidate(candidateId)
                .orElseThrow(() -> new NotFoundException(
                        "Candidate " + candidateId + " not found in scene " + scene.getSceneId()));
        String outgoing = scene.getSelectedCandidateId();
        if (candidateId.equals(outgoing)) {
            return false;
        }
        if (outgoing != null) {
            scene.getSelectionHistory().add(new SelectionHistoryEntry(
                    newId("hist_"),
                    outgoing,
                    clock.instant(),
                    changedBy == null ? ChangeSource.USER : changedBy,
                    reason == null ? "" : reason));
            capHistory(scene);
        }
        scene.setSelectedCandidateId(candidateId);
        scene.setMatchedScene(MatchedScene.projectionOf(candidate));
        LOGGER.info("Selection changed scene={} from={} to={} by={}", scene.getSceneId(), outgoing, candidateId, changedBy);
        return true;
    }

    /**
     * Re-selects the candidate recorded by a history entry.
     *
     * @throws NotFoundException when the entry, or the candidate it names, is gone.
     */
    public boolean restore(Scene scene, String entryId, ChangeSource changedBy, String reason) {
        SelectionHistoryEntry entry = scene.getSelectionHistory().stream()
                .filter(e -> e.entryId().equals(entryId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException(
                        "History entry " + entryId + " not found in scene " + scene.getSceneId()));
        return select(scene, entry.candidateId(), changedBy, reason);
    }

    /**
     * Edits the selected candidate's timing. Not a re-selection, so no history entry is written.
     */
    public void trim(Scene scene, double startTime, double endTime) {
        if (scene.getSelectedCandidateId() == null) {
            throw new InvalidStateException("Scene " + scene.getSceneId() + " has no selected candidate to trim");
        }
        SceneCandidate selected = scene.getSelectedCandidate()
                .orElseThrow(() -> new InvalidStateException("Selected candidate " + scene.getSelectedCandidateId()
                        + " of scene " + scene.getSceneId() + " no longer exists"));
        if (startTime < 0 || endTime <= startTime) {
            throw new IllegalArgumentException("Trim requires 0 <= start < end (got " + startTime + ", " + endTime + ")");
        }
        selected.setStartTime(startTime);
        selected.setEndTime(endTime);
        selected.setUpdatedAt(clock.instant());
        scene.setMatchedScene(MatchedScene.projectionOf(selected));
        LOGGER.info("Selection trimmed scene={} candidate={} start={} end={}",
                scene.getSceneId(), selected.getCandidateId(), startTime, endTime);
    }

    /**
     * Replaces the ranked candidate list. An existing selection is kept even when its id is not in the new list;
     * such a selection is reported as dangling and {@code matched_scene} keeps its last projection.
     */
    public ReplaceOutcome replaceCandidates(Scene scene, List<SceneCandidate> candidates, boolean autoSelectBest) {
        Objects.requireNonNull(candidates, "candidates");
        for (SceneCandidate candidate : candidates) {
            if (candidate.getEndTime() <= candidate.getStartTime()) {
                throw new IllegalArgumentException("Candidate end_time must be greater than start_time (scene "
                        + scene.getSceneId() + ")");
            }
        }
        Instant now = clock.instant();
        Set<String> ids = new HashSet<>();
        List<SceneCandidate> accepted = new ArrayList<>(candidates.size());
        for (SceneCandidate candidate : candidates) {
            if (candidate.getCandidateId() == null || !ids.add(candidate.getCandidateId())) {
                candidate.setCandidateId(uniqueCandidateId(ids));
            }
            if (candidate.getCreatedAt() == null) candidate.setCreatedAt(now);
            candidate.setUpdatedAt(now);
            accepted.add(candidate);
        }
        scene.setCandidates(accepted);
        capShortlist(scene);

        boolean autoSelected = false;
        String dangling = null;
        if (scene.getSelectedCandidateId() == null) {
            if (autoSelectBest && !accepted.isEmpty()) {
                SceneCandidate best = accepted.stream().min(Comparator.comparingInt(SceneCandidate::getRank)).orElseThrow();
                autoSelected = select(scene, best.getCandidateId(), ChangeSource.AGENT, "Auto-selected best candidate");
            }
        } else if (scene.isSelectionDangling()) {
            dangling = scene.getSelectedCandidateId();
            LOGGER.warn("Selection left dangling scene={} selected={} candidates={}",
                    scene.getSceneId(), dangling, accepted.size());
        } else {
            scene.setMatchedScene(MatchedScene.projectionOf(scene.getSelectedCandidate().orElseThrow()));
        }
        return new ReplaceOutcome(accepted.size(), scene.getSelectedCandidateId(), autoSelected, dangling);
    }

    /**
     * Builds ranked candidates from analysis results, best first.
     */
    public List<SceneCandidate> fromClips(List<CandidateClip> clips, boolean keepOriginalAudio) {
        List<SceneCandidate> out = new ArrayList<>(clips.size());
        for (CandidateClip clip : clips) {
            SceneCandidate candidate = new SceneCandidate(null, clip.videoId(), clip.startSeconds(), clip.endSeconds(), out.size() + 1);
            candidate.setDescription(clip.description() == null ? "" : clip.description());
            candidate.setRationale(clip.rationale() == null ? "" : clip.rationale());
            candidate.setKeepOriginalAudio(keepOriginalAudio);
            out.add(candidate);
        }
        return out;
    }

    public List<SceneCandidate> fromHandpicked(List<HandpickedCandidate> picks) {
        List<SceneCandidate> out = new ArrayList<>(picks.size());
        for (HandpickedCandidate pick : picks) {
            SceneCandidate candidate = new SceneCandidate(null, pick.sourceVideoId(), pick.startTime(), pick.endTime(), out.size() + 1);
            candidate.setDescription(pick.description() == null ? "" : pick.description());
            candidate.setKeepOriginalAudio(pick.keepOriginalAudio());
            out.add(candidate);
        }
        return out;
    }

    /**
     * Replaces the candidates with an agent's picks and selects the one at {@code selectedIndex}.
     */
    public ReplaceOutcome setHandpicked(Scene scene, List<HandpickedCandidate> picks, int selectedIndex) {
        if (picks == null || picks.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate is required for scene " + scene.getSceneId());
        }
        if (selectedIndex < 0 || selectedIndex >= picks.size()) {
            throw new IllegalArgumentException("selected_index " + selectedIndex + " out of range for scene "
                    + scene.getSceneId() + " (" + picks.size() + " candidates)");
        }
        List<SceneCandidate> candidates = fromHandpicked(picks);
        ReplaceOutcome replaced = replaceCandidates(scene, candidates, false);
        String chosen = candidates.get(selectedIndex).getCandidateId();
        select(scene, chosen, ChangeSource.AGENT, "Picked from reviewed match results");
        return new ReplaceOutcome(replaced.candidateCount(), chosen, false, null);
    }

    /**
     * Re-applies the scene invariants to state read from storage.
     */
    public void enforceInvariants(Scene scene) {
        capShortlist(scene);
        capHistory(scene);
        scene.getSelectedCandidate().ifPresent(c -> scene.setMatchedScene(MatchedScene.projectionOf(c)));
    }

    private void capShortlist(Scene scene) {
        int cap = props.getShortlistCap();
        List<SceneCandidate> shortlisted = scene.getCandidates().stream()
                .filter(SceneCandidate::isShortlisted)
                .sorted(Comparator.comparingInt(SceneCandidate::getRank))
                .toList();
        for (int i = cap; i < shortlisted.size(); i++) {
            shortlisted.get(i).setShortlisted(false);
        }
    }

    private void capHistory(Scene scene) {
        List<SelectionHistoryEntry> history = scene.getSelectionHistory();
        while (history.size() > props.getHistoryCap()) {
            history.remove(0);
        }
    }

    private static String uniqueCandidateId(Set<String> taken) {
        String id;
        do {
            id = newId("cand_");
        } while (!taken.add(id));
        return id;
    }

    private static String newId(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
