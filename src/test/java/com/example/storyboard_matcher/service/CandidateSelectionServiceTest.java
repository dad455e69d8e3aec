package com.example.storyboard_matcher.service;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.HandpickedCandidate;
import com.example.storyboard_matcher.exception.InvalidStateException;
import com.example.storyboard_matcher.exception.NotFoundException;
import com.example.storyboard_matcher.model.ChangeSource;
import com.example.storyboard_matcher.model.MatchedScene;
import com.example.storyboard_matcher.model.Scene;
import com.example.storyboard_matcher.model.SceneCandidate;
import com.example.storyboard_matcher.model.SelectionHistoryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateSelectionServiceTest {

    private CandidateSelectionService service;
    private Scene scene;

    @BeforeEach
    void setUp() {
        service = new CandidateSelectionService(new MatcherProperties(),
                Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC));
        scene = new Scene("scene_1", "Intro", "Hook", "", true);
    }

    private static SceneCandidate candidate(String id, int rank, double start, double end) {
        SceneCandidate candidate = new SceneCandidate(id, "vid_" + id, start, end, rank);
        candidate.setDescription("clip " + id);
        return candidate;
    }

    @Test
    void selectionLifecycle() {
        ReplaceOutcome outcome = service.replaceCandidates(scene,
                List.of(candidate("c1", 1, 10, 18), candidate("c2", 2, 30, 38)), true);

        assertThat(outcome.autoSelected()).isTrue();
        assertThat(scene.getSelectedCandidateId()).isEqualTo("c1");
        assertThat(scene.getSelectionHistory()).isEmpty();
        assertThat(scene.getMatchedScene().sourceVideoId()).isEqualTo("vid_c1");

        assertThat(service.select(scene, "c2", ChangeSource.USER, "prefer composition")).isTrue();
        assertThat(scene.getSelectedCandidateId()).isEqualTo("c2");
        assertThat(scene.getSelectionHistory()).singleElement().satisfies(entry -> {
            assertThat(entry.candidateId()).isEqualTo("c1");
            assertThat(entry.changedBy()).isEqualTo(ChangeSource.USER);
            assertThat(entry.reason()).isEqualTo("prefer composition");
            assertThat(entry.entryId()).matches("hist_[0-9a-f]{8}");
        });

        assertThat(service.select(scene, "c2", ChangeSource.USER, "again")).isFalse();
        assertThat(scene.getSelectionHistory()).hasSize(1);

        service.trim(scene, 2.0, 9.5);
        assertThat(scene.getMatchedScene().startTime()).isEqualTo(2.0);
        assertThat(scene.getMatchedScene().endTime()).isEqualTo(9.5);
        assertThat(scene.getMatchedScene().sourceVideoId()).isEqualTo("vid_c2");
        assertThat(scene.getSelectionHistory()).hasSize(1);
    }

    @Test
    void restoreSelectsHistoryEntryCandidate() {
        service.replaceCandidates(scene, List.of(candidate("c1", 1, 10, 18), candidate("c2", 2, 30, 38)), true);
        service.select(scene, "c2", ChangeSource.AGENT, "");
        String entryId = scene.getSelectionHistory().get(0).entryId();

        assertThat(service.restore(scene, entryId, ChangeSource.USER, "undo")).isTrue();

        assertThat(scene.getSelectedCandidateId()).isEqualTo("c1");
        assertThat(scene.getMatchedScene()).isEqualTo(MatchedScene.projectionOf(scene.findCandidate("c1").orElseThrow()));
        assertThat(scene.getSelectionHistory()).extracting(SelectionHistoryEntry::candidateId).containsExactly("c1", "c2");
    }

    @Test
    void unknownIdsAreNotFound() {
        service.replaceCandidates(scene, List.of(candidate("c1", 1, 10, 18)), false);

        assertThatThrownBy(() -> service.select(scene, "c9", ChangeSource.USER, ""))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.restore(scene, "hist_deadbeef", ChangeSource.USER, ""))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void trimWithoutSelectionIsInvalidState() {
        service.replaceCandidates(scene, List.of(candidate("c1", 1, 10, 18)), false);

        assertThat(scene.getSelectedCandidateId()).isNull();
        assertThatThrownBy(() -> service.trim(scene, 1.0, 2.0)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void trimRejectsInvertedRange() {
        service.replaceCandidates(scene, List.of(candidate("c1", 1, 10, 18)), true);

        assertThatThrownBy(() -> service.trim(scene, 5.0, 5.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void historyKeepsNewestTwentyEntries() {
        List<SceneCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < 26; i++) {
            candidates.add(candidate("c" + i, i + 1, i, i + 5));
        }
        service.replaceCandidates(scene, candidates, true);

        for (int i = 1; i <= 25; i++) {
            service.select(scene, "c" + i, ChangeSource.USER, "step " + i);
        }

        assertThat(scene.getSelectionHistory()).hasSize(20);
        assertThat(scene.getSelectionHistory().get(0).candidateId()).isEqualTo("c5");
        assertThat(scene.getSelectionHistory().get(19).candidateId()).isEqualTo("c24");
        assertThat(scene.getSelectedCandidateId()).isEqualTo("c25");
    }

    @Test
    void onlyFiveBestRankedStayShortlisted() {
        List<SceneCandidate> candidates = new ArrayList<>();
        for (int rank = 7; rank >= 1; rank--) {
            candidates.add(candidate("c" + rank, rank, rank, rank + 5));
        }

        service.replaceCandidates(scene, candidates, false);

        assertThat(scene.getCandidates()).filteredOn(SceneCandidate::isShortlisted)
                .extracting(SceneCandidate::getRank)
                .containsExactlyInAnyOrder(1, 2, 3, 4, 5);
    }

    @Test
    void replacementKeepsMissingSelectionAsDangling() {
        service.replaceCandidates(scene, List.of(candidate("c1", 1, 10, 18)), true);
        MatchedScene before = scene.getMatchedScene();

        ReplaceOutcome outcome = service.replaceCandidates(scene, List.of(candidate("c7", 1, 40, 48)), true);

        assertThat(outcome.isDangling()).isTrue();
        assertThat(outcome.danglingSelectionId()).isEqualTo("c1");
        assertThat(scene.getSelectedCandidateId()).isEqualTo("c1");
        assertThat(scene.isSelectionDangling()).isTrue();
        assertThat(scene.getMatchedScene()).isEqualTo(before);
        assertThatThrownBy(() -> service.trim(scene, 1.0, 2.0)).isInstanceOf(InvalidStateException.class);

        service.select(scene, "c7", ChangeSource.USER, "pick new");
        assertThat(scene.isSelectionDangling()).isFalse();
        assertThat(scene.getSelectionHistory()).extracting(SelectionHistoryEntry::candidateId).containsExactly("c1");
    }

    @Test
    void replacementReprojectsSurvivingSelection() {
        service.replaceCandidates(scene, List.of(candidate("c1", 1, 10, 18)), true);

        service.replaceCandidates(scene, List.of(candidate("c2", 1, 0, 4), candidate("c1", 2, 11, 19)), true);

        assertThat(scene.getSelectedCandidateId()).isEqualTo("c1");
        assertThat(scene.getMatchedScene().startTime()).isEqualTo(11.0);
    }

    @Test
    void invalidReplacementLeavesSceneUntouched() {
        service.replaceCandidates(scene, List.of(candidate("c1", 1, 10, 18)), true);
        SceneCandidate fresh = candidate(null, 1, 0, 4);

        assertThatThrownBy(() -> service.replaceCandidates(scene,
                List.of(fresh, candidate("c9", 2, 12, 12)), true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scene_1");

        assertThat(fresh.getCandidateId()).isNull();
        assertThat(fresh.getCreatedAt()).isNull();
        assertThat(fresh.getUpdatedAt()).isNull();
        assertThat(scene.getCandidates()).extracting(SceneCandidate::getCandidateId).containsExactly("c1");
        assertThat(scene.getSelectedCandidateId()).isEqualTo("c1");
    }

    @Test
    void generatedIdsAreUniqueWithinScene() {
        service.replaceCandidates(scene, List.of(candidate(null, 1, 0, 4), candidate(null, 2, 5, 9), candidate("dup", 3, 1, 2),
                candidate("dup", 4, 2, 3)), false);

        assertThat(scene.getCandidates()).extracting(SceneCandidate::getCandidateId).doesNotHaveDuplicates()
                .allSatisfy(id -> assertThat(id).isNotNull());
        assertThat(scene.getCandidates().get(0).getCandidateId()).matches("cand_[0-9a-f]{8}");
        assertThat(scene.getCandidates()).allSatisfy(c -> assertThat(c.getCreatedAt()).isEqualTo(Instant.parse("2026-01-05T10:00:00Z")));
    }

    @Test
    void handpickedCandidatesSelectChosenIndexAsAgent() {
        service.replaceCandidates(scene, List.of(candidate("c1", 1, 10, 18)), true);

        service.setHandpicked(scene, List.of(
                new HandpickedCandidate("vid_x", 1.0, 9.0, "first", false),
                new HandpickedCandidate("vid_y", 3.0, 11.0, "second", true)), 1);

        assertThat(scene.getCandidates()).extracting(SceneCandidate::getRank).containsExactly(1, 2);
        assertThat(scene.getSelectedCandidate().orElseThrow().getSourceVideoId()).isEqualTo("vid_y");
        assertThat(scene.getMatchedScene().keepOriginalAudio()).isTrue();
        assertThat(scene.getSelectionHistory()).singleElement().satisfies(entry -> {
            assertThat(entry.candidateId()).isEqualTo("c1");
            assertThat(entry.changedBy()).isEqualTo(ChangeSource.AGENT);
        });
        assertThatThrownBy(() -> service.setHandpicked(scene, List.of(new HandpickedCandidate("vid_x", 1.0, 9.0, "", false)), 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void enforceInvariantsRepairsStoredState() {
        service.replaceCandidates(scene, List.of(candidate("c1", 1, 10, 18)), true);
        scene.setMatchedScene(new MatchedScene("hand_edited", 0, 1, "", false));

        service.enforceInvariants(scene);

        assertThat(scene.getMatchedScene().sourceVideoId()).isEqualTo("vid_c1");
    }
}
