package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.dto.CandidateClip;

import java.util.List;

/**
 * Result of analyzing one job.
 *
 * @param kind           {@link Kind#OK} when every candidate survived, {@link Kind#FILTERED} when some were
 *                       dropped by soft filters, {@link Kind#FAILED} when the job produced nothing usable.
 * @param sceneId        scene of the job.
 * @param videoId        video of the job.
 * @param candidates     surviving candidates in the service's ranking order, empty when failed.
 * @param notes          free-text commentary from the service, may be {@code null}.
 * @param droppedReasons one message per dropped candidate.
 * @param error          failure message, set only when failed.
 */
public record AnalysisOutcome(Kind kind,
                              String sceneId,
                              String videoId,
                              List<CandidateClip> candidates,
                              String notes,
                              List<String> droppedReasons,
                              String error) {

    public enum Kind {
        OK,
        FILTERED,
        FAILED
    }

    public AnalysisOutcome {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        droppedReasons = droppedReasons == null ? List.of() : List.copyOf(droppedReasons);
    }

    public static AnalysisOutcome ok(MatchJob job, List<CandidateClip> candidates, String notes) {
        return new AnalysisOutcome(Kind.OK, job.sceneId(), job.videoId(), candidates, notes, List.of(), null);
    }

    public static AnalysisOutcome filtered(MatchJob job, List<CandidateClip> candidates, String notes,
                                           List<String> droppedReasons) {
        return new AnalysisOutcome(Kind.FILTERED, job.sceneId(), job.videoId(), candidates, notes, droppedReasons, null);
    }

    public static AnalysisOutcome failed(MatchJob job, String error) {
        return new AnalysisOutcome(Kind.FAILED, job.sceneId(), job.videoId(), List.of(), null, List.of(), error);
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }
}
