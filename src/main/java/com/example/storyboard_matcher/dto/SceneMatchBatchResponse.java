package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of a match batch. {@code results} has one entry per requested scene, in request order.
 *
 * @param results              per-scene candidates.
 * @param warnings             soft issues keyed by scene id.
 * @param errors               hard failures.
 * @param notes                model commentary keyed by scene id.
 * @param shortlistReviewClips review windows per scene, two-stage batches only.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneMatchBatchResponse(List<SceneResult> results,
                                      Map<String, List<String>> warnings,
                                      List<MatchError> errors,
                                      Map<String, List<String>> notes,
                                      Map<String, List<ShortlistClip>> shortlistReviewClips) {

    public static SceneMatchBatchResponse empty() {
        return new SceneMatchBatchResponse(List.of(), Map.of(), List.of(), Map.of(), Map.of());
    }

    public SceneResult resultFor(String sceneId) {
        return results.stream().filter(r -> r.sceneId().equals(sceneId)).findFirst().orElse(null);
    }

    public List<MatchError> errorsFor(String sceneId) {
        return errors.stream().filter(e -> sceneId.equals(e.sceneId())).toList();
    }
}
