package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * One scene of a single-stage match batch.
 *
 * @param sceneId            storyboard scene to match.
 * @param candidateVideoIds  library videos to inspect, at most five.
 * @param notes              visual direction for the scene.
 * @param durationSeconds    target length used when the scene has no measured voice-over.
 * @param startOffsetSeconds optional analysis window start, in source seconds.
 * @param endOffsetSeconds   optional analysis window end, in source seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneMatchRequest(
        @NotBlank String sceneId,
        List<String> candidateVideoIds,
        String notes,
        @Positive Double durationSeconds,
        Double startOffsetSeconds,
        Double endOffsetSeconds
) {
    public SceneMatchRequest(String sceneId, List<String> candidateVideoIds, String notes) {
        this(sceneId, candidateVideoIds, notes, null, null, null);
    }
}
