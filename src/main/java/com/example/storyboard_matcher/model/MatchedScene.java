package com.example.storyboard_matcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Canonical clip assignment of a scene. While a selected candidate exists this is a projection of it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchedScene(String sourceVideoId,
                           double startTime,
                           double endTime,
                           String description,
                           boolean keepOriginalAudio) {

    public static MatchedScene projectionOf(SceneCandidate candidate) {
        return new MatchedScene(
                candidate.getSourceVideoId(),
                candidate.getStartTime(),
                candidate.getEndTime(),
                candidate.getDescription(),
                candidate.isKeepOriginalAudio());
    }

    public double duration() {
        return Math.max(0.0, endTime - startTime);
    }
}
