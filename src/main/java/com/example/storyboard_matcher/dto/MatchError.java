package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A hard failure inside a batch, scoped to a scene and optionally to one video.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchError(String sceneId, String videoId, String error) {

    public static MatchError forScene(String sceneId, String error) {
        return new MatchError(sceneId, null, error);
    }
}
