package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneResult(String sceneId, List<CandidateClip> candidates) {
    public SceneResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
