package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/**
 * One voice-over scene for the shortlist/deep-analysis pipeline. Candidate videos come from the scene index.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneMatchV2Request(@NotBlank String sceneId, String notes) {
}
