package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * A clip picked for a scene from reviewed match results.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HandpickedCandidate(@NotBlank String sourceVideoId,
                                  @PositiveOrZero double startTime,
                                  double endTime,
                                  String description,
                                  boolean keepOriginalAudio) {
}
