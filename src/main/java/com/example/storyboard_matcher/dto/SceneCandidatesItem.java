package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Ranked candidates (best first) for one scene, plus the index of the one to select.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneCandidatesItem(@NotBlank String sceneId,
                                  @NotEmpty List<@Valid HandpickedCandidate> candidates,
                                  @PositiveOrZero int selectedIndex) {
}
