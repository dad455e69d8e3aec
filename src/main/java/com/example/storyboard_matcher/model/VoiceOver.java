package com.example.storyboard_matcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Narration generated for a scene.
 *
 * @param script   narration text.
 * @param duration measured audio length in seconds, {@code null} until synthesized.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VoiceOver(String script, Double duration) {

    public boolean hasDuration() {
        return duration != null && duration > 0;
    }
}
