package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A validated clip proposal with parsed timing attached.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CandidateClip(String videoId,
                            String startTimestamp,
                            String endTimestamp,
                            double startSeconds,
                            double endSeconds,
                            String description,
                            String rationale) {

    public double durationSeconds() {
        return endSeconds - startSeconds;
    }
}
