package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A broad review window chosen by the shortlist stage.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ShortlistClip(String videoId, double startTime, double endTime, String reason) {

    public double span() {
        return endTime - startTime;
    }

    public ShortlistClip withEndTime(double newEnd) {
        return new ShortlistClip(videoId, startTime, newEnd, reason);
    }
}
