package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ShortlistPayload(List<ShortlistClip> reviewClips, String notes) {
    public ShortlistPayload {
        reviewClips = reviewClips == null ? List.of() : reviewClips;
    }
}
