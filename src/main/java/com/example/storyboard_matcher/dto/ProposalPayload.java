package com.example.storyboard_matcher.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Structured reply of a single-video analysis call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProposalPayload(List<ProposedClip> candidates, String notes) {

    public ProposalPayload {
        candidates = candidates == null ? List.of() : candidates;
    }

    /**
     * A ranked clip proposal as returned by the model. The four {@code *Confirmed} flags are only
     * requested in voice-over mode.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ProposedClip(String videoId,
                               String startTimestamp,
                               String endTimestamp,
                               String description,
                               String rationale,
                               Boolean noTalkingHeadsConfirmed,
                               Boolean noSubtitlesConfirmed,
                               Boolean noCameraRecordingOnEdgeOfFrameConfirmed,
                               Boolean clipCompatibleWithSceneScriptConfirmed) {

        public ProposedClip(String videoId, String startTimestamp, String endTimestamp,
                            String description, String rationale) {
            this(videoId, startTimestamp, endTimestamp, description, rationale, null, null, null, null);
        }
    }
}
