package com.example.storyboard_matcher.library;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Precomputed per-video scene analysis used by the shortlist stage. Built off the request path.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneIndex(List<VideoEntry> videos) {

    public SceneIndex {
        videos = videos == null ? List.of() : List.copyOf(videos);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record VideoEntry(String videoId,
                             String filename,
                             Double videoDuration,
                             List<EligibleScene> eligibleScenes,
                             List<ExcludedScene> excludedScenes) {
        public VideoEntry {
            eligibleScenes = eligibleScenes == null ? List.of() : List.copyOf(eligibleScenes);
            excludedScenes = excludedScenes == null ? List.of() : List.copyOf(excludedScenes);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record EligibleScene(String sceneId,
                                double startTime,
                                double endTime,
                                Double duration,
                                String visualSummary,
                                SemanticMeaning semanticMeaning,
                                List<String> searchableKeywords) {
        public double effectiveDuration() {
            return duration != null ? duration : Math.max(0.0, endTime - startTime);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SemanticMeaning(String narrativePurpose,
                                  String featureShowcased,
                                  String painPointDepicted,
                                  String emotionalTone) {
    }

    /**
     * A sub-scene ruled out for voice-over use (talking head, captions, edge-case speaker, testimony, bad timing).
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExcludedScene(String sceneId, double startTime, double endTime, List<String> reasons) {
    }
}
