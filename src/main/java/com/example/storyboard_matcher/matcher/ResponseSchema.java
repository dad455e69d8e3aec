package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.model.AudioMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON schemas handed to the analysis service so replies come back in a parseable shape.
 */
public enum ResponseSchema {
    CANDIDATES,
    VOICE_OVER_CANDIDATES,
    SHORTLIST;

    static final List<String> VOICE_OVER_FLAGS = List.of(
            "no_talking_heads_confirmed",
            "no_subtitles_confirmed",
            "no_camera_recording_on_edge_of_frame_confirmed",
            "clip_compatible_with_scene_script_confirmed");

    public static ResponseSchema forMode(AudioMode mode) {
        return mode == AudioMode.VOICE_OVER ? VOICE_OVER_CANDIDATES : CANDIDATES;
    }

    public Map<String, Object> schema() {
        return switch (this) {
            case CANDIDATES -> proposalSchema(false);
            case VOICE_OVER_CANDIDATES -> proposalSchema(true);
            case SHORTLIST -> shortlistSchema();
        };
    }

    private static Map<String, Object> proposalSchema(boolean voiceOver) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("video_id", stringType());
        properties.put("start_timestamp", stringType("MM:SS.mmm"));
        properties.put("end_timestamp", stringType("MM:SS.mmm"));
        properties.put("description", stringType());
        properties.put("rationale", stringType());
        List<String> required = new ArrayList<>(
                List.of("video_id", "start_timestamp", "end_timestamp", "description", "rationale"));
        if (voiceOver) {
            for (String flag : VOICE_OVER_FLAGS) {
                properties.put(flag, Map.of("type", "boolean"));
                required.add(flag);
            }
        }
        Map<String, Object> candidate = object(properties, required);
        return object(
                Map.of("candidates", Map.of("type", "array", "items", candidate),
                        "notes", stringType()),
                List.of("candidates"));
    }

    private static Map<String, Object> shortlistSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("video_id", stringType());
        properties.put("start_time", Map.of("type", "number"));
        properties.put("end_time", Map.of("type", "number"));
        properties.put("reason", stringType());
        Map<String, Object> clip = object(properties, List.of("video_id", "start_time", "end_time", "reason"));
        return object(
                Map.of("review_clips", Map.of("type", "array", "items", clip),
                        "notes", stringType()),
                List.of("review_clips"));
    }

    private static Map<String, Object> object(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.copyOf(required));
        return schema;
    }

    private static Map<String, Object> stringType() {
        return Map.of("type", "string");
    }

    private static Map<String, Object> stringType(String description) {
        return Map.of("type", "string", "description", description);
    }
}
