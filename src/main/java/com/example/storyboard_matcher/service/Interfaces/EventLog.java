package com.example.storyboard_matcher.service.Interfaces;

import com.example.storyboard_matcher.model.StoryboardEvent;

import java.util.List;
import java.util.Map;

/**
 * Append-only activity log of a storyboard session.
 */
public interface EventLog {
    String MATCHING_COMPLETE = "matching_complete";
    String SCENE_CANDIDATES_UPDATED = "scene_candidates_updated";
    String SELECTION_CHANGED = "selection_changed";

    void append(String sessionId, String type, Map<String, Object> payload);

    List<StoryboardEvent> list(String sessionId);
}
