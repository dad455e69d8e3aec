package com.example.storyboard_matcher.service.Interfaces;

import com.example.storyboard_matcher.model.Scene;

import java.util.List;

/**
 * Durable scene state of storyboard sessions. The only writer of scenes.
 */
public interface StoryboardStore {

    /**
     * @throws com.example.storyboard_matcher.exception.NotFoundException when the session does not exist.
     */
    List<Scene> load(String sessionId);

    void save(String sessionId, List<Scene> scenes);

    void create(String sessionId, String tenantId, List<Scene> scenes);

    /**
     * Library owner of the session.
     */
    String tenantOf(String sessionId);
}
