package com.example.storyboard_matcher.service.command;

import com.example.storyboard_matcher.dto.SceneMatchRequest;

import java.util.List;

/**
 * Single-stage matching.
 *
 * @param saveCandidates when true, each scene's results replace its candidate list and the best one is
 *                       selected if the scene had no selection.
 */
public record MatchScenesCommand(String sessionId, List<SceneMatchRequest> requests, boolean saveCandidates)
        implements StoryboardCommand {

    public MatchScenesCommand {
        requests = requests == null ? List.of() : List.copyOf(requests);
    }

    @Override
    public <R> R accept(StoryboardCommandVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
