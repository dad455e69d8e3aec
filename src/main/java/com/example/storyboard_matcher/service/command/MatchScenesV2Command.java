package com.example.storyboard_matcher.service.command;

import com.example.storyboard_matcher.dto.SceneMatchV2Request;

import java.util.List;

/**
 * Two-stage matching for voice-over scenes, driven by the tenant's scene index.
 */
public record MatchScenesV2Command(String sessionId, List<SceneMatchV2Request> requests, boolean saveCandidates)
        implements StoryboardCommand {

    public MatchScenesV2Command {
        requests = requests == null ? List.of() : List.copyOf(requests);
    }

    @Override
    public <R> R accept(StoryboardCommandVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
