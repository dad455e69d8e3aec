package com.example.storyboard_matcher.service.command;

import com.example.storyboard_matcher.dto.SceneCandidatesItem;

import java.util.List;

/**
 * Agent-curated candidates for one or more scenes. Applied all-or-nothing.
 */
public record SetSceneCandidatesCommand(String sessionId, List<SceneCandidatesItem> items)
        implements StoryboardCommand {

    public SetSceneCandidatesCommand {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public <R> R accept(StoryboardCommandVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
