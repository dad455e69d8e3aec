package com.example.storyboard_matcher.service.command;

import com.example.storyboard_matcher.model.ChangeSource;

public record RestoreSelectionCommand(String sessionId,
                                      String sceneId,
                                      String entryId,
                                      ChangeSource changedBy,
                                      String reason) implements StoryboardCommand {

    @Override
    public <R> R accept(StoryboardCommandVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
