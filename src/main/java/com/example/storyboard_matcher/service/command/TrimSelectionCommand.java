package com.example.storyboard_matcher.service.command;

public record TrimSelectionCommand(String sessionId, String sceneId, double startTime, double endTime)
        implements StoryboardCommand {

    @Override
    public <R> R accept(StoryboardCommandVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
