package com.example.storyboard_matcher.service.command;

/**
 * A request against one storyboard session. The set of implementations is closed; each is handled by a
 * dedicated method of {@link StoryboardCommandVisitor}.
 */
public interface StoryboardCommand {

    String sessionId();

    <R> R accept(StoryboardCommandVisitor<R> visitor);
}
