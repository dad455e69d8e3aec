package com.example.storyboard_matcher.service.command;

public interface StoryboardCommandVisitor<R> {
    R visit(MatchScenesCommand command);

    R visit(MatchScenesV2Command command);

    R visit(SelectCandidateCommand command);

    R visit(RestoreSelectionCommand command);

    R visit(TrimSelectionCommand command);

    R visit(SetSceneCandidatesCommand command);
}
