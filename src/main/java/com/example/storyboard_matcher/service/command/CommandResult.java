package com.example.storyboard_matcher.service.command;

import com.example.storyboard_matcher.dto.SceneMatchBatchResponse;
import com.example.storyboard_matcher.model.Scene;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param matches        match results, set for matching commands.
 * @param updatedScenes  scenes whose candidates or selection changed.
 * @param warnings       storyboard-wide warnings after the change.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CommandResult(SceneMatchBatchResponse matches, List<Scene> updatedScenes, List<String> warnings) {

    public CommandResult {
        updatedScenes = updatedScenes == null ? List.of() : List.copyOf(updatedScenes);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static CommandResult matched(SceneMatchBatchResponse matches, List<Scene> updatedScenes, List<String> warnings) {
        return new CommandResult(matches, updatedScenes, warnings);
    }

    public static CommandResult updated(List<Scene> updatedScenes, List<String> warnings) {
        return new CommandResult(null, updatedScenes, warnings);
    }
}
