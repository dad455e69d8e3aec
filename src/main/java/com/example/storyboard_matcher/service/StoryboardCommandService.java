package com.example.storyboard_matcher.service;

import com.example.storyboard_matcher.dto.HandpickedCandidate;
import com.example.storyboard_matcher.dto.SceneCandidatesItem;
import com.example.storyboard_matcher.dto.SceneMatchBatchResponse;
import com.example.storyboard_matcher.dto.SceneResult;
import com.example.storyboard_matcher.exception.NotFoundException;
import com.example.storyboard_matcher.matcher.SceneMatchService;
import com.example.storyboard_matcher.matcher.ShortlistMatchService;
import com.example.storyboard_matcher.model.AudioMode;
import com.example.storyboard_matcher.model.ChangeSource;
import com.example.storyboard_matcher.model.Scene;
import com.example.storyboard_matcher.service.Interfaces.EventLog;
import com.example.storyboard_matcher.service.Interfaces.StoryboardStore;
import com.example.storyboard_matcher.service.command.CommandResult;
import com.example.storyboard_matcher.service.command.MatchScenesCommand;
import com.example.storyboard_matcher.service.command.MatchScenesV2Command;
import com.example.storyboard_matcher.service.command.RestoreSelectionCommand;
import com.example.storyboard_matcher.service.command.SelectCandidateCommand;
import com.example.storyboard_matcher.service.command.SetSceneCandidatesCommand;
import com.example.storyboard_matcher.service.command.StoryboardCommand;
import com.example.storyboard_matcher.service.command.StoryboardCommandVisitor;
import com.example.storyboard_matcher.service.command.TrimSelectionCommand;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point of the subsystem: loads the session's scenes, runs one command against them and persists the result.
 */
@Service
public class StoryboardCommandService implements StoryboardCommandVisitor<CommandResult> {
    private static final Logger LOGGER = LoggerFactory.getLogger(StoryboardCommandService.class);

    private final StoryboardStore store;
    private final EventLog eventLog;
    private final SceneMatchService sceneMatchService;
    private final ShortlistMatchService shortlistMatchService;
    private final CandidateSelectionService selectionService;
    private final StoryboardWarningService warningService;
    private final Validator validator;

    public StoryboardCommandService(StoryboardStore store,
                                    EventLog eventLog,
                                    SceneMatchService sceneMatchService,
                                    ShortlistMatchService shortlistMatchService,
                                    CandidateSelectionService selectionService,
                                    StoryboardWarningService warningService,
                                    Validator validator) {
        this.store = store;
        this.eventLog = eventLog;
        this.sceneMatchService = sceneMatchService;
        this.shortlistMatchService = shortlistMatchService;
        this.selectionService = selectionService;
        this.warningService = warningService;
        this.validator = validator;
    }

    public CommandResult execute(StoryboardCommand command) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(command.sessionId(), "sessionId");
        MDC.put("sessionId", command.sessionId());
        try {
            return command.accept(this);
        } finally {
            MDC.remove("sessionId");
        }
    }

    @Override
    public CommandResult visit(MatchScenesCommand command) {
        String sessionId = command.sessionId();
        List<Scene> scenes = store.load(sessionId);
        SceneMatchBatchResponse response = sceneMatchService.match(store.tenantOf(sessionId), scenes, command.requests());
        return afterMatch(sessionId, "v1", scenes, response, command.saveCandidates());
    }

    @Override
    public CommandResult visit(MatchScenesV2Command command) {
        String sessionId = command.sessionId();
        List<Scene> scenes = store.load(sessionId);
        SceneMatchBatchResponse response = shortlistMatchService.match(store.tenantOf(sessionId), scenes, command.requests());
        return afterMatch(sessionId, "v2", scenes, response, command.saveCandidates());
    }

    @Override
    public CommandResult visit(SelectCandidateCommand command) {
        List<Scene> scenes = store.load(command.sessionId());
        Scene scene = sceneOf(scenes, command.sceneId());
        MDC.put("sceneId", scene.getSceneId());
        try {
            boolean changed = selectionService.select(scene, command.candidateId(), command.changedBy(), command.reason());
            if (!changed) {
                return CommandResult.updated(List.of(), warningService.check(scenes));
            }
            store.save(command.sessionId(), scenes);
            eventLog.append(command.sessionId(), EventLog.SELECTION_CHANGED,
                    selectionPayload(scene, "select", command.changedBy(), command.reason()));
            return CommandResult.updated(List.of(scene), warningService.check(scenes));
        } finally {
            MDC.remove("sceneId");
        }
    }

    @Override
    public CommandResult visit(RestoreSelectionCommand command) {
        List<Scene> scenes = store.load(command.sessionId());
        Scene scene = sceneOf(scenes, command.sceneId());
        MDC.put("sceneId", scene.getSceneId());
        try {
            boolean changed = selectionService.restore(scene, command.entryId(), command.changedBy(), command.reason());
            if (!changed) {
                return CommandResult.updated(List.of(), warningService.check(scenes));
            }
            store.save(command.sessionId(), scenes);
            eventLog.append(command.sessionId(), EventLog.SELECTION_CHANGED,
                    selectionPayload(scene, "restore", command.changedBy(), command.reason()));
            return CommandResult.updated(List.of(scene), warningService.check(scenes));
        } finally {
            MDC.remove("sceneId");
        }
    }

    @Override
    public CommandResult visit(TrimSelectionCommand command) {
        List<Scene> scenes = store.load(command.sessionId());
        Scene scene = sceneOf(scenes, command.sceneId());
        MDC.put("sceneId", scene.getSceneId());
        try {
            selectionService.trim(scene, command.startTime(), command.endTime());
            store.save(command.sessionId(), scenes);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("scene_id", scene.getSceneId());
            payload.put("action", "trim");
            payload.put("candidate_id", scene.getSelectedCandidateId());
            payload.put("start_time", command.startTime());
            payload.put("end_time", command.endTime());
            eventLog.append(command.sessionId(), EventLog.SCENE_CANDIDATES_UPDATED, payload);
            return CommandResult.updated(List.of(scene), warningService.check(scenes));
        } finally {
            MDC.remove("sceneId");
        }
    }

    @Override
    public CommandResult visit(SetSceneCandidatesCommand command) {
        if (command.items().isEmpty()) {
            throw new IllegalArgumentException("At least one scene is required");
        }
        List<Scene> scenes = store.load(command.sessionId());
        Set<String> seen = new HashSet<>();
        for (SceneCandidatesItem item : command.items()) {
            checkItem(item);
            sceneOf(scenes, item.sceneId());
            if (!seen.add(item.sceneId())) {
                throw new IllegalArgumentException("Duplicate scene id in candidate update: " + item.sceneId());
            }
        }

        List<Scene> updated = new ArrayList<>();
        for (SceneCandidatesItem item : command.items()) {
            Scene scene = sceneOf(scenes, item.sceneId());
            selectionService.setHandpicked(scene, item.candidates(), item.selectedIndex());
            updated.add(scene);
        }
        store.save(command.sessionId(), scenes);
        for (Scene scene : updated) {
            eventLog.append(command.sessionId(), EventLog.SCENE_CANDIDATES_UPDATED, candidatesPayload(scene, "handpicked"));
        }
        LOGGER.info("Scene candidates set session={} scenes={}", command.sessionId(), updated.size());
        return CommandResult.updated(updated, warningService.check(scenes));
    }

    private CommandResult afterMatch(String sessionId,
                                     String version,
                                     List<Scene> scenes,
                                     SceneMatchBatchResponse response,
                                     boolean saveCandidates) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("version", version);
        summary.put("scenes", response.results().size());
        summary.put("candidates", response.results().stream().mapToInt(r -> r.candidates().size()).sum());
        summary.put("errors", response.errors().size());
        eventLog.append(sessionId, EventLog.MATCHING_COMPLETE, summary);

        if (!saveCandidates) {
            return CommandResult.matched(response, List.of(), List.of());
        }
        List<Scene> updated = new ArrayList<>();
        for (SceneResult result : response.results()) {
            if (result.candidates().isEmpty()) continue;
            Scene scene = findScene(scenes, result.sceneId());
            if (scene == null) continue;
            boolean keepAudio = AudioMode.forScene(scene) == AudioMode.ORIGINAL_AUDIO;
            selectionService.replaceCandidates(scene, selectionService.fromClips(result.candidates(), keepAudio), true);
            updated.add(scene);
        }
        if (!updated.isEmpty()) {
            store.save(sessionId, scenes);
            for (Scene scene : updated) {
                eventLog.append(sessionId, EventLog.SCENE_CANDIDATES_UPDATED, candidatesPayload(scene, "matched_" + version));
            }
        }
        return CommandResult.matched(response, updated, warningService.check(scenes));
    }

    private void checkItem(SceneCandidatesItem item) {
        if (item == null) {
            throw new IllegalArgumentException("Scene candidate item must not be null");
        }
        Set<ConstraintViolation<SceneCandidatesItem>> violations = validator.validate(item);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("Invalid candidates for scene " + item.sceneId() + ": "
                    + violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; ")));
        }
        for (HandpickedCandidate pick : item.candidates()) {
            if (pick.endTime() <= pick.startTime()) {
                throw new IllegalArgumentException("Candidate end_time must be greater than start_time (scene "
                        + item.sceneId() + ", video " + pick.sourceVideoId() + ")");
            }
        }
        if (item.selectedIndex() >= item.candidates().size()) {
            throw new IllegalArgumentException("selected_index " + item.selectedIndex() + " out of range for scene "
                    + item.sceneId());
        }
    }

    private static Scene sceneOf(List<Scene> scenes, String sceneId) {
        Scene scene = findScene(scenes, sceneId);
        if (scene == null) {
            throw new NotFoundException("Storyboard scene id not found: " + sceneId);
        }
        return scene;
    }

    private static Scene findScene(List<Scene> scenes, String sceneId) {
        if (sceneId == null) return null;
        return scenes.stream().filter(s -> sceneId.equals(s.getSceneId())).findFirst().orElse(null);
    }

    private static Map<String, Object> selectionPayload(Scene scene, String action, ChangeSource changedBy, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("scene_id", scene.getSceneId());
        payload.put("action", action);
        payload.put("candidate_id", scene.getSelectedCandidateId());
        payload.put("changed_by", changedBy == null ? ChangeSource.USER.wireName() : changedBy.wireName());
        payload.put("reason", reason == null ? "" : reason);
        return payload;
    }

    private static Map<String, Object> candidatesPayload(Scene scene, String source) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("scene_id", scene.getSceneId());
        payload.put("source", source);
        payload.put("candidates", scene.getCandidates().size());
        payload.put("selected_candidate_id", scene.getSelectedCandidateId());
        return payload;
    }
}
