package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.MatchError;
import com.example.storyboard_matcher.dto.SceneMatchRequest;
import com.example.storyboard_matcher.engine.Interfaces.VisualAnalysisClient;
import com.example.storyboard_matcher.exception.MatcherException;
import com.example.storyboard_matcher.exception.NotFoundException;
import com.example.storyboard_matcher.library.MediaAsset;
import com.example.storyboard_matcher.library.MediaLibrary;
import com.example.storyboard_matcher.model.AnalysisWindow;
import com.example.storyboard_matcher.model.AudioMode;
import com.example.storyboard_matcher.model.Scene;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns a batch of scene match requests into match jobs. A bad request only produces an error for itself.
 */
@Component
public class MatchJobBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(MatchJobBuilder.class);

    static final String DURATION_OVERRIDE_WARNING =
            "duration_seconds was provided without a voice over; used it as the target duration for matching.";
    static final String VOICE_OVER_DURATION_MISSING =
            "Voice over duration missing for this scene. Generate voice overs first, or provide duration_seconds.";

    private final MediaLibrary mediaLibrary;
    private final Validator validator;
    private final MatcherProperties props;

    public MatchJobBuilder(MediaLibrary mediaLibrary, Validator validator, MatcherProperties props) {
        this.mediaLibrary = mediaLibrary;
        this.validator = validator;
        this.props = props;
    }

    public JobPlan build(String tenantId, List<Scene> scenes, List<SceneMatchRequest> requests) {
        Map<String, Scene> scenesById = scenes.stream()
                .collect(Collectors.toMap(Scene::getSceneId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        List<MatchJob> jobs = new ArrayList<>();
        List<MatchError> errors = new ArrayList<>();
        Map<String, List<String>> warnings = new LinkedHashMap<>();
        Set<String> sceneOrder = new LinkedHashSet<>();

        for (SceneMatchRequest request : requests) {
            if (request == null) continue;
            if (request.sceneId() != null) sceneOrder.add(request.sceneId());
            RequestOutcome outcome = jobsFor(tenantId, scenesById, request, warnings);
            if (outcome.error() != null) {
                errors.add(MatchError.forScene(request.sceneId(), outcome.error()));
            } else {
                jobs.addAll(outcome.jobs());
            }
        }

        LOGGER.info("MatchJobBuilder done tenant={} requests={} jobs={} rejected={}",
                tenantId, requests.size(), jobs.size(), errors.size());
        return new JobPlan(jobs, errors, warnings, new ArrayList<>(sceneOrder));
    }

    private RequestOutcome jobsFor(String tenantId,
                                   Map<String, Scene> scenesById,
                                   SceneMatchRequest request,
                                   Map<String, List<String>> warnings) {
        Set<ConstraintViolation<SceneMatchRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining("; "));
            return RequestOutcome.rejected("Invalid scene match request: " + detail);
        }

        Scene scene = scenesById.get(request.sceneId());
        if (scene == null) {
            return RequestOutcome.rejected("Storyboard scene id not found: " + request.sceneId());
        }

        List<String> videoIds = request.candidateVideoIds() == null
                ? List.of()
                : new ArrayList<>(new LinkedHashSet<>(request.candidateVideoIds()));
        if (videoIds.isEmpty()) {
            return RequestOutcome.rejected("No candidate videos provided.");
        }
        if (videoIds.size() > props.getMaxCandidateVideos()) {
            return RequestOutcome.rejected("Provide up to " + props.getMaxCandidateVideos() + " candidate video ids.");
        }

        List<MediaAsset> videos = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String videoId : videoIds) {
            try {
                videos.add(mediaLibrary.resolve(tenantId, videoId));
            } catch (NotFoundException e) {
                missing.add(videoId);
            } catch (MatcherException e) {
                LOGGER.warn("MatchJobBuilder library failure tenant={} scene={} videoId={} err={}",
                        tenantId, request.sceneId(), videoId, e.getMessage());
                return RequestOutcome.rejected("Media library unavailable: " + e.getMessage());
            }
        }
        if (!missing.isEmpty()) {
            return RequestOutcome.rejected("Video id(s) not found: " + String.join(", ", missing));
        }

        Double targetDuration;
        Optional<Double> voiceOverDuration = scene.getVoiceOverDuration();
        if (voiceOverDuration.isPresent()) {
            targetDuration = voiceOverDuration.get();
        } else if (request.durationSeconds() != null) {
            targetDuration = request.durationSeconds();
        } else if (scene.isUseVoiceOver()) {
            return RequestOutcome.rejected(VOICE_OVER_DURATION_MISSING);
        } else {
            targetDuration = null;
        }

        String windowError = windowError(request);
        if (windowError != null) {
            return RequestOutcome.rejected(windowError);
        }
        AnalysisWindow window = request.startOffsetSeconds() == null
                ? null
                : new AnalysisWindow(request.startOffsetSeconds(), request.endOffsetSeconds());

        if (voiceOverDuration.isEmpty() && request.durationSeconds() != null) {
            warnings.computeIfAbsent(scene.getSceneId(), k -> new ArrayList<>()).add(DURATION_OVERRIDE_WARNING);
        }

        AudioMode mode = AudioMode.forScene(scene);
        List<MatchJob> jobs = new ArrayList<>(videos.size());
        for (MediaAsset video : videos) {
            jobs.add(new MatchJob(scene, video, mode, request.notes(), targetDuration, window,
                    VisualAnalysisClient.Stage.SINGLE));
        }
        return new RequestOutcome(jobs, null);
    }

    private static String windowError(SceneMatchRequest request) {
        Double start = request.startOffsetSeconds();
        Double end = request.endOffsetSeconds();
        if (start == null && end == null) {
            return null;
        }
        if (start == null || end == null) {
            return "Provide both start_offset_seconds and end_offset_seconds, or omit both.";
        }
        if (start < 0) {
            return "start_offset_seconds must be >= 0.";
        }
        if (end <= start) {
            return "end_offset_seconds must be greater than start_offset_seconds.";
        }
        return null;
    }

    private record RequestOutcome(List<MatchJob> jobs, String error) {
        static RequestOutcome rejected(String error) {
            return new RequestOutcome(List.of(), error);
        }
    }
}
