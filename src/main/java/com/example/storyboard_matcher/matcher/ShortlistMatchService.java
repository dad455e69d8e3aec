package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.MatchError;
import com.example.storyboard_matcher.dto.SceneMatchBatchResponse;
import com.example.storyboard_matcher.dto.SceneMatchV2Request;
import com.example.storyboard_matcher.dto.ShortlistClip;
import com.example.storyboard_matcher.dto.ShortlistPayload;
import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer;
import com.example.storyboard_matcher.engine.Interfaces.VisualAnalysisClient;
import com.example.storyboard_matcher.exception.MatcherException;
import com.example.storyboard_matcher.library.MediaAsset;
import com.example.storyboard_matcher.library.MediaLibrary;
import com.example.storyboard_matcher.library.SceneIndex;
import com.example.storyboard_matcher.library.SceneIndexReader;
import com.example.storyboard_matcher.model.AnalysisWindow;
import com.example.storyboard_matcher.model.AudioMode;
import com.example.storyboard_matcher.model.Scene;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Two-stage matcher for voice-over scenes.
 * <p>
 * Stage A asks the service for broad review windows using the tenant's scene index. Stage B deep-analyzes
 * every surviving window on the voice-stripped video. Shortlists of different scenes run concurrently, as do
 * the windows of one scene; a failure in either stage only affects its own scene or window.
 */
@Service
public class ShortlistMatchService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortlistMatchService.class);

    static final String INDEX_MISSING =
            "Scene analysis index not found for this library. Build the scene index before using the two-stage matcher.";

    private final VisualAnalysisClient client;
    private final AnalysisExecutor analysisExecutor;
    private final ShortlistBriefBuilder briefBuilder;
    private final ShortlistValidator validator;
    private final MediaLibrary mediaLibrary;
    private final SceneIndexReader indexReader;
    private final MediaResourcePreparer preparer;
    private final Validator beanValidator;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final MatcherProperties props;

    public ShortlistMatchService(VisualAnalysisClient client,
                                 AnalysisExecutor analysisExecutor,
                                 ShortlistBriefBuilder briefBuilder,
                                 ShortlistValidator validator,
                                 MediaLibrary mediaLibrary,
                                 SceneIndexReader indexReader,
                                 MediaResourcePreparer preparer,
                                 Validator beanValidator,
                                 ObjectMapper objectMapper,
                                 @Qualifier("matchTaskExecutor") Executor executor,
                                 MatcherProperties props) {
        this.client = client;
        this.analysisExecutor = analysisExecutor;
        this.briefBuilder = briefBuilder;
        this.validator = validator;
        this.mediaLibrary = mediaLibrary;
        this.indexReader = indexReader;
        this.preparer = preparer;
        this.beanValidator = beanValidator;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.props = props;
    }

    public SceneMatchBatchResponse match(String tenantId, List<Scene> scenes, List<SceneMatchV2Request> requests) {
        if (requests == null || requests.isEmpty()) {
            return SceneMatchBatchResponse.empty();
        }
        long started = System.currentTimeMillis();
        Map<String, Scene> scenesById = scenes.stream()
                .collect(Collectors.toMap(Scene::getSceneId, Function.identity(), (a, b) -> a));

        Set<String> sceneOrder = new LinkedHashSet<>();
        requests.stream().filter(r -> r != null && r.sceneId() != null).forEach(r -> sceneOrder.add(r.sceneId()));
        MatchResultAggregator aggregator = new MatchResultAggregator(new ArrayList<>(sceneOrder));

        List<SceneTarget> targets = new ArrayList<>();
        Set<String> accepted = new LinkedHashSet<>();
        for (SceneMatchV2Request request : requests) {
            if (request == null) continue;
            String error = rejectReason(request, scenesById);
            if (error != null) {
                aggregator.addError(MatchError.forScene(request.sceneId(), error));
                continue;
            }
            if (!accepted.add(request.sceneId())) {
                aggregator.addWarning(request.sceneId(), "Duplicate request for this scene ignored.");
                continue;
            }
            Scene scene = scenesById.get(request.sceneId());
            targets.add(new SceneTarget(scene, request.notes() == null ? "" : request.notes(),
                    scene.getVoiceOverDuration().orElseThrow()));
        }
        if (targets.isEmpty()) {
            return aggregator.build();
        }

        Optional<SceneIndex> index = indexReader.read(tenantId);
        if (index.isEmpty()) {
            targets.forEach(t -> aggregator.addError(MatchError.forScene(t.scene().getSceneId(), INDEX_MISSING)));
            return aggregator.build();
        }

        List<MediaAsset> assets;
        try {
            assets = mediaLibrary.listAssets(tenantId);
        } catch (MatcherException e) {
            LOGGER.warn("SceneMatchV2 library failure tenant={} err={}", tenantId, e.getMessage());
            String error = "Media library unavailable: " + e.getMessage();
            targets.forEach(t -> aggregator.addError(MatchError.forScene(t.scene().getSceneId(), error)));
            return aggregator.build();
        }
        Map<String, MediaAsset> assetsById = new LinkedHashMap<>();
        for (MediaAsset asset : assets) {
            assetsById.putIfAbsent(asset.videoId(), asset);
        }
        PreparedIndex prepared = prepareIndex(index.get(), assetsById);

        LOGGER.info("SceneMatchV2 START tenant={} scenes={} indexedVideos={} indexWarnings={}",
                tenantId, targets.size(), prepared.videos().size(), prepared.warnings().size());

        MatchBatch batch = MatchBatch.open(preparer, props.getMaxInFlight(), executor);
        List<CompletableFuture<SceneRun>> runs = new ArrayList<>();
        for (SceneTarget target : targets) {
            runs.add(runScene(target, prepared, assetsById, batch));
        }
        CompletableFuture.allOf(runs.toArray(new CompletableFuture[0])).join();
        runs.forEach(run -> run.join().applyTo(aggregator));

        SceneMatchBatchResponse response = aggregator.build();
        LOGGER.info("SceneMatchV2 DONE tenant={} scenes={} candidates={} errors={} latencyMs={}",
                tenantId,
                response.results().size(),
                response.results().stream().mapToInt(r -> r.candidates().size()).sum(),
                response.errors().size(),
                System.currentTimeMillis() - started);
        return response;
    }

    private String rejectReason(SceneMatchV2Request request, Map<String, Scene> scenesById) {
        Set<ConstraintViolation<SceneMatchV2Request>> violations = beanValidator.validate(request);
        if (!violations.isEmpty()) {
            return "Invalid scene match request: " + violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
        }
        Scene scene = scenesById.get(request.sceneId());
        if (scene == null) {
            return "Storyboard scene id not found: " + request.sceneId();
        }
        if (!scene.isUseVoiceOver()) {
            return "Scene " + scene.getSceneId()
                    + " does not use voice over; use the single-stage matcher for original-audio scenes.";
        }
        if (scene.getVoiceOverDuration().isEmpty()) {
            return "Scene " + scene.getSceneId() + " is missing voice-over duration. Generate voice overs first.";
        }
        return null;
    }

    /**
     * Restricts the index to videos that still exist in the library.
     */
    PreparedIndex prepareIndex(SceneIndex index, Map<String, MediaAsset> assetsById) {
        List<String> warnings = new ArrayList<>();
        List<SceneIndex.VideoEntry> usable = new ArrayList<>();
        Set<String> indexed = new LinkedHashSet<>();
        int stale = 0;
        for (SceneIndex.VideoEntry entry : index.videos()) {
            if (entry.videoId() == null || !indexed.add(entry.videoId())) continue;
            MediaAsset asset = assetsById.get(entry.videoId());
            if (asset == null) {
                stale++;
                continue;
            }
            usable.add(new SceneIndex.VideoEntry(
                    entry.videoId(),
                    asset.filename(),
                    asset.durationSeconds(),
                    entry.eligibleScenes(),
                    entry.excludedScenes()));
        }
        long missing = assetsById.keySet().stream().filter(id -> !indexed.contains(id)).count();
        if (missing > 0) {
            warnings.add("Skipped " + missing + " library video(s) missing scene-analysis entries in index.");
        }
        if (stale > 0) {
            warnings.add("Ignored " + stale + " index video(s) no longer present in library.");
        }
        if (usable.isEmpty()) {
            warnings.add("No usable videos in scene-analysis index after filtering.");
        }
        return new PreparedIndex(usable, warnings);
    }

    private CompletableFuture<SceneRun> runScene(SceneTarget target,
                                                 PreparedIndex index,
                                                 Map<String, MediaAsset> assetsById,
                                                 MatchBatch batch) {
        SceneRun run = new SceneRun(target.scene().getSceneId());
        index.warnings().forEach(run.warnings::add);

        return CompletableFuture
                .supplyAsync(() -> batch.gate().call(() -> shortlist(target, index)), batch.executor())
                .thenCompose(stageA -> {
                    if (stageA.notes() != null && !stageA.notes().isBlank()) {
                        run.notes.add("[shortlist] " + stageA.notes().trim());
                    }
                    if (stageA.error() != null) {
                        run.errors.add(MatchError.forScene(run.sceneId, stageA.error()));
                        return CompletableFuture.completedFuture(run);
                    }
                    Map<String, Double> durations = index.videos().stream()
                            .collect(Collectors.toMap(SceneIndex.VideoEntry::videoId, SceneIndex.VideoEntry::videoDuration));
                    ShortlistValidator.Result validated = validator.validate(stageA.clips(), durations, target.targetDuration());
                    run.warnings.addAll(validated.warnings());
                    if (validated.isRejected()) {
                        LOGGER.warn("SceneMatchV2 shortlist rejected scene={} error={}", run.sceneId, validated.error());
                        run.errors.add(MatchError.forScene(run.sceneId, validated.error()));
                        run.shortlist.addAll(stageA.clips());
                        return CompletableFuture.completedFuture(run);
                    }
                    run.shortlist.addAll(validated.clips());
                    return deepAnalyze(target, validated.clips(), assetsById, batch, run);
                })
                .exceptionally(ex -> {
                    LOGGER.warn("SceneMatchV2 scene failed scene={} error={}", run.sceneId, ex.toString());
                    run.errors.add(MatchError.forScene(run.sceneId, "Two-stage matching failed: " + ex.getMessage()));
                    return run;
                });
    }

    private CompletableFuture<SceneRun> deepAnalyze(SceneTarget target,
                                                    List<ShortlistClip> clips,
                                                    Map<String, MediaAsset> assetsById,
                                                    MatchBatch batch,
                                                    SceneRun run) {
        List<CompletableFuture<AnalysisOutcome>> windows = new ArrayList<>(clips.size());
        for (ShortlistClip clip : clips) {
            MediaAsset asset = assetsById.get(clip.videoId());
            MatchJob job = new MatchJob(
                    target.scene(),
                    asset,
                    AudioMode.VOICE_OVER,
                    target.notes() + "\nShortlist reason: " + (clip.reason() == null ? "" : clip.reason()),
                    target.targetDuration(),
                    new AnalysisWindow(clip.startTime(), clip.endTime()),
                    VisualAnalysisClient.Stage.DEEP);
            if (!asset.hasVoicelessVariant()) {
                windows.add(CompletableFuture.completedFuture(
                        AnalysisOutcome.failed(job, "Voiceless source not found for deep analysis: " + clip.videoId())));
                continue;
            }
            windows.add(analysisExecutor.submit(job, asset.voicelessLocator(), batch));
        }
        return CompletableFuture.allOf(windows.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    for (int i = 0; i < windows.size(); i++) {
                        AnalysisOutcome outcome = windows.get(i).join();
                        run.outcomes.add(outcome);
                        if (!outcome.isFailed() && outcome.candidates().isEmpty()) {
                            ShortlistClip clip = clips.get(i);
                            run.warnings.add(String.format(Locale.ROOT,
                                    "Deep analysis returned no usable candidates for clip video_id=%s, window=[%.3f, %.3f].",
                                    clip.videoId(), clip.startTime(), clip.endTime()));
                        }
                    }
                    return run;
                });
    }

    private StageA shortlist(SceneTarget target, PreparedIndex index) {
        String sceneId = target.scene().getSceneId();
        String brief = briefBuilder.build(target.scene(), target.notes(), target.targetDuration(), index.videos());
        VisualAnalysisClient.Reply reply;
        try {
            reply = client.propose(new VisualAnalysisClient.Request(
                    VisualAnalysisClient.Stage.SHORTLIST,
                    sceneId + ":shortlist",
                    null,
                    null,
                    brief,
                    ResponseSchema.SHORTLIST.schema()));
        } catch (RuntimeException e) {
            LOGGER.warn("SceneMatchV2 shortlist call failed scene={} error={}", sceneId, e.getMessage());
            return StageA.failed("Shortlist generation failed: " + e.getMessage());
        }
        if (reply == null || reply.text() == null || reply.text().isBlank()) {
            return StageA.failed("Shortlist returned an empty response.");
        }
        ShortlistPayload payload;
        try {
            payload = objectMapper.readValue(reply.text(), ShortlistPayload.class);
        } catch (JsonProcessingException e) {
            return StageA.failed("Shortlist response validation error: " + e.getOriginalMessage());
        }
        if (payload.reviewClips().stream().anyMatch(c -> c == null || c.videoId() == null)) {
            return new StageA(List.of(), payload.notes(), "Shortlist response validation error: review clip without video_id.");
        }
        LOGGER.info("SceneMatchV2 shortlist scene={} clips={} target={}",
                sceneId, payload.reviewClips().size(), target.targetDuration());
        return new StageA(payload.reviewClips(), payload.notes(), null);
    }

    private record SceneTarget(Scene scene, String notes, double targetDuration) {}

    record PreparedIndex(List<SceneIndex.VideoEntry> videos, List<String> warnings) {}

    private record StageA(List<ShortlistClip> clips, String notes, String error) {
        static StageA failed(String error) {
            return new StageA(List.of(), null, error);
        }
    }

    /**
     * Everything one scene contributes to the batch response. Mutated by a single stage at a time.
     */
    private static final class SceneRun {
        private final String sceneId;
        private final List<AnalysisOutcome> outcomes = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();
        private final List<MatchError> errors = new ArrayList<>();
        private final List<ShortlistClip> shortlist = new ArrayList<>();

        private SceneRun(String sceneId) {
            this.sceneId = sceneId;
        }

        void applyTo(MatchResultAggregator aggregator) {
            warnings.forEach(w -> aggregator.addWarning(sceneId, w));
            notes.forEach(n -> aggregator.addNote(sceneId, n));
            errors.forEach(aggregator::addError);
            outcomes.forEach(aggregator::accept);
            aggregator.setShortlistClips(sceneId, shortlist);
        }
    }
}
