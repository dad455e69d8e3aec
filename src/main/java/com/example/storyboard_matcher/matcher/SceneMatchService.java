package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.SceneMatchBatchResponse;
import com.example.storyboard_matcher.dto.SceneMatchRequest;
import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer;
import com.example.storyboard_matcher.library.MediaAsset;
import com.example.storyboard_matcher.model.AudioMode;
import com.example.storyboard_matcher.model.Scene;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Single-stage matcher: every requested scene is analyzed against each of its candidate videos.
 * <p>
 * All jobs of a batch run concurrently under one in-flight limit and the call returns once every job settled.
 */
@Service
public class SceneMatchService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneMatchService.class);

    private final MatchJobBuilder jobBuilder;
    private final AnalysisExecutor analysisExecutor;
    private final MediaResourcePreparer preparer;
    private final Executor executor;
    private final MatcherProperties props;

    public SceneMatchService(MatchJobBuilder jobBuilder,
                             AnalysisExecutor analysisExecutor,
                             MediaResourcePreparer preparer,
                             @Qualifier("matchTaskExecutor") Executor executor,
                             MatcherProperties props) {
        this.jobBuilder = jobBuilder;
        this.analysisExecutor = analysisExecutor;
        this.preparer = preparer;
        this.executor = executor;
        this.props = props;
    }

    /**
     * @param tenantId library owner.
     * @param scenes   scene snapshot taken at batch start.
     * @param requests per-scene requests; order is preserved in the response.
     */
    public SceneMatchBatchResponse match(String tenantId, List<Scene> scenes, List<SceneMatchRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return SceneMatchBatchResponse.empty();
        }
        long started = System.currentTimeMillis();
        JobPlan plan = jobBuilder.build(tenantId, scenes, requests);

        MatchResultAggregator aggregator = new MatchResultAggregator(plan.sceneOrder());
        aggregator.addErrors(plan.errors());
        aggregator.addWarnings(plan.warnings());

        List<MatchJob> jobs = plan.jobs();
        LOGGER.info("SceneMatch START tenant={} requests={} jobs={} rejected={} maxInFlight={}",
                tenantId, requests.size(), jobs.size(), plan.errors().size(), props.getMaxInFlight());

        if (!jobs.isEmpty()) {
            Set<String> needsOriginalAudio = jobs.stream()
                    .filter(job -> job.mode() == AudioMode.ORIGINAL_AUDIO)
                    .map(MatchJob::videoId)
                    .collect(Collectors.toSet());

            MatchBatch batch = MatchBatch.open(preparer, props.getMaxInFlight(), executor);
            List<CompletableFuture<AnalysisOutcome>> futures = new ArrayList<>(jobs.size());
            for (MatchJob job : jobs) {
                futures.add(analysisExecutor.submit(job, locatorFor(job.video(), needsOriginalAudio), batch));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            // Merge in job order so candidate order never depends on completion order.
            futures.forEach(future -> aggregator.accept(future.join()));
        }

        SceneMatchBatchResponse response = aggregator.build();
        LOGGER.info("SceneMatch DONE tenant={} scenes={} candidates={} errors={} latencyMs={}",
                tenantId,
                response.results().size(),
                response.results().stream().mapToInt(r -> r.candidates().size()).sum(),
                response.errors().size(),
                System.currentTimeMillis() - started);
        return response;
    }

    /**
     * The voice-stripped variant is used only when no job of this batch needs the video's original audio.
     */
    static String locatorFor(MediaAsset video, Set<String> needsOriginalAudio) {
        if (!needsOriginalAudio.contains(video.videoId()) && video.hasVoicelessVariant()) {
            return video.voicelessLocator();
        }
        return video.locator();
    }
}
