package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.CandidateClip;
import com.example.storyboard_matcher.dto.MatchError;
import com.example.storyboard_matcher.dto.SceneMatchBatchResponse;
import com.example.storyboard_matcher.dto.SceneMatchRequest;
import com.example.storyboard_matcher.dto.SceneResult;
import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer;
import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer.MediaHandle;
import com.example.storyboard_matcher.engine.Interfaces.VisualAnalysisClient;
import com.example.storyboard_matcher.library.MediaAsset;
import com.example.storyboard_matcher.model.Scene;
import com.example.storyboard_matcher.model.VoiceOver;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SceneMatchServiceTest {

    private ExecutorService executor;
    private InMemoryMediaLibrary library;
    private List<Scene> scenes;
    private final Map<String, AtomicInteger> preparations = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        library = new InMemoryMediaLibrary()
                .add("vid_a", 60, true)
                .add("vid_b", 60, false)
                .add("vid_c", 60, true);
        scenes = List.of(voiceOverScene("scene_a"), voiceOverScene("scene_b"), voiceOverScene("scene_c"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Scene voiceOverScene(String id) {
        Scene scene = new Scene(id, "Title " + id, "Purpose", "Narration for " + id, true);
        scene.setVoiceOver(new VoiceOver("Narration for " + id, 8.0));
        return scene;
    }

    private MediaResourcePreparer countingPreparer() {
        return locator -> {
            preparations.computeIfAbsent(locator, k -> new AtomicInteger()).incrementAndGet();
            return new MediaHandle("files/" + locator, "video/mp4", "files/" + locator);
        };
    }

    /**
     * Echoes the job's own video id with one 8s clip.
     */
    private static VisualAnalysisClient echoingClient(Runnable during) {
        return request -> {
            during.run();
            String videoId = request.label().split(":")[1];
            return new VisualAnalysisClient.Reply("{\"candidates\":[{\"video_id\":\"" + videoId + "\","
                    + "\"start_timestamp\":\"00:10.000\",\"end_timestamp\":\"00:18.000\",\"description\":\"d\","
                    + "\"rationale\":\"r\",\"no_talking_heads_confirmed\":true,\"no_subtitles_confirmed\":true,"
                    + "\"no_camera_recording_on_edge_of_frame_confirmed\":true,"
                    + "\"clip_compatible_with_scene_script_confirmed\":true}],\"notes\":\"checked " + videoId + "\"}",
                    10, 5);
        };
    }

    private SceneMatchService service(VisualAnalysisClient client, MatcherProperties props) {
        ObjectMapper objectMapper = new ObjectMapper();
        MatchJobBuilder builder = new MatchJobBuilder(library, Validation.buildDefaultValidatorFactory().getValidator(), props);
        AnalysisExecutor analysisExecutor = new AnalysisExecutor(client, new SceneBriefBuilder(), objectMapper, props);
        return new SceneMatchService(builder, analysisExecutor, countingPreparer(), executor, props);
    }

    @Test
    void unknownVideoOnlyFailsItsOwnScene() {
        SceneMatchService service = service(echoingClient(() -> { }), new MatcherProperties());

        SceneMatchBatchResponse response = service.match("tenant", scenes, List.of(
                new SceneMatchRequest("scene_a", List.of("vid_a"), ""),
                new SceneMatchRequest("scene_b", List.of("vid_missing"), ""),
                new SceneMatchRequest("scene_c", List.of("vid_b", "vid_c"), "")));

        assertThat(response.results()).extracting(SceneResult::sceneId).containsExactly("scene_a", "scene_b", "scene_c");
        assertThat(response.resultFor("scene_a").candidates()).hasSize(1);
        assertThat(response.resultFor("scene_b").candidates()).isEmpty();
        assertThat(response.resultFor("scene_c").candidates()).extracting(CandidateClip::videoId)
                .containsExactly("vid_b", "vid_c");
        assertThat(response.errors()).extracting(MatchError::sceneId).containsExactly("scene_b");
        assertThat(response.notes().get("scene_c")).containsExactly("[vid_b] checked vid_b", "[vid_c] checked vid_c");
    }

    @Test
    void failingCallOnlyFailsItsOwnJob() {
        VisualAnalysisClient flaky = request -> {
            if (request.label().contains("vid_b")) {
                throw new IllegalStateException("timeout");
            }
            return echoingClient(() -> { }).propose(request);
        };
        SceneMatchService service = service(flaky, new MatcherProperties());

        SceneMatchBatchResponse response = service.match("tenant", scenes, List.of(
                new SceneMatchRequest("scene_a", List.of("vid_a", "vid_b", "vid_c"), "")));

        assertThat(response.resultFor("scene_a").candidates()).extracting(CandidateClip::videoId)
                .containsExactly("vid_a", "vid_c");
        assertThat(response.errors()).singleElement().satisfies(e -> {
            assertThat(e.videoId()).isEqualTo("vid_b");
            assertThat(e.error()).isEqualTo("LLM generation failed: timeout");
        });
    }

    @Test
    void inFlightCallsStayWithinLimit() {
        MatcherProperties props = new MatcherProperties();
        props.setMaxInFlight(2);
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        VisualAnalysisClient slow = echoingClient(() -> {
            int now = current.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(40);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                current.decrementAndGet();
            }
        });
        SceneMatchService service = service(slow, props);

        SceneMatchBatchResponse response = service.match("tenant", scenes, List.of(
                new SceneMatchRequest("scene_a", List.of("vid_a", "vid_b", "vid_c"), ""),
                new SceneMatchRequest("scene_b", List.of("vid_a", "vid_b", "vid_c"), ""),
                new SceneMatchRequest("scene_c", List.of("vid_a", "vid_b", "vid_c"), "")));

        assertThat(peak.get()).isBetween(1, 2);
        assertThat(response.errors()).isEmpty();
        assertThat(response.results()).allSatisfy(r -> assertThat(r.candidates()).hasSize(3));
    }

    @Test
    void eachVideoIsPreparedOncePerBatch() {
        SceneMatchService service = service(echoingClient(() -> { }), new MatcherProperties());

        service.match("tenant", scenes, List.of(
                new SceneMatchRequest("scene_a", List.of("vid_a", "vid_b"), ""),
                new SceneMatchRequest("scene_b", List.of("vid_a", "vid_b"), ""),
                new SceneMatchRequest("scene_c", List.of("vid_a"), "")));

        assertThat(preparations).hasSize(2);
        assertThat(preparations.values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
        assertThat(preparations).containsKeys("videos_voiceless/vid_a.mp4", "videos/vid_b.mp4");
    }

    @Test
    void preparedMediaIsNotSharedAcrossBatches() {
        SceneMatchService service = service(echoingClient(() -> { }), new MatcherProperties());
        List<SceneMatchRequest> requests = List.of(
                new SceneMatchRequest("scene_a", List.of("vid_a"), ""),
                new SceneMatchRequest("scene_b", List.of("vid_a"), ""));

        service.match("tenant", scenes, requests);
        service.match("tenant", scenes, requests);

        assertThat(preparations).containsOnlyKeys("videos_voiceless/vid_a.mp4");
        assertThat(preparations.get("videos_voiceless/vid_a.mp4").get()).isEqualTo(2);
    }

    @Test
    void voicelessVariantOnlyWhenNoJobNeedsOriginalAudio() {
        MediaAsset withVariant = new MediaAsset("vid_a", "a.mp4", 60, "videos/a.mp4", "videos_voiceless/a.mp4");
        MediaAsset withoutVariant = new MediaAsset("vid_b", "b.mp4", 60, "videos/b.mp4", null);

        assertThat(SceneMatchService.locatorFor(withVariant, Set.of())).isEqualTo("videos_voiceless/a.mp4");
        assertThat(SceneMatchService.locatorFor(withVariant, Set.of("vid_a"))).isEqualTo("videos/a.mp4");
        assertThat(SceneMatchService.locatorFor(withoutVariant, Set.of())).isEqualTo("videos/b.mp4");
    }

    @Test
    void emptyBatchReturnsEmptyResponse() {
        SceneMatchService service = service(echoingClient(() -> { }), new MatcherProperties());

        assertThat(service.match("tenant", scenes, List.of()).results()).isEmpty();
    }
}
