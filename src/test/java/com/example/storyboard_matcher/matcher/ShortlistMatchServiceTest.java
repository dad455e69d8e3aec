package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.CandidateClip;
import com.example.storyboard_matcher.dto.MatchError;
import com.example.storyboard_matcher.dto.SceneMatchBatchResponse;
import com.example.storyboard_matcher.dto.SceneMatchV2Request;
import com.example.storyboard_matcher.dto.SceneResult;
import com.example.storyboard_matcher.dto.ShortlistClip;
import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer;
import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer.MediaHandle;
import com.example.storyboard_matcher.engine.Interfaces.VisualAnalysisClient;
import com.example.storyboard_matcher.exception.MatcherException;
import com.example.storyboard_matcher.library.MediaAsset;
import com.example.storyboard_matcher.library.MediaLibrary;
import com.example.storyboard_matcher.library.SceneIndex;
import com.example.storyboard_matcher.library.SceneIndexReader;
import com.example.storyboard_matcher.model.Scene;
import com.example.storyboard_matcher.model.VoiceOver;
import com.example.storyboard_matcher.util.TimestampCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class ShortlistMatchServiceTest {

    private ExecutorService executor;
    private InMemoryMediaLibrary library;
    private SceneIndex index;
    private final Map<String, String> shortlistReplies = new ConcurrentHashMap<>();
    private final List<VisualAnalysisClient.Request> deepRequests = new CopyOnWriteArrayList<>();
    private final List<String> preparedLocators = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(6);
        library = new InMemoryMediaLibrary()
                .add("vid_a", 120, true)
                .add("vid_b", 90, false)
                .add("vid_new", 30, true);
        index = new SceneIndex(List.of(
                entry("vid_a"),
                entry("vid_b"),
                entry("vid_gone")));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static SceneIndex.VideoEntry entry(String videoId) {
        return new SceneIndex.VideoEntry(videoId, videoId + ".mp4", 100.0,
                List.of(new SceneIndex.EligibleScene("s1", 0.0, 20.0, null, "Dashboard tour",
                        new SceneIndex.SemanticMeaning("demo", "dashboard", null, "calm"), List.of("dashboard", "chart"))),
                List.of(new SceneIndex.ExcludedScene("s2", 20.0, 30.0, List.of("talking head"))));
    }

    private static Scene voiceOverScene(String id, Double duration) {
        Scene scene = new Scene(id, "Title " + id, "Purpose", "Narration " + id, true);
        if (duration != null) scene.setVoiceOver(new VoiceOver("Narration " + id, duration));
        return scene;
    }

    private static String window(String videoId, double start, double end) {
        return "{\"video_id\":\"" + videoId + "\",\"start_time\":" + start + ",\"end_time\":" + end + ",\"reason\":\"fits\"}";
    }

    private VisualAnalysisClient client() {
        return request -> {
            if (request.stage() == VisualAnalysisClient.Stage.SHORTLIST) {
                String sceneId = request.label().split(":")[0];
                return new VisualAnalysisClient.Reply(shortlistReplies.get(sceneId), null, null);
            }
            deepRequests.add(request);
            String videoId = request.label().split(":")[1];
            double start = request.window().startSeconds() + 1.0;
            return new VisualAnalysisClient.Reply("{\"candidates\":[{\"video_id\":\"" + videoId + "\","
                    + "\"start_timestamp\":\"" + TimestampCodec.format(start) + "\","
                    + "\"end_timestamp\":\"" + TimestampCodec.format(start + 8.0) + "\","
                    + "\"description\":\"d\",\"rationale\":\"r\",\"no_talking_heads_confirmed\":true,"
                    + "\"no_subtitles_confirmed\":true,\"no_camera_recording_on_edge_of_frame_confirmed\":true,"
                    + "\"clip_compatible_with_scene_script_confirmed\":true}]}", null, null);
        };
    }

    private ShortlistMatchService service(Optional<SceneIndex> maybeIndex) {
        return service(maybeIndex, library);
    }

    private ShortlistMatchService service(Optional<SceneIndex> maybeIndex, MediaLibrary mediaLibrary) {
        MatcherProperties props = new MatcherProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        VisualAnalysisClient client = client();
        MediaResourcePreparer preparer = locator -> {
            preparedLocators.add(locator);
            return new MediaHandle("files/" + locator, "video/mp4", "files/" + locator);
        };
        SceneIndexReader reader = tenantId -> maybeIndex;
        return new ShortlistMatchService(
                client,
                new AnalysisExecutor(client, new SceneBriefBuilder(), objectMapper, props),
                new ShortlistBriefBuilder(),
                new ShortlistValidator(props),
                mediaLibrary,
                reader,
                preparer,
                Validation.buildDefaultValidatorFactory().getValidator(),
                objectMapper,
                executor,
                props);
    }

    @Test
    void shortlistedWindowsAreDeepAnalyzedOnVoicelessSource() {
        shortlistReplies.put("scene_1", "{\"review_clips\":["
                + window("vid_a", 10.0, 25.0) + ","
                + window("vid_a", 40.0, 48.0) + "],\"notes\":\"two spots\"}");

        SceneMatchBatchResponse response = service(Optional.of(index)).match("tenant",
                List.of(voiceOverScene("scene_1", 8.0)), List.of(new SceneMatchV2Request("scene_1", "show charts")));

        assertThat(response.errors()).isEmpty();
        assertThat(response.resultFor("scene_1").candidates()).singleElement().satisfies(c -> {
            assertThat(c.videoId()).isEqualTo("vid_a");
            assertThat(c.startSeconds()).isEqualTo(11.0);
        });
        assertThat(response.shortlistReviewClips().get("scene_1")).extracting(ShortlistClip::startTime).containsExactly(10.0);
        assertThat(response.notes().get("scene_1")).contains("[shortlist] two spots");
        assertThat(response.warnings().get("scene_1"))
                .contains("Skipped 1 library video(s) missing scene-analysis entries in index.")
                .contains("Ignored 1 index video(s) no longer present in library.")
                .anyMatch(w -> w.startsWith("Dropped shortlist clip:"));

        assertThat(deepRequests).singleElement().satisfies(r -> {
            assertThat(r.stage()).isEqualTo(VisualAnalysisClient.Stage.DEEP);
            assertThat(r.window().startSeconds()).isEqualTo(10.0);
            assertThat(r.window().endSeconds()).isEqualTo(25.0);
            assertThat(r.brief()).contains("Shortlist reason: fits");
        });
        assertThat(preparedLocators).containsExactly("videos_voiceless/vid_a.mp4");
    }

    @Test
    void rejectedShortlistFailsOnlyItsScene() {
        List<String> six = new ArrayList<>();
        for (int i = 0; i < 6; i++) six.add(window("vid_a", i * 15.0, i * 15.0 + 12.0));
        shortlistReplies.put("scene_1", "{\"review_clips\":[" + String.join(",", six) + "]}");
        shortlistReplies.put("scene_2", "{\"review_clips\":[" + window("vid_a", 60.0, 75.0) + "]}");

        SceneMatchBatchResponse response = service(Optional.of(index)).match("tenant",
                List.of(voiceOverScene("scene_1", 8.0), voiceOverScene("scene_2", 8.0)),
                List.of(new SceneMatchV2Request("scene_1", ""), new SceneMatchV2Request("scene_2", "")));

        assertThat(response.results()).extracting(SceneResult::sceneId).containsExactly("scene_1", "scene_2");
        assertThat(response.resultFor("scene_1").candidates()).isEmpty();
        assertThat(response.errorsFor("scene_1")).singleElement().extracting(MatchError::error)
                .isEqualTo("Shortlist rejected: model returned more than 5 clips (got 6).");
        assertThat(response.resultFor("scene_2").candidates()).hasSize(1);
        assertThat(response.errorsFor("scene_2")).isEmpty();
    }

    @Test
    void windowWithoutVoicelessSourceFailsAloneSiblingsContinue() {
        shortlistReplies.put("scene_1", "{\"review_clips\":["
                + window("vid_b", 10.0, 25.0) + ","
                + window("vid_a", 30.0, 45.0) + "]}");

        SceneMatchBatchResponse response = service(Optional.of(index)).match("tenant",
                List.of(voiceOverScene("scene_1", 8.0)), List.of(new SceneMatchV2Request("scene_1", "")));

        assertThat(response.resultFor("scene_1").candidates()).extracting(CandidateClip::videoId).containsExactly("vid_a");
        assertThat(response.errors()).singleElement().satisfies(e -> {
            assertThat(e.videoId()).isEqualTo("vid_b");
            assertThat(e.error()).isEqualTo("Voiceless source not found for deep analysis: vid_b");
        });
    }

    @Test
    void routingGuardsRejectUnsuitableScenes() {
        Scene talking = new Scene("scene_talk", "Talk", "Trust", "", false);
        SceneMatchBatchResponse response = service(Optional.of(index)).match("tenant",
                List.of(talking, voiceOverScene("scene_novo", null)),
                List.of(new SceneMatchV2Request("scene_talk", ""),
                        new SceneMatchV2Request("scene_novo", ""),
                        new SceneMatchV2Request("scene_missing", "")));

        assertThat(response.results()).extracting(SceneResult::sceneId)
                .containsExactly("scene_talk", "scene_novo", "scene_missing");
        assertThat(response.errors()).extracting(MatchError::error).containsExactly(
                "Scene scene_talk does not use voice over; use the single-stage matcher for original-audio scenes.",
                "Scene scene_novo is missing voice-over duration. Generate voice overs first.",
                "Storyboard scene id not found: scene_missing");
        assertThat(deepRequests).isEmpty();
    }

    @Test
    void missingIndexFailsEveryScene() {
        SceneMatchBatchResponse response = service(Optional.empty()).match("tenant",
                List.of(voiceOverScene("scene_1", 8.0), voiceOverScene("scene_2", 6.0)),
                List.of(new SceneMatchV2Request("scene_1", ""), new SceneMatchV2Request("scene_2", "")));

        assertThat(response.errors()).extracting(MatchError::error)
                .containsOnly(ShortlistMatchService.INDEX_MISSING)
                .hasSize(2);
    }

    @Test
    void unparseableShortlistIsASceneError() {
        shortlistReplies.put("scene_1", "{\"review_clips\": \"oops\"");

        SceneMatchBatchResponse response = service(Optional.of(index)).match("tenant",
                List.of(voiceOverScene("scene_1", 8.0)), List.of(new SceneMatchV2Request("scene_1", "")));

        assertThat(response.errorsFor("scene_1")).singleElement().extracting(MatchError::error).asString()
                .startsWith("Shortlist response validation error:");
        assertThat(response.resultFor("scene_1").candidates()).isEmpty();
    }

    @Test
    void libraryFailureIsReportedPerSceneWithoutAnalysis() {
        MediaLibrary broken = new MediaLibrary() {
            @Override
            public MediaAsset resolve(String tenantId, String videoId) {
                throw new MatcherException("Cannot read library manifest for tenant " + tenantId);
            }

            @Override
            public List<MediaAsset> listAssets(String tenantId) {
                throw new MatcherException("Cannot read library manifest for tenant " + tenantId);
            }
        };

        SceneMatchBatchResponse response = service(Optional.of(index), broken).match("tenant",
                List.of(voiceOverScene("scene_1", 8.0), voiceOverScene("scene_2", 6.0)),
                List.of(new SceneMatchV2Request("scene_1", ""), new SceneMatchV2Request("scene_2", "")));

        assertThat(response.errors()).extracting(MatchError::sceneId).containsExactly("scene_1", "scene_2");
        assertThat(response.errors()).extracting(MatchError::error)
                .containsOnly("Media library unavailable: Cannot read library manifest for tenant tenant");
        assertThat(preparedLocators).isEmpty();
        assertThat(deepRequests).isEmpty();
    }
}
