package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.CandidateClip;
import com.example.storyboard_matcher.dto.ProposalPayload;
import com.example.storyboard_matcher.dto.ProposalPayload.ProposedClip;
import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer.MediaHandle;
import com.example.storyboard_matcher.engine.Interfaces.VisualAnalysisClient;
import com.example.storyboard_matcher.exception.PreparationException;
import com.example.storyboard_matcher.exception.TimestampFormatException;
import com.example.storyboard_matcher.model.AnalysisWindow;
import com.example.storyboard_matcher.model.AudioMode;
import com.example.storyboard_matcher.util.TimestampCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs one match job: prepares the media through the batch cache, calls the analysis service under the
 * batch gate, then validates and filters the reply.
 * <p>
 * Structural problems (bad id echo, malformed timestamps, inverted ranges, window violations) fail the
 * whole job. Duration tolerance and voice-over self-checks drop single candidates.
 */
@Component
public class AnalysisExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisExecutor.class);
    private static final double RATIO_EPSILON = 1e-9;

    private final VisualAnalysisClient client;
    private final SceneBriefBuilder briefBuilder;
    private final ObjectMapper objectMapper;
    private final MatcherProperties props;

    public AnalysisExecutor(VisualAnalysisClient client,
                            SceneBriefBuilder briefBuilder,
                            ObjectMapper objectMapper,
                            MatcherProperties props) {
        this.client = client;
        this.briefBuilder = briefBuilder;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    /**
     * Schedules the job on the batch executor. The returned future always completes normally.
     */
    public CompletableFuture<AnalysisOutcome> submit(MatchJob job, String locator, MatchBatch batch) {
        return batch.cache().prepare(locator)
                .thenApplyAsync(handle -> batch.gate().call(() -> analyze(job, handle)), batch.executor())
                .exceptionally(ex -> {
                    Throwable cause = unwrap(ex);
                    String error = cause instanceof PreparationException
                            ? "Failed to upload video: " + cause.getMessage()
                            : "Analysis failed: " + cause.getMessage();
                    LOGGER.warn("AnalysisExecutor job failed job={} error={}", job.label(), error);
                    return AnalysisOutcome.failed(job, error);
                });
    }

    /**
     * Calls the service for a prepared video and validates the reply. Never throws for service or reply problems.
     */
    public AnalysisOutcome analyze(MatchJob job, MediaHandle media) {
        long started = System.nanoTime();
        VisualAnalysisClient.Reply reply;
        try {
            reply = client.propose(new VisualAnalysisClient.Request(
                    job.stage(),
                    job.label(),
                    media,
                    job.window(),
                    briefBuilder.build(job),
                    ResponseSchema.forMode(job.mode()).schema()));
        } catch (RuntimeException e) {
            return fail(job, "LLM generation failed: " + e.getMessage());
        }
        long latencyMs = (System.nanoTime() - started) / 1_000_000;

        if (reply == null || reply.text() == null || reply.text().isBlank()) {
            return fail(job, "Model returned an empty response.");
        }

        ProposalPayload payload;
        try {
            payload = objectMapper.readValue(reply.text(), ProposalPayload.class);
        } catch (JsonProcessingException e) {
            return fail(job, "Model response validation error: " + e.getOriginalMessage());
        }
        String shapeError = shapeError(payload);
        if (shapeError != null) {
            return fail(job, "Model response validation error: " + shapeError);
        }

        Set<String> badIds = new LinkedHashSet<>();
        for (ProposedClip clip : payload.candidates()) {
            if (!Objects.equals(clip.videoId(), job.videoId())) {
                badIds.add(clip.videoId());
            }
        }
        if (!badIds.isEmpty()) {
            return fail(job, "Model selected bad video_id(s): " + String.join(", ", badIds));
        }

        List<CandidateClip> normalized = new ArrayList<>();
        for (ProposedClip clip : payload.candidates()) {
            double start;
            double end;
            try {
                start = TimestampCodec.parse(clip.startTimestamp());
                end = TimestampCodec.parse(clip.endTimestamp());
            } catch (TimestampFormatException e) {
                return fail(job, "Invalid candidate timestamp: " + e.getMessage());
            }
            if (end <= start) {
                return fail(job, "Invalid candidate range " + clip.startTimestamp() + "-" + clip.endTimestamp()
                        + ": end_timestamp must be after start_timestamp.");
            }
            AnalysisWindow window = job.window();
            if (window != null && !window.contains(start, end, props.getWindowToleranceSeconds())) {
                return fail(job, String.format(Locale.ROOT,
                        "Candidate %s-%s is outside the analysis window %.3f-%.3fs.",
                        clip.startTimestamp(), clip.endTimestamp(), window.startSeconds(), window.endSeconds()));
            }
            normalized.add(new CandidateClip(
                    job.videoId(),
                    clip.startTimestamp(),
                    clip.endTimestamp(),
                    start,
                    end,
                    clip.description() == null ? "" : clip.description(),
                    clip.rationale() == null ? "" : clip.rationale()));
        }

        List<String> dropped = new ArrayList<>();
        List<CandidateClip> certified = new ArrayList<>();
        for (int i = 0; i < normalized.size(); i++) {
            CandidateClip candidate = normalized.get(i);
            List<String> failedChecks = job.mode() == AudioMode.VOICE_OVER
                    ? failedSelfChecks(payload.candidates().get(i))
                    : List.of();
            if (failedChecks.isEmpty()) {
                certified.add(candidate);
            } else {
                dropped.add(String.format(Locale.ROOT,
                        "Dropped candidate %s %s-%s: failed visual checks (%s).",
                        job.videoId(), candidate.startTimestamp(), candidate.endTimestamp(),
                        String.join(", ", failedChecks)));
            }
        }

        List<CandidateClip> kept = certified;
        if (job.mode() == AudioMode.VOICE_OVER && job.targetDuration() != null && job.targetDuration() > 0) {
            kept = new ArrayList<>();
            for (CandidateClip candidate : certified) {
                double ratio = durationMismatchRatio(candidate.durationSeconds(), job.targetDuration());
                if (ratio <= props.getDurationToleranceRatio() + RATIO_EPSILON) {
                    kept.add(candidate);
                } else {
                    String message = String.format(Locale.ROOT,
                            "Dropped candidate %s %s-%s: clip duration %.3fs deviates %.1f%% from target %.3fs (limit %.0f%%).",
                            job.videoId(), candidate.startTimestamp(), candidate.endTimestamp(),
                            candidate.durationSeconds(), ratio * 100, job.targetDuration(),
                            props.getDurationToleranceRatio() * 100);
                    LOGGER.info("DurationFilter scene={} video={} range={}-{} duration={} target={} mismatch={}",
                            job.sceneId(), job.videoId(), candidate.startTimestamp(), candidate.endTimestamp(),
                            candidate.durationSeconds(), job.targetDuration(), ratio);
                    dropped.add(message);
                }
            }
        }

        LOGGER.info("Analysis done job={} stage={} latencyMs={} in={} out={} proposed={} kept={} dropped={}",
                job.label(), job.stage(), latencyMs,
                reply.promptTokens() == null ? "?" : reply.promptTokens(),
                reply.outputTokens() == null ? "?" : reply.outputTokens(),
                payload.candidates().size(), kept.size(), dropped.size());

        return dropped.isEmpty()
                ? AnalysisOutcome.ok(job, kept, payload.notes())
                : AnalysisOutcome.filtered(job, kept, payload.notes(), dropped);
    }

    static double durationMismatchRatio(double clipDuration, double targetDuration) {
        return Math.abs(clipDuration - targetDuration) / targetDuration;
    }

    private static String shapeError(ProposalPayload payload) {
        for (int i = 0; i < payload.candidates().size(); i++) {
            ProposedClip clip = payload.candidates().get(i);
            if (clip == null) {
                return "candidate " + (i + 1) + " is null";
            }
            if (clip.videoId() == null) return "candidate " + (i + 1) + " is missing video_id";
            if (clip.startTimestamp() == null) return "candidate " + (i + 1) + " is missing start_timestamp";
            if (clip.endTimestamp() == null) return "candidate " + (i + 1) + " is missing end_timestamp";
        }
        return null;
    }

    private static List<String> failedSelfChecks(ProposedClip clip) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("no_talking_heads_confirmed", clip.noTalkingHeadsConfirmed());
        checks.put("no_subtitles_confirmed", clip.noSubtitlesConfirmed());
        checks.put("no_camera_recording_on_edge_of_frame_confirmed", clip.noCameraRecordingOnEdgeOfFrameConfirmed());
        checks.put("clip_compatible_with_scene_script_confirmed", clip.clipCompatibleWithSceneScriptConfirmed());
        List<String> failed = new ArrayList<>();
        checks.forEach((name, value) -> {
            if (!Boolean.TRUE.equals(value)) failed.add(name);
        });
        return failed;
    }

    private AnalysisOutcome fail(MatchJob job, String error) {
        LOGGER.warn("Analysis failed job={} error={}", job.label(), error);
        return AnalysisOutcome.failed(job, error);
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cursor = ex;
        while (cursor instanceof CompletionException && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }
}
