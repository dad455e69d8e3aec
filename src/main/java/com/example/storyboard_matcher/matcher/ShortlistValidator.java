package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.ShortlistClip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validates the review windows returned by the shortlist stage.
 * <p>
 * Order: the raw count cap (too many windows rejects the whole shortlist), then the strict span filter
 * (windows not longer than the target are dropped with a warning), then per-window checks on the survivors,
 * where any failure rejects the whole shortlist.
 */
@Component
public class ShortlistValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortlistValidator.class);
    private static final double END_EPSILON_SECONDS = 0.01;

    private final MatcherProperties props;

    public ShortlistValidator(MatcherProperties props) {
        this.props = props;
    }

    /**
     * @param clips            windows as returned by the service.
     * @param videoDurations   durations of the videos the shortlist may reference.
     * @param targetDuration   scene target length in seconds.
     */
    public Result validate(List<ShortlistClip> clips, Map<String, Double> videoDurations, double targetDuration) {
        if (clips.size() > props.getShortlistMaxClips()) {
            return Result.rejected(String.format(Locale.ROOT,
                    "Shortlist rejected: model returned more than %d clips (got %d).",
                    props.getShortlistMaxClips(), clips.size()));
        }

        List<String> warnings = new ArrayList<>();
        List<ShortlistClip> longEnough = new ArrayList<>();
        for (ShortlistClip clip : clips) {
            double span = clip.span();
            if (span <= targetDuration) {
                String message = String.format(Locale.ROOT,
                        "Dropped shortlist clip: duration must be strictly longer than target scene duration. "
                                + "video_id=%s, start=%.3f, end=%.3f, clip_duration=%.3fs, target_duration=%.3fs",
                        clip.videoId(), clip.startTime(), clip.endTime(), span, targetDuration);
                LOGGER.warn("ShortlistFilter {}", message);
                warnings.add(message);
                continue;
            }
            longEnough.add(clip);
        }
        if (longEnough.isEmpty()) {
            warnings.add(String.format(Locale.ROOT,
                    "Shortlist returned no review clips after post-filtering (required: clip duration > %.3fs).",
                    targetDuration));
            return new Result(List.of(), warnings, null);
        }

        List<ShortlistClip> accepted = new ArrayList<>();
        for (int i = 0; i < longEnough.size(); i++) {
            int position = i + 1;
            ShortlistClip clip = longEnough.get(i);
            Double videoDuration = clip.videoId() == null ? null : videoDurations.get(clip.videoId());
            if (videoDuration == null) {
                return Result.rejected(warnings,
                        "Shortlist rejected: unknown video_id at position " + position + ": " + clip.videoId());
            }
            if (clip.startTime() < 0) {
                return Result.rejected(warnings, "Shortlist rejected: negative start time at position " + position + ".");
            }
            if (clip.endTime() > videoDuration + END_EPSILON_SECONDS) {
                double overrun = clip.endTime() - videoDuration;
                if (overrun <= props.getShortlistEndOverrunSeconds()) {
                    LOGGER.info("ShortlistClamp video={} end={} duration={}", clip.videoId(), clip.endTime(), videoDuration);
                    clip = clip.withEndTime(videoDuration);
                } else {
                    return Result.rejected(warnings, String.format(Locale.ROOT,
                            "Shortlist rejected: clip end exceeds video duration at position %d (%.3f > %.3f).",
                            position, clip.endTime(), videoDuration));
                }
            }
            if (clip.endTime() <= clip.startTime()) {
                return Result.rejected(warnings, "Shortlist rejected: invalid timing at position " + position + ".");
            }
            if (clip.span() > props.getShortlistMaxSpanSeconds()) {
                return Result.rejected(warnings, String.format(Locale.ROOT,
                        "Shortlist rejected: span > %.0fs at position %d.", props.getShortlistMaxSpanSeconds(), position));
            }
            accepted.add(clip);
        }
        return new Result(accepted, warnings, null);
    }

    /**
     * @param clips    windows to deep-analyze.
     * @param warnings soft issues, including dropped windows.
     * @param error    set when the whole shortlist was rejected.
     */
    public record Result(List<ShortlistClip> clips, List<String> warnings, String error) {
        static Result rejected(String error) {
            return new Result(List.of(), List.of(), error);
        }

        static Result rejected(List<String> warnings, String error) {
            return new Result(List.of(), List.copyOf(warnings), error);
        }

        public boolean isRejected() {
            return error != null;
        }
    }
}
