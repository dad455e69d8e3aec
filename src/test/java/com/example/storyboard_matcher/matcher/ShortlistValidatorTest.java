package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.dto.ShortlistClip;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ShortlistValidatorTest {

    private final ShortlistValidator validator = new ShortlistValidator(new MatcherProperties());
    private final Map<String, Double> durations = Map.of("v1", 100.0, "v2", 40.0);

    private static List<ShortlistClip> windows(int count) {
        List<ShortlistClip> clips = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            clips.add(new ShortlistClip("v1", i * 10.0, i * 10.0 + 9.0, "window " + i));
        }
        return clips;
    }

    @Test
    void windowMustBeStrictlyLongerThanTarget() {
        ShortlistValidator.Result result = validator.validate(List.of(
                new ShortlistClip("v1", 10.0, 16.0, "exact"),
                new ShortlistClip("v1", 20.0, 26.01, "just longer")), durations, 6.0);

        assertThat(result.isRejected()).isFalse();
        assertThat(result.clips()).extracting(ShortlistClip::reason).containsExactly("just longer");
        assertThat(result.warnings()).singleElement().asString().startsWith("Dropped shortlist clip:");
    }

    @Test
    void moreThanFiveWindowsRejectsWholeShortlist() {
        ShortlistValidator.Result six = validator.validate(windows(6), durations, 6.0);
        ShortlistValidator.Result seven = validator.validate(windows(7), durations, 6.0);

        assertThat(six.isRejected()).isTrue();
        assertThat(six.clips()).isEmpty();
        assertThat(six.error()).isEqualTo("Shortlist rejected: model returned more than 5 clips (got 6).");
        assertThat(seven.clips().size()).isLessThanOrEqualTo(5);
        assertThat(seven.isRejected()).isTrue();
    }

    @Test
    void fiveWindowsAreAccepted() {
        ShortlistValidator.Result result = validator.validate(windows(5), durations, 6.0);

        assertThat(result.isRejected()).isFalse();
        assertThat(result.clips()).hasSize(5);
    }

    @Test
    void nothingLeftAfterSpanFilterIsAWarningNotAnError() {
        ShortlistValidator.Result result = validator.validate(List.of(
                new ShortlistClip("v1", 0.0, 5.0, "short")), durations, 6.0);

        assertThat(result.isRejected()).isFalse();
        assertThat(result.clips()).isEmpty();
        assertThat(result.warnings()).last().asString()
                .isEqualTo("Shortlist returned no review clips after post-filtering (required: clip duration > 6.000s).");
    }

    @Test
    void smallEndOverrunIsClampedLargeOneRejects() {
        ShortlistValidator.Result clamped = validator.validate(List.of(
                new ShortlistClip("v2", 20.0, 40.4, "near end")), durations, 6.0);
        assertThat(clamped.isRejected()).isFalse();
        assertThat(clamped.clips()).singleElement().extracting(ShortlistClip::endTime).isEqualTo(40.0);

        ShortlistValidator.Result rejected = validator.validate(List.of(
                new ShortlistClip("v2", 20.0, 41.0, "past end")), durations, 6.0);
        assertThat(rejected.isRejected()).isTrue();
        assertThat(rejected.error()).contains("exceeds video duration at position 1");
    }

    @Test
    void unknownVideoOrOverlongSpanRejects() {
        assertThat(validator.validate(List.of(new ShortlistClip("v9", 0.0, 10.0, "?")), durations, 6.0).error())
                .isEqualTo("Shortlist rejected: unknown video_id at position 1: v9");
        assertThat(validator.validate(List.of(new ShortlistClip("v1", 0.0, 99.0, "long"),
                new ShortlistClip("v1", 0.0, 10.0, "ok")), Map.of("v1", 300.0), 6.0).isRejected()).isFalse();
        assertThat(validator.validate(List.of(new ShortlistClip("v1", 0.0, 130.0, "too long")), Map.of("v1", 300.0), 6.0).error())
                .isEqualTo("Shortlist rejected: span > 120s at position 1.");
    }
}
