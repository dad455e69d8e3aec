package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.library.SceneIndex;
import com.example.storyboard_matcher.model.Scene;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.example.storyboard_matcher.util.MessageText.clean;

/**
 * Builds the text-only shortlist brief: the target scene plus compact cards for every indexed video.
 */
@Component
public class ShortlistBriefBuilder {
    private static final int MAX_KEYWORDS = 4;

    public String build(Scene scene, String notes, double targetDuration, List<SceneIndex.VideoEntry> videos) {
        return String.format(Locale.ROOT, """
                You are an expert video editor shortlisting footage for a voice-over scene.

                ### TASK
                This is step one of two. Return broad review windows only; a second pass inspects each
                window and trims the final clip inside it.

                ### AUDIO MODE: REPLACE WITH VOICE OVER
                Source audio is replaced, so the visuals must carry the script on their own.

                ### VISUAL RULES (CRITICAL)
                - No talking heads speaking to camera.
                - No burned-in subtitles.
                - No speaker shown inside a screen region (picture-in-picture, call window, TV, laptop, phone).
                - Visually compatible with the script and the notes.
                - Avoid visuals that stay static for the whole window.

                ### SELECTION BAR
                Only shortlist windows that cover ALL main talking points of the script. A near miss
                (the right idea for a different company, the solution shown while the script describes a pain)
                is not a match.

                ### HARD CONSTRAINTS
                - at most 5 review_clips
                - each clip lies within one video and spans <= 120 seconds
                - each clip span is STRICTLY greater than target_duration_seconds
                - start_time >= 0 and end_time > start_time
                - use only eligible_scenes; never use excluded_scenes
                - windows may span several adjacent eligible scenes

                ### OUTPUT SCHEMA
                {"review_clips":[{"video_id":"...","start_time":12.3,"end_time":68.0,"reason":"..."}],"notes":"optional"}

                %s
                %s""", targetBlock(scene, notes, targetDuration), videoContextBlock(videos));
    }

    String targetBlock(Scene scene, String notes, double targetDuration) {
        return String.format(Locale.ROOT, """
                ### TARGET SCENE
                - scene_id: `%s`
                - title: %s
                - purpose: %s
                - target_duration_seconds: %.3f
                - script: %s
                - notes: %s
                """,
                scene.getSceneId(),
                orDefault(clean(scene.getTitle(), 140), "(untitled)"),
                orDefault(clean(scene.getPurpose(), 220), "(none)"),
                targetDuration,
                orDefault(clean(scene.getScript(), 800), "(none)"),
                orDefault(clean(notes, 500), "(none)"));
    }

    String videoContextBlock(List<SceneIndex.VideoEntry> videos) {
        if (videos == null || videos.isEmpty()) {
            return "### VIDEO LIBRARY CONTEXT\nNo videos available.\n";
        }
        List<String> lines = new ArrayList<>();
        lines.add("### VIDEO LIBRARY CONTEXT");
        lines.add("");
        for (SceneIndex.VideoEntry video : videos) {
            String videoId = clean(video.videoId(), 80);
            if (videoId.isEmpty()) continue;
            lines.add("#### VIDEO `" + videoId + "`");
            lines.add("- filename: `" + orDefault(clean(video.filename(), 140), "(unknown)") + "`");
            lines.add("- video_duration: `" + (video.videoDuration() == null
                    ? "unknown"
                    : String.format(Locale.ROOT, "%.3fs", video.videoDuration())) + "`");
            lines.add("- eligible_scene_count: `" + video.eligibleScenes().size() + "`");
            lines.add("- excluded_scene_count: `" + video.excludedScenes().size() + "`");
            lines.add("- eligible_scenes:");
            if (video.eligibleScenes().isEmpty()) {
                lines.add("  - (none)");
            }
            for (SceneIndex.EligibleScene card : video.eligibleScenes()) {
                lines.add(eligibleCard(card));
            }
            lines.add("- excluded_scenes:");
            if (video.excludedScenes().isEmpty()) {
                lines.add("  - (none)");
            }
            for (SceneIndex.ExcludedScene excluded : video.excludedScenes()) {
                List<String> reasons = new ArrayList<>();
                if (excluded.reasons() != null) {
                    for (String reason : excluded.reasons()) {
                        String cleaned = clean(reason, 40);
                        if (!cleaned.isEmpty()) reasons.add(cleaned);
                    }
                }
                lines.add("  - `" + orDefault(clean(excluded.sceneId(), 80), "unknown_scene") + "` | reasons: "
                        + (reasons.isEmpty() ? "unspecified" : String.join(", ", reasons)));
            }
            lines.add("");
        }
        return String.join("\n", lines).stripTrailing() + "\n";
    }

    private String eligibleCard(SceneIndex.EligibleScene card) {
        SceneIndex.SemanticMeaning meaning = card.semanticMeaning() == null
                ? new SceneIndex.SemanticMeaning(null, null, null, null)
                : card.semanticMeaning();
        List<String> keywords = new ArrayList<>();
        if (card.searchableKeywords() != null) {
            for (String keyword : card.searchableKeywords()) {
                String cleaned = clean(keyword, 30);
                if (!cleaned.isEmpty()) keywords.add(cleaned);
                if (keywords.size() >= MAX_KEYWORDS) break;
            }
        }
        return String.format(Locale.ROOT,
                "  - `%s` | %.3f-%.3fs (%.3fs) | visual: %s | purpose: %s | feature: %s | pain: %s | tone: %s | keywords: %s",
                orDefault(clean(card.sceneId(), 80), "unknown_scene"),
                card.startTime(),
                card.endTime(),
                card.effectiveDuration(),
                orDefault(clean(card.visualSummary(), 220), "(none)"),
                orDefault(clean(meaning.narrativePurpose(), 60), "unknown"),
                orDefault(clean(meaning.featureShowcased(), 80), "none"),
                orDefault(clean(meaning.painPointDepicted(), 80), "none"),
                orDefault(clean(meaning.emotionalTone(), 60), "neutral"),
                keywords.isEmpty() ? "none" : String.join(", ", keywords));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
