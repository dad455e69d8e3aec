package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.model.AnalysisWindow;
import com.example.storyboard_matcher.model.AudioMode;
import com.example.storyboard_matcher.model.Scene;
import com.example.storyboard_matcher.util.TimestampCodec;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Builds the natural-language instructions sent with each single-video analysis call.
 */
@Component
public class SceneBriefBuilder {

    public String build(MatchJob job) {
        return job.mode() == AudioMode.VOICE_OVER ? voiceOverBrief(job) : originalAudioBrief(job);
    }

    String durationSection(Double targetDuration) {
        if (targetDuration == null || targetDuration <= 0) {
            return "Pick the clip length that best fits the scene.";
        }
        return "Duration Target: " + targetDuration + "s (Tolerance: +/- 1s)";
    }

    String windowSection(AnalysisWindow window) {
        if (window == null) {
            return "";
        }
        return String.format(Locale.ROOT,
                "Analysis Window (Sub-Span):%n- Start: %.3fs%n- End: %.3fs%n"
                        + "- Analyze ONLY this window and return timestamps in absolute source-video time.%n",
                window.startSeconds(), window.endSeconds());
    }

    private String voiceOverBrief(MatchJob job) {
        Scene scene = job.scene();
        String script = scene.getScript() == null || scene.getScript().isBlank()
                ? "Voice-Over Script: (None)"
                : "Voice-Over Script: \"" + scene.getScript() + "\"";
        return String.format(Locale.ROOT, """
                You are an expert video editor finding a background clip for a voice-over.

                ### AUDIO MODE: REPLACE WITH VOICE OVER
                The source audio will be removed and replaced with narration.

                ### SCENE
                Scene Title: %s
                Scene Purpose: %s
                %s
                Editor Notes: %s

                ### VISUAL RULES (CRITICAL)
                - NO TALKING HEADS: never pick a moment where someone speaks to the camera.
                - NO EDGE CASES: no recorded speaker inside a screen, picture-in-picture or frame edge.
                - NO SUBTITLES: no burned-in captions or subtitle overlays.
                - COMPATIBLE WITH SCRIPT: on-screen text and widgets must not contradict the script.
                - NO STATIC SCENES: reject clips that hold one frame for the whole duration.

                ### MISSION
                1. Find one continuous clip matching the script and the notes.
                2. %s
                3. Only return clips that support every key point of the script. If unsure, return nothing.

                ### VIDEO TO EVALUATE
                - ID: %s
                - Filename: %s
                - Total Duration: %.1fs
                %s
                ### OUTPUT
                - Return up to 3 candidates, ranked best first.
                - Echo EXACTLY the video_id above.
                - Describe every logo, text and element visible in each clip.
                - Set each *_confirmed flag only if the clip truly satisfies that rule.

                Example:
                {"candidates":[{"video_id":"%s","start_timestamp":"00:12.500","end_timestamp":"00:20.500",\
                "description":"...","rationale":"...","no_talking_heads_confirmed":true,"no_subtitles_confirmed":true,\
                "no_camera_recording_on_edge_of_frame_confirmed":true,"clip_compatible_with_scene_script_confirmed":true}]}
                """,
                scene.getTitle(),
                scene.getPurpose(),
                script,
                job.notes(),
                durationSection(job.targetDuration()),
                job.videoId(),
                job.video().filename(),
                job.video().durationSeconds(),
                windowSection(job.window()),
                job.videoId());
    }

    private String originalAudioBrief(MatchJob job) {
        Scene scene = job.scene();
        String script = scene.getScript() == null || scene.getScript().isBlank()
                ? "Script/Target Line: (None)"
                : "Script/Target Line: \"" + scene.getScript() + "\"";
        return String.format(Locale.ROOT, """
                You are an expert video editor finding an on-camera speaking moment whose audio will be kept.

                ### AUDIO MODE: KEEP ORIGINAL AUDIO
                The clip's own speech plays in the final video.

                ### SCENE
                Scene Title: %s
                Scene Purpose: %s
                %s
                Editor Notes: %s

                ### RULES (CRITICAL)
                - TALKING HEAD REQUIRED: the speaker must be clearly visible on camera.
                - NO B-ROLL: avoid cutaways where the speaker is absent.
                - HARD IN/OUT TIMING: start on the first spoken word and end right after the final syllable.

                ### MISSION
                1. Find one continuous speaking clip that matches the scene.
                2. %s
                3. Align timestamps tightly to speech using both audio and visual cues.

                ### VIDEO TO EVALUATE
                - ID: %s
                - Filename: %s
                - Total Duration: %.1fs
                %s
                ### OUTPUT
                - Return up to 3 candidates, ranked best first.
                - Echo EXACTLY the video_id above.
                - Describe what is said and shown in each clip.

                Example:
                {"candidates":[{"video_id":"%s","start_timestamp":"%s","end_timestamp":"%s",\
                "description":"...","rationale":"..."}]}
                """,
                scene.getTitle(),
                scene.getPurpose(),
                script,
                job.notes(),
                durationSection(job.targetDuration()),
                job.videoId(),
                job.video().filename(),
                job.video().durationSeconds(),
                windowSection(job.window()),
                job.videoId(),
                TimestampCodec.format(12.5),
                TimestampCodec.format(30.0));
    }
}
