package com.example.storyboard_matcher.service;

import com.example.storyboard_matcher.model.MatchedScene;
import com.example.storyboard_matcher.model.Scene;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Storyboard-wide checks reported after candidate changes. Never blocks a change.
 */
@Component
public class StoryboardWarningService {
    static final double VOICE_OVER_MISMATCH_RATIO = 0.10;
    static final double OVERLAP_THRESHOLD_SECONDS = 0.5;

    public List<String> check(List<Scene> scenes) {
        List<Scene> ordered = scenes.stream()
                .sorted(Comparator.comparingInt(Scene::getOrder))
                .toList();
        List<String> warnings = new ArrayList<>();
        for (Scene scene : ordered) {
            voiceOverMismatch(scene, warnings);
        }
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                overlap(ordered.get(i), ordered.get(j), warnings);
            }
        }
        return warnings;
    }

    private static void voiceOverMismatch(Scene scene, List<String> out) {
        MatchedScene matched = scene.getMatchedScene();
        if (!scene.isUseVoiceOver() || matched == null) return;
        scene.getVoiceOverDuration()
                .filter(vo -> vo > 0)
                .ifPresent(vo -> {
                    double ratio = Math.abs(matched.duration() - vo) / vo;
                    if (ratio > VOICE_OVER_MISMATCH_RATIO) {
                        out.add(String.format(Locale.ROOT,
                                "Scene %s: matched clip is %.2fs but voice over is %.2fs (%.0f%% off).",
                                scene.getSceneId(), matched.duration(), vo, ratio * 100));
                    }
                });
    }

    private static void overlap(Scene a, Scene b, List<String> out) {
        MatchedScene left = a.getMatchedScene();
        MatchedScene right = b.getMatchedScene();
        if (left == null || right == null || left.sourceVideoId() == null) return;
        if (!left.sourceVideoId().equals(right.sourceVideoId())) return;
        double shared = Math.min(left.endTime(), right.endTime()) - Math.max(left.startTime(), right.startTime());
        if (shared > OVERLAP_THRESHOLD_SECONDS) {
            out.add(String.format(Locale.ROOT,
                    "Scenes %s and %s reuse overlapping footage from video %s (%.2fs overlap).",
                    a.getSceneId(), b.getSceneId(), left.sourceVideoId(), shared));
        }
    }
}
