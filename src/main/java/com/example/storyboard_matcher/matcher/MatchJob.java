package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.engine.Interfaces.VisualAnalysisClient;
import com.example.storyboard_matcher.library.MediaAsset;
import com.example.storyboard_matcher.model.AnalysisWindow;
import com.example.storyboard_matcher.model.AudioMode;
import com.example.storyboard_matcher.model.Scene;

import java.util.Objects;

/**
 * One scene against one candidate video. Built per batch and consumed once.
 *
 * @param scene          snapshot of the scene taken at batch start.
 * @param video          candidate video.
 * @param mode           audio handling, drives the brief and the filters.
 * @param notes          caller's visual direction.
 * @param targetDuration clip length to aim for, {@code null} when unknown in original-audio mode.
 * @param window         optional sub-span of the video to analyze.
 * @param stage          pipeline stage the job belongs to.
 */
public record MatchJob(Scene scene,
                       MediaAsset video,
                       AudioMode mode,
                       String notes,
                       Double targetDuration,
                       AnalysisWindow window,
                       VisualAnalysisClient.Stage stage) {

    public MatchJob {
        Objects.requireNonNull(scene, "scene");
        Objects.requireNonNull(video, "video");
        Objects.requireNonNull(mode, "mode");
        notes = notes == null ? "" : notes;
        stage = stage == null ? VisualAnalysisClient.Stage.SINGLE : stage;
    }

    public String sceneId() {
        return scene.getSceneId();
    }

    public String videoId() {
        return video.videoId();
    }

    public String label() {
        return sceneId() + ":" + videoId() + ":" + mode.wireName();
    }
}
