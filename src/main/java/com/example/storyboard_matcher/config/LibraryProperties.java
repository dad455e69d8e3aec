package com.example.storyboard_matcher.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location of the per-tenant media library on local disk.
 * Layout: {@code <baseDir>/<tenant>/<manifestName>}, {@code <baseDir>/<tenant>/<videosPrefix>/...}
 * and {@code <baseDir>/<tenant>/scene_analysis/<sceneIndexName>}.
 */
@ConfigurationProperties(prefix = "library")
public class LibraryProperties {
    private String baseDir = "./data/library";
    private String videosPrefix = "videos";
    private String voicelessPrefix = "videos_voiceless";
    private String manifestName = "library.json";
    private String sceneIndexName = "index_vo_v1.json";

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public String getVideosPrefix() {
        return videosPrefix;
    }

    public void setVideosPrefix(String videosPrefix) {
        this.videosPrefix = videosPrefix;
    }

    public String getVoicelessPrefix() {
        return voicelessPrefix;
    }

    public void setVoicelessPrefix(String voicelessPrefix) {
        this.voicelessPrefix = voicelessPrefix;
    }

    public String getManifestName() {
        return manifestName;
    }

    public void setManifestName(String manifestName) {
        this.manifestName = manifestName;
    }

    public String getSceneIndexName() {
        return sceneIndexName;
    }

    public void setSceneIndexName(String sceneIndexName) {
        this.sceneIndexName = sceneIndexName;
    }
}
