package com.example.storyboard_matcher.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the matching pipeline: concurrency limits, tolerances and per-scene caps.
 */
@ConfigurationProperties(prefix = "matcher")
public class MatcherProperties {

    private int maxInFlight = 8;
    private int executorThreads = 10;
    private int executorQueueCapacity = 200;
    private int maxCandidateVideos = 5;
    private double durationToleranceRatio = 0.10;
    private double windowToleranceSeconds = 0.25;
    private int shortlistMaxClips = 5;
    private double shortlistMaxSpanSeconds = 120.0;
    private double shortlistEndOverrunSeconds = 0.5;
    private int shortlistCap = 5;
    private int historyCap = 20;

    public int getMaxInFlight() {
        return maxInFlight;
    }

    public void setMaxInFlight(int maxInFlight) {
        this.maxInFlight = maxInFlight;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public int getMaxCandidateVideos() {
        return maxCandidateVideos;
    }

    public void setMaxCandidateVideos(int maxCandidateVideos) {
        this.maxCandidateVideos = maxCandidateVideos;
    }

    public double getDurationToleranceRatio() {
        return durationToleranceRatio;
    }

    public void setDurationToleranceRatio(double durationToleranceRatio) {
        this.durationToleranceRatio = durationToleranceRatio;
    }

    public double getWindowToleranceSeconds() {
        return windowToleranceSeconds;
    }

    public void setWindowToleranceSeconds(double windowToleranceSeconds) {
        this.windowToleranceSeconds = windowToleranceSeconds;
    }

    public int getShortlistMaxClips() {
        return shortlistMaxClips;
    }

    public void setShortlistMaxClips(int shortlistMaxClips) {
        this.shortlistMaxClips = shortlistMaxClips;
    }

    public double getShortlistMaxSpanSeconds() {
        return shortlistMaxSpanSeconds;
    }

    public void setShortlistMaxSpanSeconds(double shortlistMaxSpanSeconds) {
        this.shortlistMaxSpanSeconds = shortlistMaxSpanSeconds;
    }

    public double getShortlistEndOverrunSeconds() {
        return shortlistEndOverrunSeconds;
    }

    public void setShortlistEndOverrunSeconds(double shortlistEndOverrunSeconds) {
        this.shortlistEndOverrunSeconds = shortlistEndOverrunSeconds;
    }

    public int getShortlistCap() {
        return shortlistCap;
    }

    public void setShortlistCap(int shortlistCap) {
        this.shortlistCap = shortlistCap;
    }

    public int getHistoryCap() {
        return historyCap;
    }

    public void setHistoryCap(int historyCap) {
        this.historyCap = historyCap;
    }

    /**
     * Pool size for the match executor. Never smaller than the in-flight gate so a permit holder always has a thread.
     *
     * @return number of worker threads.
     */
    public int effectiveExecutorThreads() {
        return Math.max(executorThreads, maxInFlight);
    }
}
