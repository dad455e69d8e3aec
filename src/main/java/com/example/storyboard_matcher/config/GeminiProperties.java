package com.example.storyboard_matcher.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "analysis.gemini")
public class GeminiProperties {

    private String baseUrl = "https://generativelanguage.googleapis.com";
    private String apiKey = "";
    private String model = "gemini-2.5-pro";
    /** Model for the shortlist stage; falls back to {@link #model}. */
    private String shortlistModel;
    /** Model for the deep-analysis stage; falls back to {@link #model}. */
    private String deepModel;
    private int thinkingBudget = 2048;
    private int timeoutSeconds = 300;
    private long uploadPollIntervalMs = 2000;
    private int uploadMaxPolls = 90;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getShortlistModel() {
        return shortlistModel == null || shortlistModel.isBlank() ? model : shortlistModel;
    }

    public void setShortlistModel(String shortlistModel) {
        this.shortlistModel = shortlistModel;
    }

    public String getDeepModel() {
        return deepModel == null || deepModel.isBlank() ? model : deepModel;
    }

    public void setDeepModel(String deepModel) {
        this.deepModel = deepModel;
    }

    public int getThinkingBudget() {
        return thinkingBudget;
    }

    public void setThinkingBudget(int thinkingBudget) {
        this.thinkingBudget = thinkingBudget;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getUploadPollIntervalMs() {
        return uploadPollIntervalMs;
    }

    public void setUploadPollIntervalMs(long uploadPollIntervalMs) {
        this.uploadPollIntervalMs = uploadPollIntervalMs;
    }

    public int getUploadMaxPolls() {
        return uploadMaxPolls;
    }

    public void setUploadMaxPolls(int uploadMaxPolls) {
        this.uploadMaxPolls = uploadMaxPolls;
    }
}
