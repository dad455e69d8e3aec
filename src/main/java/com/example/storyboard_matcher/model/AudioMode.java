package com.example.storyboard_matcher.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a matched clip's soundtrack is treated in the final render.
 */
public enum AudioMode {
    /** Source audio is dropped in favor of synthesized narration. */
    VOICE_OVER("voice_over"),
    /** The clip's own speech is kept. */
    ORIGINAL_AUDIO("original_audio");

    private final String wireName;

    AudioMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static AudioMode forScene(Scene scene) {
        return scene.isUseVoiceOver() ? VOICE_OVER : ORIGINAL_AUDIO;
    }
}
