package com.example.storyboard_matcher.library;

/**
 * A video in a tenant's media library.
 *
 * @param videoId          opaque library id.
 * @param filename         original file name.
 * @param durationSeconds  full length of the video.
 * @param locator          storage locator of the original file.
 * @param voicelessLocator locator of the narration-safe variant with the voice track removed, or {@code null}.
 */
public record MediaAsset(String videoId,
                         String filename,
                         double durationSeconds,
                         String locator,
                         String voicelessLocator) {

    public boolean hasVoicelessVariant() {
        return voicelessLocator != null && !voicelessLocator.isBlank();
    }
}
