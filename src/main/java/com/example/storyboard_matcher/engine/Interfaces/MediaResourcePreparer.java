package com.example.storyboard_matcher.engine.Interfaces;

import com.example.storyboard_matcher.exception.PreparationException;

/**
 * Makes a stored video readable by the visual-analysis service.
 */
public interface MediaResourcePreparer {

    /**
     * Prepares the file behind {@code locator}. Repeated calls for the same locator return an equivalent handle.
     *
     * @throws PreparationException when the file is missing or the service rejects it.
     */
    MediaHandle prepare(String locator);

    /**
     * @param uri      service-side reference to the prepared file.
     * @param mimeType content type reported by the service.
     * @param name     service-side resource name.
     */
    record MediaHandle(String uri, String mimeType, String name) {}
}
