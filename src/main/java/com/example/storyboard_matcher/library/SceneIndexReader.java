package com.example.storyboard_matcher.library;

import java.util.Optional;

public interface SceneIndexReader {
    /**
     * @return the tenant's scene index, or empty when it has not been built or cannot be decoded.
     */
    Optional<SceneIndex> read(String tenantId);
}
