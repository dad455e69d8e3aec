package com.example.storyboard_matcher.library;

import com.example.storyboard_matcher.exception.NotFoundException;

import java.util.List;

public interface MediaLibrary {

    /**
     * @throws NotFoundException when the tenant has no video with this id.
     */
    MediaAsset resolve(String tenantId, String videoId);

    List<MediaAsset> listAssets(String tenantId);
}
