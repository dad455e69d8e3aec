package com.example.storyboard_matcher.library;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code <baseDir>/<tenant>/scene_analysis/<indexName>}.
 */
public class FileSceneIndexReader implements SceneIndexReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileSceneIndexReader.class);
    static final String SCENE_ANALYSIS_DIR = "scene_analysis";

    private final Path baseDir;
    private final String indexName;
    private final ObjectMapper objectMapper;

    public FileSceneIndexReader(Path baseDir, String indexName, ObjectMapper objectMapper) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.indexName = indexName;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SceneIndex> read(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return Optional.empty();
        }
        Path path = baseDir.resolve(tenantId).resolve(SCENE_ANALYSIS_DIR).resolve(indexName).normalize();
        if (!path.startsWith(baseDir) || !Files.exists(path)) {
            LOGGER.info("SceneIndex missing tenant={} path={}", tenantId, path);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), SceneIndex.class));
        } catch (IOException e) {
            LOGGER.warn("SceneIndex unreadable tenant={} path={} error={}", tenantId, path, e.toString());
            return Optional.empty();
        }
    }
}
