package com.example.storyboard_matcher.library;

import com.example.storyboard_matcher.exception.MatcherException;
import com.example.storyboard_matcher.exception.NotFoundException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Media library backed by a JSON manifest per tenant:
 * {@code <baseDir>/<tenant>/library.json} listing {@code {id, filename, duration, path}} entries,
 * where {@code path} is relative to the tenant directory.
 */
public class LocalMediaLibrary implements MediaLibrary {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalMediaLibrary.class);

    private final Path baseDir;
    private final String videosPrefix;
    private final String voicelessPrefix;
    private final String manifestName;
    private final ObjectMapper objectMapper;

    public LocalMediaLibrary(Path baseDir, String videosPrefix, String voicelessPrefix,
                             String manifestName, ObjectMapper objectMapper) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.videosPrefix = videosPrefix;
        this.voicelessPrefix = voicelessPrefix;
        this.manifestName = manifestName;
        this.objectMapper = objectMapper;
        LOGGER.info("LocalMediaLibrary ready. base={} videos={} voiceless={}", this.baseDir, videosPrefix, voicelessPrefix);
    }

    @Override
    public MediaAsset resolve(String tenantId, String videoId) {
        return listAssets(tenantId).stream()
                .filter(asset -> Objects.equals(asset.videoId(), videoId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Video id not found: " + videoId));
    }

    @Override
    public List<MediaAsset> listAssets(String tenantId) {
        Path tenantDir = safeResolve(baseDir, tenantId);
        Path manifest = tenantDir.resolve(manifestName);
        if (!Files.exists(manifest)) {
            LOGGER.warn("LocalMediaLibrary manifest missing tenant={} path={}", tenantId, manifest);
            return List.of();
        }
        Manifest parsed;
        try {
            parsed = objectMapper.readValue(manifest.toFile(), Manifest.class);
        } catch (IOException e) {
            throw new MatcherException("Cannot read library manifest for tenant " + tenantId, e);
        }
        List<MediaAsset> assets = new ArrayList<>();
        if (parsed.videos() == null) return assets;
        for (ManifestEntry entry : parsed.videos()) {
            if (entry.id() == null || entry.path() == null) {
                LOGGER.warn("LocalMediaLibrary skipping entry without id/path tenant={} entry={}", tenantId, entry);
                continue;
            }
            Path original = safeResolve(tenantDir, entry.path());
            String voiceless = voicelessVariant(tenantDir, entry.path());
            assets.add(new MediaAsset(
                    entry.id(),
                    entry.filename() == null ? original.getFileName().toString() : entry.filename(),
                    entry.duration() == null ? 0.0 : entry.duration(),
                    original.toString(),
                    voiceless));
        }
        return assets;
    }

    private String voicelessVariant(Path tenantDir, String relativePath) {
        String normalized = relativePath.replace('\\', '/').replaceAll("^/+", "");
        String marker = videosPrefix + "/";
        if (!normalized.startsWith(marker) && !normalized.contains("/" + marker)) {
            return null;
        }
        String swapped = normalized.startsWith(marker)
                ? voicelessPrefix + "/" + normalized.substring(marker.length())
                : normalized.replaceFirst("/" + marker, "/" + voicelessPrefix + "/");
        Path candidate = safeResolve(tenantDir, swapped);
        return Files.exists(candidate) ? candidate.toString() : null;
    }

    private Path safeResolve(Path root, String key) {
        if (key == null || key.isBlank()) {
            throw new MatcherException("Library key is blank");
        }
        String normalizedKey = key.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new MatcherException("Invalid library key (path traversal?): " + key);
        }
        return p;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Manifest(List<ManifestEntry> videos) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ManifestEntry(String id, String filename, Double duration, String path) {
    }
}
