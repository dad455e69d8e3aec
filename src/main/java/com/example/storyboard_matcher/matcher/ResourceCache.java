package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer;
import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer.MediaHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Batch-scoped cache of prepared media. Each locator is prepared at most once; every job referencing
 * it shares the same future, so a failed preparation fails exactly those jobs.
 */
public class ResourceCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceCache.class);

    private final MediaResourcePreparer preparer;
    private final ConcurrencyGate gate;
    private final Executor executor;
    private final Map<String, CompletableFuture<MediaHandle>> handles = new ConcurrentHashMap<>();

    public ResourceCache(MediaResourcePreparer preparer, ConcurrencyGate gate, Executor executor) {
        this.preparer = preparer;
        this.gate = gate;
        this.executor = executor;
    }

    public CompletableFuture<MediaHandle> prepare(String locator) {
        return handles.computeIfAbsent(locator, key -> CompletableFuture.supplyAsync(() -> {
            LOGGER.debug("ResourceCache prepare locator={}", key);
            return gate.call(() -> preparer.prepare(key));
        }, executor));
    }

    public int size() {
        return handles.size();
    }
}
