package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer;

import java.util.concurrent.Executor;

/**
 * Resources owned by one running batch: the in-flight gate, the media cache and the executor.
 */
public record MatchBatch(ConcurrencyGate gate, ResourceCache cache, Executor executor) {

    public static MatchBatch open(MediaResourcePreparer preparer, int maxInFlight, Executor executor) {
        ConcurrencyGate gate = new ConcurrencyGate(maxInFlight);
        return new MatchBatch(gate, new ResourceCache(preparer, gate, executor), executor);
    }
}
