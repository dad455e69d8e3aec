package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.exception.MatcherException;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Caps the number of blocking service calls (analysis and uploads) in flight for one batch.
 */
public class ConcurrencyGate {
    private final Semaphore permits;
    private final int limit;

    public ConcurrencyGate(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Concurrency limit must be >= 1");
        }
        this.limit = limit;
        this.permits = new Semaphore(limit, true);
    }

    public <T> T call(Supplier<T> work) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MatcherException("Interrupted while waiting for a concurrency permit", e);
        }
        try {
            return work.get();
        } finally {
            permits.release();
        }
    }

    public int limit() {
        return limit;
    }

    public int inFlight() {
        return limit - permits.availablePermits();
    }
}
