package com.github.rudygunawan.rendercache.model;

import java.time.Duration;

/**
 * Summary of a warmup run.
 */
public final class CacheWarmupResult {
    private final int keysCount;
    private final int successCount;
    private final int failureCount;
    private final Duration duration;

    public CacheWarmupResult(int keysCount, int successCount, int failureCount, Duration duration) {
        this.keysCount = keysCount;
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.duration = duration;
    }

    public int getKeysCount() {
        return keysCount;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "CacheWarmupResult{keysCount=" + keysCount + ", successCount=" + successCount
                + ", failureCount=" + failureCount + ", duration=" + duration.toMillis() + "ms}";
    }
}
