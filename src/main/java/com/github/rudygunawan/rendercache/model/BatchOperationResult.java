package com.github.rudygunawan.rendercache.model;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a multi-key operation.
 */
public final class BatchOperationResult {
    private final int successCount;
    private final int failureCount;
    private final List<String> failedKeys;
    private final Duration duration;

    public BatchOperationResult(int successCount, List<String> failedKeys, Duration duration) {
        this.successCount = successCount;
        this.failedKeys = List.copyOf(failedKeys);
        this.failureCount = failedKeys.size();
        this.duration = duration;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    /**
     * Returns the keys the operation could not apply to, in request order.
     */
    public List<String> getFailedKeys() {
        return failedKeys;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "BatchOperationResult{successCount=" + successCount + ", failureCount=" + failureCount
                + ", failedKeys=" + failedKeys + ", duration=" + duration.toMillis() + "ms}";
    }
}
