package com.github.rudygunawan.rendercache.metrics;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by MicrometerRenderCacheMetrics to collect and expose metrics.
 */
public interface RenderCacheMetrics {

    /**
     * Returns the current number of entries in the cache.
     */
    long size();

    /**
     * Returns the sum of the byte sizes of all cached entries.
     */
    long totalBytes();

    long hitCount();

    long missCount();

    /**
     * Returns the number of entries removed by capacity limits or TTL.
     */
    long evictionCount();

    /**
     * Returns the number of entries removed by explicit, file-change or batch invalidation.
     */
    long invalidationCount();

    /**
     * Returns the number of computations currently running.
     */
    long inFlightCount();

    double utilization();

    double memoryUtilization();

    boolean isHealthy();

    /**
     * Returns the hit ratio, 0.0 when there has been no lookup.
     */
    default double hitRatio() {
        long hits = hitCount();
        long total = hits + missCount();
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
