package com.github.rudygunawan.rendercache.impl;

import com.github.rudygunawan.rendercache.model.CacheHealthStatus;
import com.github.rudygunawan.rendercache.model.CacheLimits;
import com.github.rudygunawan.rendercache.model.CacheStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of one cache instance and the health rules derived from them.
 *
 * <p>Counters are only recorded when statistics are enabled. {@code totalAccess} is counted on its
 * own rather than derived, so the health check can detect lost updates.
 */
public class StatisticsRecorder {
    static final double WARNING_THRESHOLD = 0.9;

    private final CacheLimits limits;
    private final boolean enabled;
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong totalAccess = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final AtomicLong invalidations = new AtomicLong(0);
    private final long createdAt;
    private final AtomicLong lastUpdatedAt;

    public StatisticsRecorder(CacheLimits limits, long createdAt) {
        this.limits = limits;
        this.enabled = limits.isStatisticsEnabled();
        this.createdAt = createdAt;
        this.lastUpdatedAt = new AtomicLong(createdAt);
    }

    public void recordHit(long now) {
        if (enabled) {
            hits.incrementAndGet();
            totalAccess.incrementAndGet();
        }
        touch(now);
    }

    public void recordMiss(long now) {
        if (enabled) {
            misses.incrementAndGet();
            totalAccess.incrementAndGet();
        }
        touch(now);
    }

    public void recordEvictions(int count, long now) {
        if (enabled && count > 0) {
            evictions.addAndGet(count);
        }
        touch(now);
    }

    public void recordInvalidations(int count, long now) {
        if (enabled && count > 0) {
            invalidations.addAndGet(count);
        }
        touch(now);
    }

    /**
     * Marks a change to the store that is not itself counted.
     */
    public void touch(long now) {
        lastUpdatedAt.accumulateAndGet(now, Math::max);
    }

    public void reset(long now) {
        hits.set(0);
        misses.set(0);
        totalAccess.set(0);
        evictions.set(0);
        invalidations.set(0);
        touch(now);
    }

    public long hitCount() {
        return hits.get();
    }

    public long missCount() {
        return misses.get();
    }

    public long evictionCount() {
        return evictions.get();
    }

    public long invalidationCount() {
        return invalidations.get();
    }

    public CacheStatistics snapshot(long entryCount, long totalBytes) {
        return new CacheStatistics(
                hits.get(),
                misses.get(),
                evictions.get(),
                invalidations.get(),
                entryCount,
                totalBytes,
                limits.getMaxEntries(),
                limits.getMaxTotalBytes(),
                createdAt,
                lastUpdatedAt.get());
    }

    /**
     * Evaluates the health rules against the given store size.
     *
     * <p>Errors: entry count or bytes above the limit, or hit and miss counters that do not add up to
     * the access counter. Warnings: entry count or bytes above 90% of the limit.
     */
    public CacheHealthStatus healthStatus(long entryCount, long totalBytes) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        double utilization = (double) entryCount / limits.getMaxEntries();
        double memoryUtilization = (double) totalBytes / limits.getMaxTotalBytes();

        if (utilization > 1.0) {
            errors.add("Entry count " + entryCount + " exceeds maxEntries " + limits.getMaxEntries());
        } else if (utilization > WARNING_THRESHOLD) {
            warnings.add(String.format(Locale.ROOT, "Entry utilization at %.1f%%, heavy eviction expected", utilization * 100));
        }

        if (memoryUtilization > 1.0) {
            errors.add("Cached bytes " + totalBytes + " exceed maxTotalBytes " + limits.getMaxTotalBytes());
        } else if (memoryUtilization > WARNING_THRESHOLD) {
            warnings.add(String.format(Locale.ROOT, "Memory utilization at %.1f%%, heavy eviction expected", memoryUtilization * 100));
        }

        long hitCount = hits.get();
        long missCount = misses.get();
        long accessCount = totalAccess.get();
        if (enabled && hitCount + missCount != accessCount) {
            errors.add("Inconsistent counters: hits " + hitCount + " + misses " + missCount
                    + " != totalAccess " + accessCount);
        }

        long lookups = hitCount + missCount;
        double hitRate = lookups == 0 ? 0.0 : (double) hitCount / lookups;
        return new CacheHealthStatus(errors, warnings, utilization, memoryUtilization, hitRate);
    }
}
