package com.github.rudygunawan.rendercache.model;

import com.github.rudygunawan.rendercache.exception.CapacityMisconfiguredException;

/**
 * Immutable bounds and switches of a render cache, fixed for the cache's lifetime.
 */
public final class CacheLimits {
    public static final long DEFAULT_MAX_ENTRIES = 1000;
    public static final long DEFAULT_MAX_TOTAL_BYTES = 10L * 1024 * 1024;
    public static final long DEFAULT_TTL_MILLIS = 30L * 60 * 1000;

    private final long maxEntries;
    private final long maxTotalBytes;
    private final long ttlMillis;
    private final boolean fileBasedInvalidationEnabled;
    private final boolean statisticsEnabled;

    /**
     * Creates validated limits.
     *
     * @throws CapacityMisconfiguredException if {@code maxEntries} or {@code maxTotalBytes} is not
     *     positive, or {@code ttlMillis} is negative
     */
    public CacheLimits(long maxEntries, long maxTotalBytes, long ttlMillis,
                       boolean fileBasedInvalidationEnabled, boolean statisticsEnabled) {
        if (maxEntries <= 0) {
            throw new CapacityMisconfiguredException("maxEntries must be positive but was " + maxEntries);
        }
        if (maxTotalBytes <= 0) {
            throw new CapacityMisconfiguredException("maxTotalBytes must be positive but was " + maxTotalBytes);
        }
        if (ttlMillis < 0) {
            throw new CapacityMisconfiguredException("ttl must not be negative but was " + ttlMillis + "ms");
        }
        this.maxEntries = maxEntries;
        this.maxTotalBytes = maxTotalBytes;
        this.ttlMillis = ttlMillis;
        this.fileBasedInvalidationEnabled = fileBasedInvalidationEnabled;
        this.statisticsEnabled = statisticsEnabled;
    }

    /**
     * Returns the defaults used by the documentation server: 1000 entries, 10 MiB, 30 minutes.
     */
    public static CacheLimits defaults() {
        return new CacheLimits(DEFAULT_MAX_ENTRIES, DEFAULT_MAX_TOTAL_BYTES, DEFAULT_TTL_MILLIS, true, true);
    }

    public long getMaxEntries() {
        return maxEntries;
    }

    public long getMaxTotalBytes() {
        return maxTotalBytes;
    }

    /**
     * Returns the entry time-to-live in milliseconds; zero means entries never expire.
     */
    public long getTtlMillis() {
        return ttlMillis;
    }

    public boolean isFileBasedInvalidationEnabled() {
        return fileBasedInvalidationEnabled;
    }

    public boolean isStatisticsEnabled() {
        return statisticsEnabled;
    }

    @Override
    public String toString() {
        return "CacheLimits{"
                + "maxEntries=" + maxEntries
                + ", maxTotalBytes=" + maxTotalBytes
                + ", ttlMillis=" + ttlMillis
                + ", fileBasedInvalidationEnabled=" + fileBasedInvalidationEnabled
                + ", statisticsEnabled=" + statisticsEnabled
                + '}';
    }
}
