package com.github.rudygunawan.rendercache.model;

import java.util.Objects;

/**
 * Statistics about the performance of a render cache. Instances of this class are immutable.
 *
 * <p>Counters are incremented according to the following rules:
 *
 * <ul>
 *   <li>When a lookup finds a live entry, {@code hits} is incremented.
 *   <li>When a lookup finds nothing, or finds an expired entry, {@code misses} is incremented.
 *   <li>When the cache removes an entry on its own (capacity limit or TTL), {@code evictions} is
 *       incremented once per entry.
 *   <li>When an entry is removed on request (manual, file change, batch, clear),
 *       {@code invalidations} is incremented once per entry.
 * </ul>
 *
 * <p>{@code currentEntryCount} and {@code currentTotalBytes} describe the live store and are the
 * only values that go down.
 */
public class CacheStatistics {
    private final long hits;
    private final long misses;
    private final long evictions;
    private final long invalidations;
    private final long currentEntryCount;
    private final long currentTotalBytes;
    private final long maxEntries;
    private final long maxTotalBytes;
    private final long createdAt;
    private final long lastUpdatedAt;

    /**
     * Constructs a new {@code CacheStatistics} instance.
     */
    public CacheStatistics(
            long hits,
            long misses,
            long evictions,
            long invalidations,
            long currentEntryCount,
            long currentTotalBytes,
            long maxEntries,
            long maxTotalBytes,
            long createdAt,
            long lastUpdatedAt) {
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.invalidations = invalidations;
        this.currentEntryCount = currentEntryCount;
        this.currentTotalBytes = currentTotalBytes;
        this.maxEntries = maxEntries;
        this.maxTotalBytes = maxTotalBytes;
        this.createdAt = createdAt;
        this.lastUpdatedAt = lastUpdatedAt;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    /**
     * Returns the number of lookups. This is defined as {@code hits + misses}.
     */
    public long getTotalAccess() {
        return hits + misses;
    }

    /**
     * Returns the ratio of lookups which were hits. This is defined as
     * {@code hits / totalAccess}, or {@code 0.0} when {@code totalAccess == 0}.
     */
    public double getHitRate() {
        long totalAccess = getTotalAccess();
        return (totalAccess == 0) ? 0.0 : (double) hits / totalAccess;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getInvalidations() {
        return invalidations;
    }

    public long getCurrentEntryCount() {
        return currentEntryCount;
    }

    public long getCurrentTotalBytes() {
        return currentTotalBytes;
    }

    public long getMaxEntries() {
        return maxEntries;
    }

    public long getMaxTotalBytes() {
        return maxTotalBytes;
    }

    /**
     * Returns the time (in milliseconds) when the cache was created.
     */
    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns the time (in milliseconds) of the last recorded change to any counter or to the store.
     */
    public long getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hits, misses, evictions, invalidations, currentEntryCount, currentTotalBytes,
                maxEntries, maxTotalBytes, createdAt, lastUpdatedAt);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStatistics)) {
            return false;
        }
        CacheStatistics other = (CacheStatistics) obj;
        return hits == other.hits
                && misses == other.misses
                && evictions == other.evictions
                && invalidations == other.invalidations
                && currentEntryCount == other.currentEntryCount
                && currentTotalBytes == other.currentTotalBytes
                && maxEntries == other.maxEntries
                && maxTotalBytes == other.maxTotalBytes
                && createdAt == other.createdAt
                && lastUpdatedAt == other.lastUpdatedAt;
    }

    @Override
    public String toString() {
        return "CacheStatistics{"
                + "hits=" + hits
                + ", misses=" + misses
                + ", evictions=" + evictions
                + ", invalidations=" + invalidations
                + ", entries=" + currentEntryCount + "/" + maxEntries
                + ", bytes=" + currentTotalBytes + "/" + maxTotalBytes
                + ", hitRate=" + String.format("%.2f%%", getHitRate() * 100)
                + '}';
    }
}
