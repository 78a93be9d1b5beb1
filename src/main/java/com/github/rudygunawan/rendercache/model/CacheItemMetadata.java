package com.github.rudygunawan.rendercache.model;

import java.time.Instant;

/**
 * Read-only description of one cached entry for diagnostic listings.
 */
public final class CacheItemMetadata {
    private final String key;
    private final String filePath;
    private final Instant createdAt;
    private final Instant lastAccessedAt;
    private final long accessCount;
    private final long size;
    private final boolean expired;
    private final Long remainingTtl;

    public CacheItemMetadata(String key, String filePath, Instant createdAt, Instant lastAccessedAt,
                             long accessCount, long size, boolean expired, Long remainingTtl) {
        this.key = key;
        this.filePath = filePath;
        this.createdAt = createdAt;
        this.lastAccessedAt = lastAccessedAt;
        this.accessCount = accessCount;
        this.size = size;
        this.expired = expired;
        this.remainingTtl = remainingTtl;
    }

    /**
     * Describes {@code entry} as seen at {@code now}.
     */
    public static CacheItemMetadata describe(CacheEntry<?> entry, long now, long ttlMillis) {
        return new CacheItemMetadata(
                entry.getKey(),
                entry.getSourceFilePath(),
                Instant.ofEpochMilli(entry.getCreatedAt()),
                Instant.ofEpochMilli(entry.getLastAccessedAt()),
                entry.getAccessCount(),
                entry.getByteSize(),
                entry.isExpired(now, ttlMillis),
                entry.remainingTtl(now, ttlMillis));
    }

    public String getKey() {
        return key;
    }

    public String getFilePath() {
        return filePath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public long getAccessCount() {
        return accessCount;
    }

    /**
     * Returns the entry size in bytes.
     */
    public long getSize() {
        return size;
    }

    public boolean isExpired() {
        return expired;
    }

    /**
     * Returns the milliseconds left before expiry, or null when entries do not expire.
     */
    public Long getRemainingTtl() {
        return remainingTtl;
    }
}
