package com.github.rudygunawan.rendercache.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A cached render result with the metadata used for expiry, LRU ordering and file-based
 * invalidation.
 *
 * <p>{@code byteSize}, {@code createdAt} and the source file association are fixed at insertion.
 * {@code lastAccessedAt} and {@code accessCount} only move on a successful read through the cache.
 * Instances returned to callers are snapshots taken with {@link #snapshot()}; they are detached
 * from the store.
 *
 * @param <V> the type of the cached value
 */
public class CacheEntry<V> {
    private final String key;
    private final V value;
    private final long createdAt;
    private final long byteSize;
    private final String sourceFilePath;
    private final Long sourceFileModifiedAt;
    private final long sequence;
    private final AtomicLong lastAccessedAt;
    private final AtomicLong accessCount;

    /**
     * Creates a new entry.
     *
     * @param key the cache key
     * @param value the cached value
     * @param byteSize the size of the value in bytes
     * @param createdAt the insertion time in milliseconds
     * @param sourceFilePath the file the value was rendered from, or null
     * @param sourceFileModifiedAt the modification time of that file when rendered, or null
     * @param sequence a store-wide insertion counter used as the last LRU tie-break
     */
    public CacheEntry(String key, V value, long byteSize, long createdAt,
                      String sourceFilePath, Long sourceFileModifiedAt, long sequence) {
        this(key, value, byteSize, createdAt, sourceFilePath, sourceFileModifiedAt, sequence, createdAt, 0);
    }

    private CacheEntry(String key, V value, long byteSize, long createdAt,
                       String sourceFilePath, Long sourceFileModifiedAt, long sequence,
                       long lastAccessedAt, long accessCount) {
        this.key = key;
        this.value = value;
        this.byteSize = byteSize;
        this.createdAt = createdAt;
        this.sourceFilePath = sourceFilePath;
        this.sourceFileModifiedAt = sourceFileModifiedAt;
        this.sequence = sequence;
        this.lastAccessedAt = new AtomicLong(lastAccessedAt);
        this.accessCount = new AtomicLong(accessCount);
    }

    public String getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    /**
     * Returns the time (in milliseconds) when this entry was inserted.
     */
    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns the time (in milliseconds) of the last successful read, or the creation time if the
     * entry was never read.
     */
    public long getLastAccessedAt() {
        return lastAccessedAt.get();
    }

    /**
     * Returns the number of successful reads of this entry.
     */
    public long getAccessCount() {
        return accessCount.get();
    }

    public long getByteSize() {
        return byteSize;
    }

    public String getSourceFilePath() {
        return sourceFilePath;
    }

    public Long getSourceFileModifiedAt() {
        return sourceFileModifiedAt;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * Records a successful read at {@code now}.
     */
    public void recordAccess(long now) {
        lastAccessedAt.set(now);
        accessCount.incrementAndGet();
    }

    /**
     * Returns true if this entry is older than {@code ttlMillis} at {@code now}. A TTL of zero
     * disables expiry.
     */
    public boolean isExpired(long now, long ttlMillis) {
        return ttlMillis > 0 && now - createdAt > ttlMillis;
    }

    /**
     * Returns the milliseconds left before expiry, never negative, or {@code null} when expiry is
     * disabled.
     */
    public Long remainingTtl(long now, long ttlMillis) {
        if (ttlMillis <= 0) {
            return null;
        }
        return Math.max(0, createdAt + ttlMillis - now);
    }

    /**
     * Returns a detached copy of this entry.
     */
    public CacheEntry<V> snapshot() {
        return new CacheEntry<>(key, value, byteSize, createdAt, sourceFilePath, sourceFileModifiedAt,
                sequence, lastAccessedAt.get(), accessCount.get());
    }

    @Override
    public String toString() {
        return "CacheEntry{"
                + "key=" + key
                + ", byteSize=" + byteSize
                + ", createdAt=" + createdAt
                + ", lastAccessedAt=" + lastAccessedAt.get()
                + ", accessCount=" + accessCount.get()
                + ", sourceFilePath=" + sourceFilePath
                + ", sourceFileModifiedAt=" + sourceFileModifiedAt
                + '}';
    }
}
