package com.github.rudygunawan.rendercache.policy;

/**
 * The reason why a cached render result was removed.
 */
public enum InvalidationReason {
    /**
     * The entry was removed explicitly through
     * {@link com.github.rudygunawan.rendercache.api.RenderCache#invalidate(String)} or a manual
     * {@code clear()}.
     */
    MANUAL,

    /**
     * The source file of the entry was modified or deleted.
     */
    FILE_CHANGED,

    /**
     * The entry outlived the configured TTL.
     */
    EXPIRED,

    /**
     * The entry was chosen as the least recently used victim because the entry count or byte
     * limit was exceeded.
     */
    CAPACITY_LIMIT,

    /**
     * Several entries were removed by one batch request; reported as a single event.
     */
    BATCH;

    /**
     * Returns {@code true} if the removal was decided by the cache itself (capacity or TTL)
     * rather than requested from outside. Only these removals count as evictions.
     */
    public boolean wasEvicted() {
        return this == CAPACITY_LIMIT || this == EXPIRED;
    }
}
