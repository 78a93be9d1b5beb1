package com.github.rudygunawan.rendercache.model;

/**
 * Outcome of a cache lookup.
 *
 * @param <V> the type of the cached value
 */
public final class CacheQueryResult<V> {
    private static final CacheQueryResult<?> MISS = new CacheQueryResult<>(null);

    private final CacheEntry<V> entry;

    private CacheQueryResult(CacheEntry<V> entry) {
        this.entry = entry;
    }

    /**
     * Returns a hit carrying a snapshot of the entry that was read.
     */
    public static <V> CacheQueryResult<V> hit(CacheEntry<V> entry) {
        return new CacheQueryResult<>(entry);
    }

    @SuppressWarnings("unchecked")
    public static <V> CacheQueryResult<V> miss() {
        return (CacheQueryResult<V>) MISS;
    }

    public boolean isFound() {
        return entry != null;
    }

    /**
     * Returns true when the lookup was served from the cache. Lookups never find an entry without
     * hitting it, so this always equals {@link #isFound()}.
     */
    public boolean isHit() {
        return entry != null;
    }

    /**
     * Returns the cached value, or null on a miss.
     */
    public V getValue() {
        return entry == null ? null : entry.getValue();
    }

    /**
     * Returns a detached snapshot of the entry, or null on a miss.
     */
    public CacheEntry<V> getEntry() {
        return entry;
    }

    @Override
    public String toString() {
        return entry == null ? "CacheQueryResult{miss}" : "CacheQueryResult{hit, key=" + entry.getKey() + '}';
    }
}
