package com.github.rudygunawan.rendercache.policy;

import com.github.rudygunawan.rendercache.model.CacheEntry;
import com.github.rudygunawan.rendercache.model.CacheLimits;

import java.util.ArrayList;
import java.util.List;

/**
 * Least-recently-used eviction against an entry-count limit and a byte limit.
 *
 * <p>The entry-count limit is enforced first, then the byte limit. In both passes the victim is the
 * entry with the oldest {@code lastAccessedAt}; ties go to the oldest {@code createdAt}, then to the
 * earliest insertion. The byte pass ignores entry size, so a single entry larger than the byte limit
 * evicts itself.
 *
 * <p>The policy holds no state. It must be called with the store lock held.
 */
public final class CapacityEvictionPolicy {

    /**
     * The store as seen by the policy.
     *
     * @param <V> the type of cached values
     */
    public interface EvictionTarget<V> {

        long entryCount();

        long totalBytes();

        /**
         * Returns live entries from least to most recently accessed.
         */
        Iterable<CacheEntry<V>> accessOrder();

        /**
         * Removes {@code victim} and returns it.
         */
        CacheEntry<V> evict(CacheEntry<V> victim);
    }

    private final long maxEntries;
    private final long maxTotalBytes;

    public CapacityEvictionPolicy(CacheLimits limits) {
        this.maxEntries = limits.getMaxEntries();
        this.maxTotalBytes = limits.getMaxTotalBytes();
    }

    public boolean isOverEntryLimit(long entryCount) {
        return entryCount > maxEntries;
    }

    public boolean isOverByteLimit(long totalBytes) {
        return totalBytes > maxTotalBytes;
    }

    /**
     * Evicts until both limits hold and returns the victims in eviction order.
     */
    public <V> List<CacheEntry<V>> enforce(EvictionTarget<V> target) {
        List<CacheEntry<V>> victims = new ArrayList<>();
        while (isOverEntryLimit(target.entryCount())) {
            if (!evictOne(target, victims)) {
                break;
            }
        }
        while (isOverByteLimit(target.totalBytes())) {
            if (!evictOne(target, victims)) {
                break;
            }
        }
        return victims;
    }

    private <V> boolean evictOne(EvictionTarget<V> target, List<CacheEntry<V>> victims) {
        CacheEntry<V> victim = selectVictim(target.accessOrder());
        if (victim == null) {
            // over limit with nothing to evict
            return false;
        }
        victims.add(target.evict(victim));
        return true;
    }

    /**
     * Picks the least recently used entry.
     *
     * <p>{@code accessOrder} lists entries by access sequence, so access times never decrease along
     * it; only the leading run of entries sharing the oldest access time needs to be compared.
     *
     * @return the victim, or null if there are no entries
     */
    public <V> CacheEntry<V> selectVictim(Iterable<CacheEntry<V>> accessOrder) {
        CacheEntry<V> victim = null;
        for (CacheEntry<V> candidate : accessOrder) {
            if (victim == null) {
                victim = candidate;
                continue;
            }
            if (candidate.getLastAccessedAt() != victim.getLastAccessedAt()) {
                break;
            }
            if (isOlder(candidate, victim)) {
                victim = candidate;
            }
        }
        return victim;
    }

    private static boolean isOlder(CacheEntry<?> a, CacheEntry<?> b) {
        if (a.getCreatedAt() != b.getCreatedAt()) {
            return a.getCreatedAt() < b.getCreatedAt();
        }
        return a.getSequence() < b.getSequence();
    }
}
