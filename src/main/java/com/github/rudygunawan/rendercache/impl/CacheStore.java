package com.github.rudygunawan.rendercache.impl;

import com.github.rudygunawan.rendercache.api.ByteSizer;
import com.github.rudygunawan.rendercache.model.CacheClearResult;
import com.github.rudygunawan.rendercache.model.CacheEntry;
import com.github.rudygunawan.rendercache.model.CacheHealthStatus;
import com.github.rudygunawan.rendercache.model.CacheLimits;
import com.github.rudygunawan.rendercache.model.CacheQueryResult;
import com.github.rudygunawan.rendercache.model.CacheStatistics;
import com.github.rudygunawan.rendercache.policy.CapacityEvictionPolicy;
import com.github.rudygunawan.rendercache.policy.InvalidationReason;
import com.github.rudygunawan.rendercache.time.Ticker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the cached entries: the primary key map, the {@code filePath -> keys} index and the running
 * byte total.
 *
 * <p>All three structures, and the statistics recorded alongside them, change under one lock, so
 * a TTL check, the removal it triggers and the access bookkeeping of a read are a single atomic
 * step. A read moves its entry to the end of the primary map, which keeps the least recently used
 * entry first.
 *
 * <p>The store never notifies listeners. Methods that remove entries append detached snapshots of
 * them to a caller-supplied list; the caller publishes the events once the lock is released.
 *
 * @param <V> the type of cached values
 */
public class CacheStore<V> {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.rendercache.RenderCache");

    private final CacheLimits limits;
    private final Ticker ticker;
    private final ByteSizer<? super V> byteSizer;
    private final StatisticsRecorder statistics;
    private final CapacityEvictionPolicy evictionPolicy;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final Map<String, Set<String>> keysByFilePath = new HashMap<>();
    private final EvictionTarget evictionTarget = new EvictionTarget();
    private long totalBytes;
    private long sequence;

    public CacheStore(CacheLimits limits, Ticker ticker, ByteSizer<? super V> byteSizer,
                      StatisticsRecorder statistics, CapacityEvictionPolicy evictionPolicy) {
        this.limits = Objects.requireNonNull(limits, "limits cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.byteSizer = Objects.requireNonNull(byteSizer, "byteSizer cannot be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics cannot be null");
        this.evictionPolicy = Objects.requireNonNull(evictionPolicy, "evictionPolicy cannot be null");
    }

    /**
     * Looks up {@code key}. An expired entry is removed, appended to {@code expired}, counted as an
     * eviction and reported as a miss. A live entry has its access time and count updated.
     *
     * @param key the cache key
     * @param recordStats whether to count the lookup as a hit or miss
     * @param expired receives the entry removed because its TTL elapsed
     * @return the result, carrying a snapshot of the entry on a hit
     */
    public CacheQueryResult<V> get(String key, boolean recordStats, List<CacheEntry<V>> expired) {
        lock.lock();
        try {
            long now = ticker.read();
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                if (recordStats) statistics.recordMiss(now);
                return CacheQueryResult.miss();
            }
            if (entry.isExpired(now, limits.getTtlMillis())) {
                expired.add(removeInternal(key));
                statistics.recordEvictions(1, now);
                if (recordStats) statistics.recordMiss(now);
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Expired entry on read: key=" + key + ", age=" + (now - entry.getCreatedAt()) + "ms");
                }
                return CacheQueryResult.miss();
            }
            entry.recordAccess(now);
            moveToTail(key, entry);
            if (recordStats) statistics.recordHit(now);
            return CacheQueryResult.hit(entry.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts {@code value}, replacing any entry under the same key, then enforces the capacity
     * limits. Replacing an entry is not an eviction.
     *
     * <p>If the value cannot be sized it is not stored; the failure is logged and {@code false} is
     * returned.
     *
     * @param evicted receives the entries evicted to make room, possibly including this one
     * @return true if the value was inserted
     */
    public boolean put(String key, V value, String sourceFilePath, Long sourceFileModifiedAt,
                       List<CacheEntry<V>> evicted) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");

        long byteSize;
        try {
            byteSize = byteSizer.sizeOf(value);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not compute byte size, value not cached: key=" + key, e);
            return false;
        }
        if (byteSize < 0) {
            LOGGER.warning("ByteSizer returned negative size " + byteSize + ", value not cached: key=" + key);
            return false;
        }

        lock.lock();
        try {
            long now = ticker.read();
            if (entries.containsKey(key)) {
                removeInternal(key);
            }
            CacheEntry<V> entry = new CacheEntry<>(key, value, byteSize, now, sourceFilePath,
                    sourceFileModifiedAt, sequence++);
            entries.put(key, entry);
            totalBytes += byteSize;
            if (sourceFilePath != null) {
                keysByFilePath.computeIfAbsent(sourceFilePath, p -> new LinkedHashSet<>()).add(key);
            }
            statistics.touch(now);
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Cached entry: key=" + key + ", bytes=" + byteSize + ", filePath=" + sourceFilePath);
            }

            List<CacheEntry<V>> victims = evictionPolicy.enforce(evictionTarget);
            if (!victims.isEmpty()) {
                statistics.recordEvictions(victims.size(), now);
                evicted.addAll(victims);
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Evicted " + victims.size() + " entries due to capacity limit: size="
                            + entries.size() + ", bytes=" + totalBytes);
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the entry for {@code key}.
     *
     * @return a snapshot of the removed entry, or null if none was present
     */
    public CacheEntry<V> remove(String key, InvalidationReason reason) {
        lock.lock();
        try {
            if (!entries.containsKey(key)) {
                return null;
            }
            CacheEntry<V> removed = removeInternal(key);
            countRemovals(1, reason);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry for {@code filePath} accepted by {@code filter}, using the file index.
     *
     * @param removed receives the removed entries
     * @return the number of removed entries
     */
    public int removeByFilePath(String filePath, Predicate<CacheEntry<V>> filter, InvalidationReason reason,
                                List<CacheEntry<V>> removed) {
        lock.lock();
        try {
            Set<String> keys = keysByFilePath.get(filePath);
            if (keys == null) {
                return 0;
            }
            int count = 0;
            for (String key : new ArrayList<>(keys)) {
                CacheEntry<V> entry = entries.get(key);
                if (entry != null && filter.test(entry)) {
                    removed.add(removeInternal(key));
                    count++;
                }
            }
            countRemovals(count, reason);
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry in one step.
     *
     * @param removed receives the removed entries
     */
    public CacheClearResult clear(InvalidationReason reason, List<CacheEntry<V>> removed) {
        lock.lock();
        try {
            long beforeSize = entries.size();
            long beforeBytes = totalBytes;
            for (CacheEntry<V> entry : entries.values()) {
                removed.add(entry.snapshot());
            }
            entries.clear();
            keysByFilePath.clear();
            totalBytes = 0;
            countRemovals((int) beforeSize, reason);
            return new CacheClearResult(beforeSize, beforeBytes, entries.size(), totalBytes, beforeSize, reason);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry, counting each as an eviction.
     *
     * @param expired receives the removed entries
     * @return the number of removed entries
     */
    public int sweepExpired(List<CacheEntry<V>> expired) {
        if (limits.getTtlMillis() <= 0) {
            return 0;
        }
        lock.lock();
        try {
            long now = ticker.read();
            int count = 0;
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                CacheEntry<V> entry = it.next();
                if (entry.isExpired(now, limits.getTtlMillis())) {
                    it.remove();
                    unindex(entry);
                    expired.add(entry.snapshot());
                    count++;
                }
            }
            if (count > 0) {
                statistics.recordEvictions(count, now);
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true if a live, unexpired entry exists for {@code key}. Does not count as an access.
     */
    public boolean containsKey(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            return entry != null && !entry.isExpired(ticker.read(), limits.getTtlMillis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns snapshots of all entries, least recently used first, without touching them.
     */
    public List<CacheEntry<V>> snapshot() {
        lock.lock();
        try {
            List<CacheEntry<V>> copies = new ArrayList<>(entries.size());
            for (CacheEntry<V> entry : entries.values()) {
                copies.add(entry.snapshot());
            }
            return copies;
        } finally {
            lock.unlock();
        }
    }

    public List<String> keys() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the keys indexed under {@code filePath}.
     */
    public Set<String> keysForFilePath(String filePath) {
        lock.lock();
        try {
            Set<String> keys = keysByFilePath.get(filePath);
            return keys == null ? Collections.emptySet() : new LinkedHashSet<>(keys);
        } finally {
            lock.unlock();
        }
    }

    public long size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long totalBytes() {
        lock.lock();
        try {
            return totalBytes;
        } finally {
            lock.unlock();
        }
    }

    public CacheStatistics statistics() {
        lock.lock();
        try {
            return statistics.snapshot(entries.size(), totalBytes);
        } finally {
            lock.unlock();
        }
    }

    public CacheHealthStatus healthStatus() {
        lock.lock();
        try {
            return statistics.healthStatus(entries.size(), totalBytes);
        } finally {
            lock.unlock();
        }
    }

    public void resetStatistics() {
        lock.lock();
        try {
            statistics.reset(ticker.read());
        } finally {
            lock.unlock();
        }
    }

    // Helper methods, all called with the lock held

    private void moveToTail(String key, CacheEntry<V> entry) {
        entries.remove(key);
        entries.put(key, entry);
    }

    private CacheEntry<V> removeInternal(String key) {
        CacheEntry<V> removed = entries.remove(key);
        unindex(removed);
        return removed.snapshot();
    }

    private void unindex(CacheEntry<V> entry) {
        totalBytes -= entry.getByteSize();
        String path = entry.getSourceFilePath();
        if (path != null) {
            Set<String> keys = keysByFilePath.get(path);
            if (keys != null) {
                keys.remove(entry.getKey());
                if (keys.isEmpty()) {
                    keysByFilePath.remove(path);
                }
            }
        }
    }

    private void countRemovals(int count, InvalidationReason reason) {
        long now = ticker.read();
        if (reason.wasEvicted()) {
            statistics.recordEvictions(count, now);
        } else {
            statistics.recordInvalidations(count, now);
        }
    }

    private final class EvictionTarget implements CapacityEvictionPolicy.EvictionTarget<V> {

        @Override
        public long entryCount() {
            return entries.size();
        }

        @Override
        public long totalBytes() {
            return totalBytes;
        }

        @Override
        public Iterable<CacheEntry<V>> accessOrder() {
            return entries.values();
        }

        @Override
        public CacheEntry<V> evict(CacheEntry<V> victim) {
            return removeInternal(victim.getKey());
        }
    }
}
