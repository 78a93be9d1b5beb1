package com.github.rudygunawan.rendercache.api;

import com.github.rudygunawan.rendercache.listener.CacheEventListener;
import com.github.rudygunawan.rendercache.model.BatchOperationResult;
import com.github.rudygunawan.rendercache.model.CacheClearResult;
import com.github.rudygunawan.rendercache.model.CacheHealthStatus;
import com.github.rudygunawan.rendercache.model.CacheItemMetadata;
import com.github.rudygunawan.rendercache.model.CacheKeyParams;
import com.github.rudygunawan.rendercache.model.CacheLimits;
import com.github.rudygunawan.rendercache.model.CacheQueryResult;
import com.github.rudygunawan.rendercache.model.CacheStatistics;
import com.github.rudygunawan.rendercache.model.CacheWarmupResult;
import com.github.rudygunawan.rendercache.model.FileChangeEvent;
import com.github.rudygunawan.rendercache.model.WarmupEntry;
import com.github.rudygunawan.rendercache.policy.InvalidationReason;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * An in-process cache of rendered documents, keyed by a fingerprint of the render inputs and
 * bounded by entry count, total bytes and age.
 *
 * <p>Entries may be tied to a source file; a change to that file removes every entry rendered from
 * it. Concurrent misses for the same key share a single computation.
 *
 * <p>Implementations of this interface are expected to be thread-safe, and can be safely accessed
 * by multiple concurrent threads.
 *
 * @param <V> the type of rendered values
 */
public interface RenderCache<V> extends AutoCloseable {

    /**
     * Returns the cached value for {@code params}, computing and caching it on a miss.
     *
     * <p>If another thread is already computing the same key, this call waits for that computation
     * and returns its result instead of starting a second one.
     *
     * @param params the render inputs
     * @param compute produces the value on a miss
     * @return the cached or freshly computed value
     * @throws com.github.rudygunawan.rendercache.exception.ComputeFailedException if
     *     {@code compute} threw or returned null; nothing is cached
     * @throws com.github.rudygunawan.rendercache.exception.InvalidKeyParamsException if
     *     {@code params} cannot be fingerprinted
     */
    V getOrCompute(CacheKeyParams params, Callable<? extends V> compute);

    /**
     * Same as {@link #getOrCompute(CacheKeyParams, Callable)}, recording the modification time of
     * the source file the value is rendered from. A later change notification carrying the same
     * time keeps the entry.
     */
    V getOrCompute(CacheKeyParams params, Long sourceFileModifiedAt, Callable<? extends V> compute);

    /**
     * Looks up {@code key} without computing. Counts as a hit or miss.
     */
    CacheQueryResult<V> peek(String key);

    CacheQueryResult<V> peek(CacheKeyParams params);

    /**
     * Stores {@code value} under the fingerprint of {@code params}, replacing any previous entry.
     *
     * @return the cache key
     */
    String put(CacheKeyParams params, V value, Long sourceFileModifiedAt);

    /**
     * Discards the entry for {@code key}.
     *
     * @return true if an entry was removed
     */
    boolean invalidate(String key);

    /**
     * Discards every entry rendered from {@code filePath}.
     *
     * @return the number of removed entries
     */
    int invalidateByFilePath(String filePath);

    /**
     * Discards the entries rendered from {@code filePath} whose recorded modification time is not
     * {@code currentModifiedAt}.
     *
     * @return the number of removed entries
     */
    int invalidateByFilePath(String filePath, Long currentModifiedAt);

    /**
     * Discards every entry rendered from any of {@code filePaths}.
     *
     * @return the number of removed entries
     */
    int invalidateAll(Collection<String> filePaths);

    BatchOperationResult invalidateKeys(Collection<String> keys);

    /**
     * Applies a notification from the file watcher.
     *
     * @return the number of removed entries
     */
    int onFileChange(FileChangeEvent event);

    /**
     * Discards all entries with reason {@link InvalidationReason#MANUAL}.
     */
    CacheClearResult clear();

    CacheClearResult clear(InvalidationReason reason);

    /**
     * Computes and caches each entry in order. Failures are counted and do not stop the run.
     */
    CacheWarmupResult warmup(List<WarmupEntry<V>> entries);

    /**
     * Returns a description of every cached entry, least recently used first. Does not count as
     * access.
     */
    List<CacheItemMetadata> entries();

    CacheStatistics statistics();

    CacheHealthStatus healthStatus();

    void resetStatistics();

    /**
     * Returns true if an unexpired entry exists for {@code key}. Does not count as access.
     */
    boolean containsKey(String key);

    List<String> keys();

    long size();

    /**
     * Removes expired entries now instead of waiting for them to be read.
     *
     * @return the number of removed entries
     */
    int cleanUp();

    void addListener(CacheEventListener listener);

    boolean removeListener(CacheEventListener listener);

    CacheLimits getLimits();

    /**
     * Stops background maintenance. The cache remains usable.
     */
    @Override
    void close();
}
