package com.github.rudygunawan.rendercache.impl;

import com.github.rudygunawan.rendercache.api.ByteSizer;
import com.github.rudygunawan.rendercache.api.RenderCache;
import com.github.rudygunawan.rendercache.builder.RenderCacheBuilder;
import com.github.rudygunawan.rendercache.exception.ComputeFailedException;
import com.github.rudygunawan.rendercache.exception.RenderCacheException;
import com.github.rudygunawan.rendercache.key.Fingerprinter;
import com.github.rudygunawan.rendercache.listener.CacheEventListener;
import com.github.rudygunawan.rendercache.metrics.RenderCacheMetrics;
import com.github.rudygunawan.rendercache.model.BatchOperationResult;
import com.github.rudygunawan.rendercache.model.CacheClearResult;
import com.github.rudygunawan.rendercache.model.CacheEntry;
import com.github.rudygunawan.rendercache.model.CacheHealthStatus;
import com.github.rudygunawan.rendercache.model.CacheItemMetadata;
import com.github.rudygunawan.rendercache.model.CacheKeyParams;
import com.github.rudygunawan.rendercache.model.CacheLimits;
import com.github.rudygunawan.rendercache.model.CacheQueryResult;
import com.github.rudygunawan.rendercache.model.CacheStatistics;
import com.github.rudygunawan.rendercache.model.CacheWarmupResult;
import com.github.rudygunawan.rendercache.model.FileChangeEvent;
import com.github.rudygunawan.rendercache.model.WarmupEntry;
import com.github.rudygunawan.rendercache.policy.CapacityEvictionPolicy;
import com.github.rudygunawan.rendercache.policy.InvalidationReason;
import com.github.rudygunawan.rendercache.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link RenderCache} that runs at most one computation per key at a time.
 *
 * <p>A miss registers a {@link CompletableFuture} for its key. The caller that registered it
 * computes and stores the value; callers missing on the same key meanwhile wait on that future and
 * receive the same value, or the same {@link ComputeFailedException} or {@link Error} instance.
 * The future is removed once it settles, so a failed computation is retried by the next caller.
 *
 * <p>Logging: This class uses java.util.logging. Users can configure logging levels using standard
 * JUL configuration. See {@link #LOGGER} for the logger name.
 *
 * @param <V> the type of rendered values
 */
public class ConcurrentRenderCache<V> implements RenderCache<V>, RenderCacheMetrics {
    /**
     * Logger for render cache operations. Logger name: "com.github.rudygunawan.rendercache.RenderCache"
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.rendercache.RenderCache");

    private final CacheLimits limits;
    private final Ticker ticker;
    private final boolean enabled;
    private final StatisticsRecorder statistics;
    private final CacheStore<V> store;
    private final InvalidationCoordinator<V> coordinator;

    // Renders in progress, at most one per key
    private final ConcurrentHashMap<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    // Optional background TTL sweep
    private final ScheduledExecutorService cleanupScheduler;
    private final ScheduledFuture<?> cleanupTask;

    @SuppressWarnings("unchecked")
    public ConcurrentRenderCache(RenderCacheBuilder<?> builder) {
        this.limits = builder.getLimits();
        this.ticker = builder.getTicker();
        this.enabled = builder.isEnabled();
        this.statistics = new StatisticsRecorder(limits, ticker.read());
        this.store = new CacheStore<>(limits, ticker, (ByteSizer<? super V>) builder.getByteSizer(),
                statistics, new CapacityEvictionPolicy(limits));
        this.coordinator = new InvalidationCoordinator<>(store, limits, ticker);
        for (CacheEventListener listener : builder.getListeners()) {
            coordinator.addListener(listener);
        }

        long interval = builder.getCleanupIntervalMillis();
        if (interval > 0 && enabled) {
            this.cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "render-cache-cleanup");
                t.setDaemon(true);
                return t;
            });
            this.cleanupTask = cleanupScheduler.scheduleAtFixedRate(
                    this::scheduledCleanUp,
                    interval, interval, TimeUnit.MILLISECONDS
            );
        } else {
            this.cleanupScheduler = null;
            this.cleanupTask = null;
        }

        if (LOGGER.isLoggable(Level.CONFIG)) {
            LOGGER.config("Created render cache: " + limits + (enabled ? "" : " (disabled)"));
        }
    }

    @Override
    public V getOrCompute(CacheKeyParams params, Callable<? extends V> compute) {
        return getOrCompute(params, null, compute);
    }

    @Override
    public V getOrCompute(CacheKeyParams params, Long sourceFileModifiedAt, Callable<? extends V> compute) {
        Objects.requireNonNull(compute, "compute cannot be null");
        String key = Fingerprinter.fingerprint(params);
        if (!enabled) {
            return computeValue(key, compute);
        }

        CacheQueryResult<V> cached = lookup(key, true);
        if (cached.isHit()) {
            return cached.getValue();
        }

        CompletableFuture<V> pending = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, pending);
        if (existing != null) {
            return await(key, existing);
        }

        // We're responsible for computing
        try {
            // Double-check: a previous leader may have stored the value after our miss
            CacheQueryResult<V> recheck = lookup(key, false);
            if (recheck.isHit()) {
                pending.complete(recheck.getValue());
                return recheck.getValue();
            }

            V value;
            try {
                value = computeValue(key, compute);
            } catch (RuntimeException | Error e) {
                // waiters rethrow this same instance
                pending.completeExceptionally(e);
                throw e;
            }
            insert(key, value, params.getFilePath(), sourceFileModifiedAt);
            pending.complete(value);
            return value;
        } finally {
            if (!pending.isDone()) {
                pending.completeExceptionally(new RenderCacheException("Computation abandoned for key: " + key));
            }
            inFlight.remove(key, pending);
        }
    }

    @Override
    public CacheQueryResult<V> peek(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (!enabled) {
            return CacheQueryResult.miss();
        }
        return lookup(key, true);
    }

    @Override
    public CacheQueryResult<V> peek(CacheKeyParams params) {
        return peek(Fingerprinter.fingerprint(params));
    }

    @Override
    public String put(CacheKeyParams params, V value, Long sourceFileModifiedAt) {
        Objects.requireNonNull(value, "value cannot be null");
        String key = Fingerprinter.fingerprint(params);
        if (enabled) {
            insert(key, value, params.getFilePath(), sourceFileModifiedAt);
        }
        return key;
    }

    @Override
    public boolean invalidate(String key) {
        return coordinator.invalidate(key);
    }

    @Override
    public int invalidateByFilePath(String filePath) {
        return coordinator.invalidateByFilePath(filePath);
    }

    @Override
    public int invalidateByFilePath(String filePath, Long currentModifiedAt) {
        return coordinator.invalidateByFilePath(filePath, currentModifiedAt);
    }

    @Override
    public int invalidateAll(Collection<String> filePaths) {
        return coordinator.invalidateAll(filePaths);
    }

    @Override
    public BatchOperationResult invalidateKeys(Collection<String> keys) {
        return coordinator.invalidateKeys(keys);
    }

    @Override
    public int onFileChange(FileChangeEvent event) {
        return coordinator.onFileChange(event);
    }

    @Override
    public CacheClearResult clear() {
        return clear(InvalidationReason.MANUAL);
    }

    @Override
    public CacheClearResult clear(InvalidationReason reason) {
        return coordinator.clear(reason);
    }

    @Override
    public CacheWarmupResult warmup(List<WarmupEntry<V>> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        long startTime = System.nanoTime();
        int successCount = 0;
        int failureCount = 0;
        for (WarmupEntry<V> entry : entries) {
            try {
                getOrCompute(entry.getParams(), entry.getSourceFileModifiedAt(), entry.getCompute());
                successCount++;
            } catch (RenderCacheException e) {
                failureCount++;
                LOGGER.log(Level.WARNING, "Warmup failed for filePath=" + entry.getParams().getFilePath(), e);
            }
        }
        CacheWarmupResult result = new CacheWarmupResult(entries.size(), successCount, failureCount,
                Duration.ofNanos(System.nanoTime() - startTime));
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Warmup finished: " + result);
        }
        return result;
    }

    @Override
    public List<CacheItemMetadata> entries() {
        List<CacheEntry<V>> snapshot = store.snapshot();
        long now = ticker.read();
        List<CacheItemMetadata> items = new ArrayList<>(snapshot.size());
        for (CacheEntry<V> entry : snapshot) {
            items.add(CacheItemMetadata.describe(entry, now, limits.getTtlMillis()));
        }
        return items;
    }

    @Override
    public CacheStatistics statistics() {
        return store.statistics();
    }

    @Override
    public CacheHealthStatus healthStatus() {
        return store.healthStatus();
    }

    @Override
    public void resetStatistics() {
        store.resetStatistics();
    }

    @Override
    public boolean containsKey(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        return store.containsKey(key);
    }

    @Override
    public List<String> keys() {
        return store.keys();
    }

    @Override
    public long size() {
        return store.size();
    }

    @Override
    public int cleanUp() {
        List<CacheEntry<V>> expired = new ArrayList<>();
        int removed = store.sweepExpired(expired);
        coordinator.publishEach(expired, InvalidationReason.EXPIRED);
        if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Removed " + removed + " expired entries");
        }
        return removed;
    }

    @Override
    public void addListener(CacheEventListener listener) {
        coordinator.addListener(listener);
    }

    @Override
    public boolean removeListener(CacheEventListener listener) {
        return coordinator.removeListener(listener);
    }

    @Override
    public CacheLimits getLimits() {
        return limits;
    }

    @Override
    public void close() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        if (cleanupScheduler != null) {
            cleanupScheduler.shutdown();
        }
    }

    // RenderCacheMetrics interface implementation for Micrometer integration

    @Override
    public long totalBytes() {
        return store.totalBytes();
    }

    @Override
    public long hitCount() {
        return statistics.hitCount();
    }

    @Override
    public long missCount() {
        return statistics.missCount();
    }

    @Override
    public long evictionCount() {
        return statistics.evictionCount();
    }

    @Override
    public long invalidationCount() {
        return statistics.invalidationCount();
    }

    @Override
    public long inFlightCount() {
        return inFlight.size();
    }

    @Override
    public double utilization() {
        return (double) store.size() / limits.getMaxEntries();
    }

    @Override
    public double memoryUtilization() {
        return (double) store.totalBytes() / limits.getMaxTotalBytes();
    }

    @Override
    public boolean isHealthy() {
        return store.healthStatus().isHealthy();
    }

    // Helper methods

    private CacheQueryResult<V> lookup(String key, boolean recordStats) {
        List<CacheEntry<V>> expired = new ArrayList<>(1);
        CacheQueryResult<V> result = store.get(key, recordStats, expired);
        coordinator.publishEach(expired, InvalidationReason.EXPIRED);
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer((result.isHit() ? "Cache hit: key=" : "Cache miss: key=") + key);
        }
        return result;
    }

    private void insert(String key, V value, String sourceFilePath, Long sourceFileModifiedAt) {
        List<CacheEntry<V>> evicted = new ArrayList<>();
        store.put(key, value, sourceFilePath, sourceFileModifiedAt, evicted);
        coordinator.publishEach(evicted, InvalidationReason.CAPACITY_LIMIT);
    }

    private V computeValue(String key, Callable<? extends V> compute) {
        V value;
        try {
            value = compute.call();
        } catch (Exception e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "Render computation failed, not cached: key=" + key, e);
            }
            throw new ComputeFailedException(key, e);
        }
        if (value == null) {
            throw new ComputeFailedException(key, new NullPointerException("compute returned null"));
        }
        return value;
    }

    private V await(String key, CompletableFuture<V> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ComputeFailedException(key, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderCacheException("Interrupted while waiting for render of key: " + key, e);
        }
    }

    private void scheduledCleanUp() {
        try {
            cleanUp();
        } catch (RuntimeException e) {
            // Keep the schedule alive; the next run retries
            LOGGER.log(Level.WARNING, "Scheduled cleanup failed", e);
        }
    }

    @Override
    public String toString() {
        return "ConcurrentRenderCache{size=" + store.size() + ", bytes=" + store.totalBytes()
                + ", limits=" + limits + ", enabled=" + enabled + "}";
    }
}
