package com.github.rudygunawan.rendercache.builder;

import com.github.rudygunawan.rendercache.api.ByteSizer;
import com.github.rudygunawan.rendercache.api.RenderCache;
import com.github.rudygunawan.rendercache.exception.CapacityMisconfiguredException;
import com.github.rudygunawan.rendercache.impl.ConcurrentRenderCache;
import com.github.rudygunawan.rendercache.listener.CacheEventListener;
import com.github.rudygunawan.rendercache.model.CacheLimits;
import com.github.rudygunawan.rendercache.time.Ticker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A builder of {@link RenderCache} instances.
 *
 * <p>Every option has a default taken from {@link CacheLimits}: 1000 entries, 10 MiB, a 30 minute
 * TTL, file-based invalidation and statistics enabled. Limits are validated when {@link #build()}
 * is called.
 *
 * <p>Usage example:
 * <pre>{@code
 * RenderCache<String> html = RenderCacheBuilder.newBuilder()
 *     .maxEntries(500)
 *     .maxTotalBytes(5 * 1024 * 1024)
 *     .ttl(10, TimeUnit.MINUTES)
 *     .byteSizer(ByteSizer.utf8Sizer())
 *     .build();
 *
 * String page = html.getOrCompute(CacheKeyParams.of(markdown, "docs/intro.md"),
 *     () -> renderer.render(markdown));
 * }</pre>
 *
 * @param <V> the type of rendered values
 */
public class RenderCacheBuilder<V> {
    private static final long UNSET = -1;

    private long maxEntries = CacheLimits.DEFAULT_MAX_ENTRIES;
    private long maxTotalBytes = CacheLimits.DEFAULT_MAX_TOTAL_BYTES;
    private long ttlMillis = CacheLimits.DEFAULT_TTL_MILLIS;
    private boolean fileBasedInvalidation = true;
    private boolean recordStats = true;
    private boolean enabled = true;
    private ByteSizer<? super V> byteSizer;
    private Ticker ticker;
    private final List<CacheEventListener> listeners = new ArrayList<>();
    private long cleanupIntervalMillis = UNSET;

    private RenderCacheBuilder() {
    }

    /**
     * Constructs a new {@code RenderCacheBuilder} instance with default settings.
     */
    public static RenderCacheBuilder<Object> newBuilder() {
        return new RenderCacheBuilder<>();
    }

    /**
     * Specifies the maximum number of entries. When an insertion exceeds it, the least recently
     * used entries are evicted.
     *
     * @param maxEntries the maximum number of entries, must be positive
     * @return this builder instance
     */
    public RenderCacheBuilder<V> maxEntries(long maxEntries) {
        this.maxEntries = maxEntries;
        return this;
    }

    /**
     * Specifies the maximum sum of entry byte sizes. When an insertion exceeds it, the least
     * recently used entries are evicted regardless of their size. A single value larger than the
     * limit is evicted as soon as it is inserted.
     *
     * @param maxTotalBytes the byte limit, must be positive
     * @return this builder instance
     */
    public RenderCacheBuilder<V> maxTotalBytes(long maxTotalBytes) {
        this.maxTotalBytes = maxTotalBytes;
        return this;
    }

    /**
     * Specifies how long an entry stays valid after it was inserted. Zero disables expiry. A positive
     * duration shorter than one millisecond is rounded up to one millisecond.
     *
     * @param duration the time to live
     * @param unit the unit that {@code duration} is expressed in
     * @return this builder instance
     */
    public RenderCacheBuilder<V> ttl(long duration, TimeUnit unit) {
        if (unit == null) {
            throw new NullPointerException("unit cannot be null");
        }
        this.ttlMillis = duration > 0 ? Math.max(1, unit.toMillis(duration)) : duration;
        return this;
    }

    /**
     * Enables or disables reaction to file watcher notifications. Explicit invalidation by file path
     * works either way.
     *
     * @return this builder instance
     */
    public RenderCacheBuilder<V> fileBasedInvalidation(boolean enabled) {
        this.fileBasedInvalidation = enabled;
        return this;
    }

    /**
     * Enables or disables hit, miss, eviction and invalidation counting. Without it
     * {@link RenderCache#statistics()} reports zero for all counters.
     *
     * @return this builder instance
     */
    public RenderCacheBuilder<V> recordStats(boolean recordStats) {
        this.recordStats = recordStats;
        return this;
    }

    /**
     * Specifies how the byte size of a value is computed. Without it, character sequences count
     * their UTF-8 length and byte arrays their length; values of other types are not cached.
     *
     * <p>The sizer is called once per insertion, outside the cache lock. A sizer that throws or
     * returns a negative size prevents the value from being cached.
     *
     * @param <V1> the value type of the sizer
     * @param byteSizer the sizer to use
     * @return this builder instance, with its type parameter adjusted to match the sizer
     * @throws IllegalStateException if a sizer was already set
     */
    public <V1 extends V> RenderCacheBuilder<V1> byteSizer(ByteSizer<? super V1> byteSizer) {
        if (byteSizer == null) {
            throw new NullPointerException("byteSizer cannot be null");
        }
        if (this.byteSizer != null) {
            throw new IllegalStateException("byteSizer was already set");
        }
        @SuppressWarnings("unchecked")
        RenderCacheBuilder<V1> me = (RenderCacheBuilder<V1>) this;
        me.byteSizer = byteSizer;
        return me;
    }

    /**
     * Specifies the clock used for TTL and access times. Intended for tests.
     *
     * @return this builder instance
     */
    public RenderCacheBuilder<V> ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Registers a listener notified of every removal. More can be added to the built cache.
     *
     * <p><b>Warning:</b> all exceptions thrown by {@code listener} will be logged and then swallowed.
     *
     * @return this builder instance
     */
    public RenderCacheBuilder<V> listener(CacheEventListener listener) {
        if (listener == null) {
            throw new NullPointerException("listener cannot be null");
        }
        this.listeners.add(listener);
        return this;
    }

    /**
     * Starts a background thread that removes expired entries at a fixed rate. Without it, expired
     * entries are removed when read or on {@link RenderCache#cleanUp()}.
     *
     * @param interval the time between sweeps, must be positive
     * @param unit the unit that {@code interval} is expressed in
     * @return this builder instance
     * @throws IllegalArgumentException if {@code interval} is not positive
     */
    public RenderCacheBuilder<V> cleanupInterval(long interval, TimeUnit unit) {
        if (interval <= 0) {
            throw new IllegalArgumentException("cleanup interval must be positive");
        }
        if (unit == null) {
            throw new NullPointerException("unit cannot be null");
        }
        this.cleanupIntervalMillis = unit.toMillis(interval);
        return this;
    }

    /**
     * Builds a cache that stores nothing: every lookup misses and every render is computed.
     *
     * @return this builder instance
     */
    public RenderCacheBuilder<V> disabled() {
        this.enabled = false;
        return this;
    }

    /**
     * Builds a cache with the configured settings.
     *
     * @param <V1> the value type of the cache
     * @return a new cache instance
     * @throws CapacityMisconfiguredException if a limit is zero or negative, or the TTL is negative
     */
    public <V1 extends V> RenderCache<V1> build() {
        return new ConcurrentRenderCache<>(this);
    }

    /**
     * Returns the validated limits for the configured settings.
     *
     * @throws CapacityMisconfiguredException if a limit is zero or negative, or the TTL is negative
     */
    public CacheLimits getLimits() {
        return new CacheLimits(maxEntries, maxTotalBytes, ttlMillis, fileBasedInvalidation, recordStats);
    }

    public ByteSizer<? super V> getByteSizer() {
        return byteSizer == null ? ByteSizer.defaultSizer() : byteSizer;
    }

    public Ticker getTicker() {
        return ticker == null ? Ticker.systemTicker() : ticker;
    }

    public List<CacheEventListener> getListeners() {
        return List.copyOf(listeners);
    }

    /**
     * Returns the background sweep interval in milliseconds, or a negative value if none is set.
     */
    public long getCleanupIntervalMillis() {
        return cleanupIntervalMillis;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
