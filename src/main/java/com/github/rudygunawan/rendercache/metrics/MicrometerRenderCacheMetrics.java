package com.github.rudygunawan.rendercache.metrics;

import com.github.rudygunawan.rendercache.api.RenderCache;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for the render cache.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics, all tagged with {@code cache=<name>}:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.bytes - Sum of the byte sizes of cached entries
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.evictions - Entries removed by capacity limits or TTL
 *   <li>cache.invalidations - Entries removed by explicit, file-change or batch invalidation
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 *   <li>cache.utilization - Entry count relative to maxEntries
 *   <li>cache.memory.utilization - Cached bytes relative to maxTotalBytes
 *   <li>cache.healthy - 1 when the health check passes, 0 otherwise
 *   <li>cache.computations.inflight - Renders currently in progress
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * RenderCache<String> cache = RenderCacheBuilder.newBuilder()
 *     .maxEntries(1000)
 *     .build();
 *
 * MicrometerRenderCacheMetrics.monitor(registry, cache, "markdown");
 * }</pre>
 */
public class MicrometerRenderCacheMetrics implements MeterBinder {

    private final RenderCacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerRenderCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerRenderCacheMetrics(RenderCacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param <C> the cache type
     * @return the cache (for chaining)
     * @throws IllegalArgumentException if the cache does not expose metrics
     */
    public static <C extends RenderCache<?>> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param tags additional tags
     * @param <C> the cache type
     * @return the cache (for chaining)
     * @throws IllegalArgumentException if the cache does not expose metrics
     */
    public static <C extends RenderCache<?>> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        if (!(cache instanceof RenderCacheMetrics)) {
            throw new IllegalArgumentException("cache does not expose metrics: " + cache.getClass().getName());
        }
        new MicrometerRenderCacheMetrics((RenderCacheMetrics) cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, RenderCacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        Gauge.builder("cache.bytes", cache, RenderCacheMetrics::totalBytes)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Sum of the byte sizes of cached entries")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, RenderCacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, RenderCacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, RenderCacheMetrics::evictionCount)
                .tags(allTags)
                .description("Entries removed by capacity limits or TTL")
                .register(registry);

        FunctionCounter.builder("cache.invalidations", cache, RenderCacheMetrics::invalidationCount)
                .tags(allTags)
                .description("Entries removed by explicit, file-change or batch invalidation")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, RenderCacheMetrics::hitRatio)
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);

        Gauge.builder("cache.utilization", cache, RenderCacheMetrics::utilization)
                .tags(allTags)
                .description("Entry count relative to maxEntries")
                .register(registry);

        Gauge.builder("cache.memory.utilization", cache, RenderCacheMetrics::memoryUtilization)
                .tags(allTags)
                .description("Cached bytes relative to maxTotalBytes")
                .register(registry);

        Gauge.builder("cache.healthy", cache, c -> c.isHealthy() ? 1.0 : 0.0)
                .tags(allTags)
                .description("1 when the cache health check passes, 0 otherwise")
                .register(registry);

        Gauge.builder("cache.computations.inflight", cache, RenderCacheMetrics::inFlightCount)
                .tags(allTags)
                .description("Number of renders currently in progress")
                .register(registry);
    }
}
