package com.github.rudygunawan.rendercache.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A time source that returns the current time in milliseconds.
 *
 * <p>All cache timestamps ({@code createdAt}, {@code lastAccessedAt}, TTL checks, statistics)
 * are read from a ticker. Tests install a fake implementation so that expiry can be exercised
 * without sleeping.
 *
 * <p><b>Production Usage:</b>
 * <pre>{@code
 * RenderCache<String> cache = RenderCacheBuilder.newBuilder()
 *     .ticker(Ticker.systemTicker())
 *     .ttl(30, TimeUnit.MINUTES)
 *     .build();
 * }</pre>
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * RenderCache<String> cache = RenderCacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .ttl(100, TimeUnit.MILLISECONDS)
 *     .build();
 *
 * cache.put(params, "<p>hi</p>", null);
 * ticker.advance(150, TimeUnit.MILLISECONDS);
 * assertFalse(cache.peek(params).isFound());
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the current time in milliseconds.
     *
     * <p>Values must never go backwards; eviction ordering relies on it.
     *
     * @return the current time in milliseconds
     */
    long read();

    /**
     * Returns a ticker that reads {@link System#currentTimeMillis()}.
     *
     * <p>This is the default ticker used by caches when no custom ticker is specified. A wall clock
     * stepped backwards (for example by NTP) holds at the highest value already returned until it
     * catches up.
     *
     * @return the wall-clock ticker
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Wraps {@code source} so that its readings never decrease.
     *
     * @param source the underlying time source
     * @return a ticker returning the maximum of all readings so far
     */
    static Ticker monotonic(Ticker source) {
        if (source == null) {
            throw new NullPointerException("source cannot be null");
        }
        return new MonotonicTicker(source);
    }

    /**
     * Default system ticker implementation using System.currentTimeMillis().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        private final Ticker clock = new MonotonicTicker(System::currentTimeMillis);

        @Override
        public long read() {
            return clock.read();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }

    /**
     * Clamps a time source to its highest reading.
     */
    final class MonotonicTicker implements Ticker {
        private final Ticker source;
        private final AtomicLong highest = new AtomicLong(Long.MIN_VALUE);

        private MonotonicTicker(Ticker source) {
            this.source = source;
        }

        @Override
        public long read() {
            return highest.accumulateAndGet(source.read(), Math::max);
        }

        @Override
        public String toString() {
            return "Ticker.monotonic(" + source + ")";
        }
    }
}
