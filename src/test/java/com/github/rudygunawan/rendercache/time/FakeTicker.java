package com.github.rudygunawan.rendercache.time;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A fake {@link Ticker} for testing TTL behavior without waiting for wall-clock time.
 *
 * <p><b>Example usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * RenderCache<String> cache = RenderCacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .ttl(100, TimeUnit.MILLISECONDS)
 *     .build();
 *
 * ticker.advance(150, TimeUnit.MILLISECONDS);
 * }</pre>
 *
 * <p>This class is thread-safe and can be used in concurrent tests.
 */
public class FakeTicker implements Ticker {

    private final AtomicLong millis;

    /**
     * Creates a new fake ticker starting at an arbitrary non-zero epoch.
     */
    public FakeTicker() {
        this(1_000_000L);
    }

    /**
     * Creates a new fake ticker starting at the given time.
     *
     * @param startMillis the initial time in milliseconds
     */
    public FakeTicker(long startMillis) {
        this.millis = new AtomicLong(startMillis);
    }

    /**
     * Advances the ticker by the specified duration.
     *
     * <p>Time can only advance forward. Negative durations are treated as zero.
     *
     * @param duration the amount of time to advance
     * @param unit the time unit of the duration
     * @return this ticker, for method chaining
     */
    public FakeTicker advance(long duration, TimeUnit unit) {
        return advance(unit.toMillis(duration));
    }

    /**
     * Advances the ticker by the specified number of milliseconds.
     *
     * @param milliseconds the number of milliseconds to advance
     * @return this ticker, for method chaining
     */
    public FakeTicker advance(long milliseconds) {
        if (milliseconds > 0) {
            millis.addAndGet(milliseconds);
        }
        return this;
    }

    @Override
    public long read() {
        return millis.get();
    }

    @Override
    public String toString() {
        return "FakeTicker(" + millis.get() + " ms)";
    }
}
