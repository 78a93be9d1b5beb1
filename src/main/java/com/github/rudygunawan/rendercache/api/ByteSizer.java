package com.github.rudygunawan.rendercache.api;

import java.nio.charset.StandardCharsets;

/**
 * Computes the byte size of a value at insertion. The size is charged against
 * {@code maxTotalBytes} for as long as the entry stays cached.
 *
 * <p>A sizer that throws, or returns a negative size, marks the value as uncacheable: the cache
 * logs the failure and hands the value back to the caller without storing it.
 *
 * <pre>{@code
 * RenderCache<byte[]> images = RenderCacheBuilder.newBuilder()
 *     .maxTotalBytes(50 * 1024 * 1024)
 *     .byteSizer(ByteSizer.byteArraySizer())
 *     .build();
 * }</pre>
 *
 * @param <V> the type of values
 */
@FunctionalInterface
public interface ByteSizer<V> {

    /**
     * Returns the size of {@code value} in bytes.
     *
     * @param value the value being cached (never null)
     * @return the size in bytes, must be non-negative
     */
    long sizeOf(V value);

    /**
     * Sizes character data by its UTF-8 encoding, which is what the HTTP layer sends.
     */
    static ByteSizer<CharSequence> utf8Sizer() {
        return value -> value.toString().getBytes(StandardCharsets.UTF_8).length;
    }

    static ByteSizer<byte[]> byteArraySizer() {
        return value -> value.length;
    }

    /**
     * Returns the sizer used when none is configured: UTF-8 length for character data, array
     * length for byte arrays. Any other type is rejected, so such values are never cached unless a
     * sizer is supplied.
     */
    static ByteSizer<Object> defaultSizer() {
        return value -> {
            if (value instanceof CharSequence) {
                return ((CharSequence) value).toString().getBytes(StandardCharsets.UTF_8).length;
            }
            if (value instanceof byte[]) {
                return ((byte[]) value).length;
            }
            throw new IllegalArgumentException("No byte size known for " + value.getClass().getName()
                    + "; configure a ByteSizer");
        };
    }
}
