package com.github.rudygunawan.rendercache.model;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * One item to pre-populate: the render inputs plus the computation producing the value.
 *
 * @param <V> the type of the cached value
 */
public final class WarmupEntry<V> {
    private final CacheKeyParams params;
    private final Long sourceFileModifiedAt;
    private final Callable<? extends V> compute;

    public WarmupEntry(CacheKeyParams params, Long sourceFileModifiedAt, Callable<? extends V> compute) {
        this.params = Objects.requireNonNull(params, "params cannot be null");
        this.sourceFileModifiedAt = sourceFileModifiedAt;
        this.compute = Objects.requireNonNull(compute, "compute cannot be null");
    }

    public static <V> WarmupEntry<V> of(CacheKeyParams params, Callable<? extends V> compute) {
        return new WarmupEntry<>(params, null, compute);
    }

    public CacheKeyParams getParams() {
        return params;
    }

    public Long getSourceFileModifiedAt() {
        return sourceFileModifiedAt;
    }

    public Callable<? extends V> getCompute() {
        return compute;
    }
}
