package com.github.rudygunawan.rendercache.model;

import com.github.rudygunawan.rendercache.policy.InvalidationReason;

/**
 * Before and after view of a {@code clear()} call.
 */
public final class CacheClearResult {
    private final long beforeSize;
    private final long beforeByteSize;
    private final long afterSize;
    private final long afterByteSize;
    private final long clearedCount;
    private final InvalidationReason reason;

    public CacheClearResult(long beforeSize, long beforeByteSize, long afterSize, long afterByteSize,
                            long clearedCount, InvalidationReason reason) {
        this.beforeSize = beforeSize;
        this.beforeByteSize = beforeByteSize;
        this.afterSize = afterSize;
        this.afterByteSize = afterByteSize;
        this.clearedCount = clearedCount;
        this.reason = reason;
    }

    public long getBeforeSize() {
        return beforeSize;
    }

    public long getBeforeByteSize() {
        return beforeByteSize;
    }

    public long getAfterSize() {
        return afterSize;
    }

    public long getAfterByteSize() {
        return afterByteSize;
    }

    public long getClearedCount() {
        return clearedCount;
    }

    public InvalidationReason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "CacheClearResult{"
                + "beforeSize=" + beforeSize
                + ", beforeByteSize=" + beforeByteSize
                + ", afterSize=" + afterSize
                + ", afterByteSize=" + afterByteSize
                + ", clearedCount=" + clearedCount
                + ", reason=" + reason
                + '}';
    }
}
