package com.github.rudygunawan.rendercache.model;

import com.github.rudygunawan.rendercache.policy.InvalidationReason;

import java.util.List;

/**
 * Notification that one or more entries left the cache.
 *
 * <p>Single-entry events carry the key and a snapshot of the removed entry. Events summarizing
 * several removals (batch invalidation, clear) carry every affected key in {@link #getKeys()} and
 * have a null {@link #getKey()}.
 */
public final class InvalidationEvent {
    private final String key;
    private final List<String> keys;
    private final InvalidationReason reason;
    private final long timestamp;
    private final CacheEntry<?> entry;

    private InvalidationEvent(String key, List<String> keys, InvalidationReason reason, long timestamp,
                              CacheEntry<?> entry) {
        this.key = key;
        this.keys = keys;
        this.reason = reason;
        this.timestamp = timestamp;
        this.entry = entry;
    }

    public static InvalidationEvent single(CacheEntry<?> removed, InvalidationReason reason, long timestamp) {
        return new InvalidationEvent(removed.getKey(), List.of(removed.getKey()), reason, timestamp, removed);
    }

    public static InvalidationEvent summary(List<String> keys, InvalidationReason reason, long timestamp) {
        return new InvalidationEvent(null, List.copyOf(keys), reason, timestamp, null);
    }

    /**
     * Returns the removed key, or null for a multi-entry event.
     */
    public String getKey() {
        return key;
    }

    public List<String> getKeys() {
        return keys;
    }

    public InvalidationReason getReason() {
        return reason;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Returns a snapshot of the removed entry, or null for a multi-entry event.
     */
    public CacheEntry<?> getEntry() {
        return entry;
    }

    public boolean isSummary() {
        return key == null;
    }

    @Override
    public String toString() {
        return "InvalidationEvent{"
                + (key != null ? "key=" + key : "keys=" + keys.size())
                + ", reason=" + reason
                + ", timestamp=" + timestamp
                + '}';
    }
}
