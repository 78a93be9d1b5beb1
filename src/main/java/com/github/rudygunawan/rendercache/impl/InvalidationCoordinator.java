package com.github.rudygunawan.rendercache.impl;

import com.github.rudygunawan.rendercache.listener.CacheEventListener;
import com.github.rudygunawan.rendercache.model.BatchOperationResult;
import com.github.rudygunawan.rendercache.model.CacheClearResult;
import com.github.rudygunawan.rendercache.model.CacheEntry;
import com.github.rudygunawan.rendercache.model.CacheLimits;
import com.github.rudygunawan.rendercache.model.FileChangeEvent;
import com.github.rudygunawan.rendercache.model.FileChangeKind;
import com.github.rudygunawan.rendercache.model.InvalidationEvent;
import com.github.rudygunawan.rendercache.policy.InvalidationReason;
import com.github.rudygunawan.rendercache.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns removal requests and file-change notifications into store removals, and publishes one
 * {@link InvalidationEvent} per removal to the registered listeners.
 *
 * <p>Entries belonging to a file are found through the store's file index; keys are never
 * inspected. Batch requests publish a single {@link InvalidationReason#BATCH} event for the whole
 * set.
 *
 * @param <V> the type of cached values
 */
public class InvalidationCoordinator<V> {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.rendercache.RenderCache");

    private final CacheStore<V> store;
    private final CacheLimits limits;
    private final Ticker ticker;
    private final List<CacheEventListener> listeners = new CopyOnWriteArrayList<>();

    public InvalidationCoordinator(CacheStore<V> store, CacheLimits limits, Ticker ticker) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.limits = Objects.requireNonNull(limits, "limits cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
    }

    public void addListener(CacheEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public boolean removeListener(CacheEventListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Removes {@code key} with reason {@link InvalidationReason#MANUAL}.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        CacheEntry<V> removed = store.remove(key, InvalidationReason.MANUAL);
        if (removed == null) {
            return false;
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Invalidated entry: key=" + key);
        }
        publish(InvalidationEvent.single(removed, InvalidationReason.MANUAL, ticker.read()));
        return true;
    }

    /**
     * Removes every entry rendered from {@code filePath}.
     *
     * @return the number of removed entries
     */
    public int invalidateByFilePath(String filePath) {
        Objects.requireNonNull(filePath, "filePath cannot be null");
        return removeForFile(filePath, entry -> true);
    }

    /**
     * Removes the entries rendered from {@code filePath} whose recorded modification time differs
     * from {@code currentModifiedAt}. Entries rendered from the current version are kept.
     *
     * @return the number of removed entries
     */
    public int invalidateByFilePath(String filePath, Long currentModifiedAt) {
        Objects.requireNonNull(filePath, "filePath cannot be null");
        return removeForFile(filePath, entry -> !Objects.equals(entry.getSourceFileModifiedAt(), currentModifiedAt));
    }

    /**
     * Applies a notification from the file watcher. Additions are ignored, as is everything when
     * file-based invalidation is disabled. An unlink removes every entry for the path, including
     * entries stored without a modification time.
     *
     * @return the number of removed entries
     */
    public int onFileChange(FileChangeEvent event) {
        Objects.requireNonNull(event, "event cannot be null");
        if (!limits.isFileBasedInvalidationEnabled() || !event.getKind().canInvalidate()) {
            return 0;
        }
        int removed = event.getKind() == FileChangeKind.UNLINK
                ? invalidateByFilePath(event.getPath())
                : invalidateByFilePath(event.getPath(), event.getNewModifiedAt());
        if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("File " + event.getKind() + " invalidated " + removed + " entries: path=" + event.getPath());
        }
        return removed;
    }

    /**
     * Removes every entry rendered from any of {@code filePaths} and publishes one batch event.
     *
     * @return the number of removed entries
     */
    public int invalidateAll(Collection<String> filePaths) {
        Objects.requireNonNull(filePaths, "filePaths cannot be null");
        List<CacheEntry<V>> removed = new ArrayList<>();
        for (String filePath : filePaths) {
            if (filePath != null) {
                store.removeByFilePath(filePath, entry -> true, InvalidationReason.BATCH, removed);
            }
        }
        publishSummary(removed, InvalidationReason.BATCH);
        return removed.size();
    }

    /**
     * Removes the given keys and publishes one batch event. Keys that were not cached are reported
     * as failures.
     */
    public BatchOperationResult invalidateKeys(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys cannot be null");
        long start = System.nanoTime();
        List<CacheEntry<V>> removed = new ArrayList<>();
        List<String> failedKeys = new ArrayList<>();
        for (String key : keys) {
            CacheEntry<V> entry = key == null ? null : store.remove(key, InvalidationReason.BATCH);
            if (entry == null) {
                failedKeys.add(key);
            } else {
                removed.add(entry);
            }
        }
        publishSummary(removed, InvalidationReason.BATCH);
        return new BatchOperationResult(removed.size(), failedKeys, Duration.ofNanos(System.nanoTime() - start));
    }

    /**
     * Empties the store and publishes one event covering every removed key, if there were any.
     */
    public CacheClearResult clear(InvalidationReason reason) {
        Objects.requireNonNull(reason, "reason cannot be null");
        List<CacheEntry<V>> removed = new ArrayList<>();
        CacheClearResult result = store.clear(reason, removed);
        if (result.getClearedCount() > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Cleared cache: " + result);
        }
        publishSummary(removed, reason);
        return result;
    }

    /**
     * Publishes one event per entry the store removed on its own.
     */
    public void publishEach(List<CacheEntry<V>> removed, InvalidationReason reason) {
        if (removed.isEmpty()) {
            return;
        }
        long now = ticker.read();
        for (CacheEntry<V> entry : removed) {
            publish(InvalidationEvent.single(entry, reason, now));
        }
    }

    private int removeForFile(String filePath, Predicate<CacheEntry<V>> filter) {
        List<CacheEntry<V>> removed = new ArrayList<>();
        store.removeByFilePath(filePath, filter, InvalidationReason.FILE_CHANGED, removed);
        publishEach(removed, InvalidationReason.FILE_CHANGED);
        return removed.size();
    }

    private void publishSummary(List<CacheEntry<V>> removed, InvalidationReason reason) {
        if (removed.isEmpty()) {
            return;
        }
        List<String> keys = new ArrayList<>(removed.size());
        for (CacheEntry<V> entry : removed) {
            keys.add(entry.getKey());
        }
        publish(InvalidationEvent.summary(keys, reason, ticker.read()));
    }

    private void publish(InvalidationEvent event) {
        for (CacheEventListener listener : listeners) {
            try {
                listener.onInvalidation(event);
            } catch (Exception e) {
                // Log and continue with the remaining listeners
                LOGGER.log(Level.WARNING, "CacheEventListener threw exception for event: " + event, e);
            }
        }
    }
}
