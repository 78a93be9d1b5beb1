package com.github.rudygunawan.rendercache.listener;

import com.github.rudygunawan.rendercache.model.InvalidationEvent;

/**
 * A listener notified after entries leave the cache.
 *
 * <p>Listeners run synchronously on the thread that caused the removal, after the store lock has
 * been released. An exception thrown by one listener is logged and does not prevent the others from
 * being notified.
 *
 * <pre>{@code
 * cache.addListener(event ->
 *     System.out.println("Removed " + event.getKeys() + " because " + event.getReason()));
 * }</pre>
 */
@FunctionalInterface
public interface CacheEventListener {

    /**
     * Notifies the listener of a removal.
     *
     * @param event the removal, never null
     */
    void onInvalidation(InvalidationEvent event);
}
