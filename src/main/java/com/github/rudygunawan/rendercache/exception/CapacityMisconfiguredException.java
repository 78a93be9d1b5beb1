package com.github.rudygunawan.rendercache.exception;

/**
 * Thrown at construction time when cache limits are invalid ({@code maxEntries <= 0},
 * {@code maxTotalBytes <= 0} or a negative TTL).
 */
public class CapacityMisconfiguredException extends IllegalArgumentException {

    public CapacityMisconfiguredException(String message) {
        super(message);
    }
}
