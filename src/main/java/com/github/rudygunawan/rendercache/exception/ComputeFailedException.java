package com.github.rudygunawan.rendercache.exception;

/**
 * Thrown when the compute function supplied to
 * {@link com.github.rudygunawan.rendercache.api.RenderCache#getOrCompute} throws or returns
 * {@code null}.
 *
 * <p>Every caller that joined the same in-flight computation receives the same instance. The
 * failed result is never cached, so the next caller runs the computation again.
 */
public class ComputeFailedException extends RenderCacheException {

    private final String key;

    public ComputeFailedException(String key, Throwable cause) {
        super("Render computation failed for key: " + key, cause);
        this.key = key;
    }

    /**
     * Returns the cache key whose computation failed.
     */
    public String getKey() {
        return key;
    }
}
