package com.github.rudygunawan.rendercache.exception;

/**
 * Base class for errors raised by the render cache.
 */
public class RenderCacheException extends RuntimeException {

    public RenderCacheException(String message) {
        super(message);
    }

    public RenderCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
