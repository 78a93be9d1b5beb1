package com.github.rudygunawan.rendercache.exception;

/**
 * Thrown when render inputs cannot be turned into a cache key, for example when an option or
 * metadata value cannot be serialized.
 */
public class InvalidKeyParamsException extends RenderCacheException {

    public InvalidKeyParamsException(String message) {
        super(message);
    }

    public InvalidKeyParamsException(String message, Throwable cause) {
        super(message, cause);
    }
}
