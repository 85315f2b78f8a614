package com.crossfire.cache;

/**
 * Thrown when a value cannot be encoded for the cache, or a stored value cannot be decoded.
 */
public class CacheValueCodecException extends IllegalArgumentException {
    public CacheValueCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
