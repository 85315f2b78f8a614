package com.crossfire.cache;

/**
 * Thrown when the cache storage cannot be read or written.
 */
public class CacheStorageException extends RuntimeException {
    public CacheStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
