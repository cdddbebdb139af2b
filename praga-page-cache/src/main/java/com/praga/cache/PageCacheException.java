package com.praga.cache;

/**
 * Thrown when the page cache backend (database, Redis) cannot complete an operation.
 */
public final class PageCacheException extends RuntimeException {

    public PageCacheException(String message) {
        super(message);
    }

    public PageCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
