package com.praga.page;

/**
 * Thrown when a page cannot be written to or read from JSON.
 */
public final class PageCodecException extends RuntimeException {

    public PageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
