package com.praga.page;

/**
 * Thrown when a page address string or component does not follow the canonical format.
 */
public final class MalformedAddressException extends IllegalArgumentException {

    public MalformedAddressException(String message) {
        super(message);
    }

    public MalformedAddressException(String message, Throwable cause) {
        super(message, cause);
    }
}
