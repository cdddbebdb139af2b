package com.praga.router;

/**
 * Thrown when no handler is registered for an address type (neither as tag nor as alias).
 */
public final class UnknownPageTypeException extends RuntimeException {

    private final String type;

    public UnknownPageTypeException(String type) {
        super("No handler registered for page type: " + type);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
