package com.praga.tools;

/**
 * Thrown when a function cannot be registered as a tool: unsupported return type, missing
 * parameter names, or options that conflict with the function's shape.
 */
public final class ToolRegistrationException extends IllegalArgumentException {

    public ToolRegistrationException(String message) {
        super(message);
    }

    public ToolRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
