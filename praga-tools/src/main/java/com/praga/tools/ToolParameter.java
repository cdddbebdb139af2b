package com.praga.tools;

import java.util.Objects;

/**
 * Declared parameter of a tool function: argument name and the Java type arguments are converted to.
 */
public record ToolParameter(String name, Class<?> type) {

    public ToolParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Tool parameter name must be non-blank");
        }
    }

    /** Untyped parameter; values are passed through as given. */
    public static ToolParameter of(String name) {
        return new ToolParameter(name, Object.class);
    }
}
