package com.praga.tools;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only arguments handed to a lambda tool body.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    ToolArguments(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(Objects.requireNonNull(values, "values"));
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object v = values.get(name);
        return v != null ? v.toString() : null;
    }

    /** Integer argument; strings are parsed, missing or blank values give the default. */
    public int getInt(String name, int defaultValue) {
        Object v = values.get(name);
        if (v instanceof Number n) {
            return n.intValue();
        }
        if (v == null || v.toString().isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument '" + name + "' is not an integer: " + v, e);
        }
    }

    /** The {@code cursor} argument of a self-paginating function; {@code null} on the first page. */
    public String getCursor() {
        return getString(Tool.CURSOR);
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
