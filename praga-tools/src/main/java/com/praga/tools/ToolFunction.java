package com.praga.tools;

import java.util.List;
import java.util.Map;

/**
 * A retrieval function that can be registered as a tool. Built reflectively from a method
 * ({@link ToolFunctions#fromMethod}) or from a lambda ({@link ToolFunctions#pages},
 * {@link ToolFunctions#paginated}).
 */
public interface ToolFunction {

    /** Stable identity of the function; part of every cache fingerprint. */
    String identity();

    /** Default tool name. */
    String name();

    /** Parameters in declaration order; the first receives a plain-string invocation input. */
    List<ToolParameter> parameters();

    ToolReturnKind returnKind();

    /**
     * Bound arguments converted to the values {@link #apply} will receive. Called before the cache
     * fingerprint is taken, so equivalent inputs ({@code 2} and {@code "2"} for an {@code int})
     * share a cache entry. The default keeps the arguments as given.
     *
     * @throws IllegalArgumentException if an argument cannot be converted
     */
    default Map<String, Object> normalize(Map<String, Object> arguments) {
        return arguments;
    }

    /**
     * Runs the function.
     *
     * @param arguments one entry per declared parameter (missing arguments are {@code null})
     * @return a {@code List} of pages or a {@link PaginatedResponse}, per {@link #returnKind()}
     */
    Object apply(Map<String, Object> arguments) throws Exception;
}
