package com.praga.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method of a retriever toolkit as a tool. The toolkit collects annotated methods
 * (instance or static) when it is constructed and registers each one with the options below.
 * The method must return a collection of pages or a paginated response, optionally inside a
 * {@code CompletionStage}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RetrieverTool {

    /** Tool name; empty means the method name. */
    String name() default "";

    /** Description shown to agents; empty means none. */
    String description() default "";

    /** Whether direct calls are cached by argument fingerprint. */
    boolean cache() default false;

    /** Cache time-to-live in milliseconds; 0 or negative means entries never expire. */
    long ttlMillis() default 0L;

    /**
     * Invalidator class (must have a no-arg constructor and implement the toolkit's cache
     * invalidator contract). {@code Void.class} means none.
     */
    Class<?> invalidator() default Void.class;

    /** Whether the toolkit paginates the full result list with a cursor. */
    boolean paginate() default false;

    /** Page size cap when paginating. */
    int maxItems() default 20;

    /** Token budget per page when paginating. */
    int maxTokens() default 2048;
}
