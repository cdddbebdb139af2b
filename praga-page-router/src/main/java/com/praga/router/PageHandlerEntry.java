package com.praga.router;

import com.praga.page.Page;

import java.util.List;
import java.util.Objects;

/**
 * Registered handler for one page type: canonical tag, aliases, page class (used to decode cache
 * payloads), producer and whether results are cached.
 */
public record PageHandlerEntry<P extends Page>(
        String typeTag,
        List<String> aliases,
        Class<P> pageClass,
        PageProducer<P> producer,
        boolean cacheEnabled
) {
    public PageHandlerEntry {
        Objects.requireNonNull(typeTag, "typeTag");
        Objects.requireNonNull(pageClass, "pageClass");
        Objects.requireNonNull(producer, "producer");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
