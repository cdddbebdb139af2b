package com.praga.router;

import com.praga.page.DuplicateRegistrationException;
import com.praga.page.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of page handlers by canonical type tag, plus aliases that resolve to a tag.
 * A tag or alias can be taken once; a second registration under a taken name throws
 * {@link DuplicateRegistrationException}. Registration is serialized so tag and alias checks see
 * each other; lookups are lock-free.
 */
public final class PageHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(PageHandlerRegistry.class);

    /** typeTag → entry */
    private final Map<String, PageHandlerEntry<?>> handlersByTag = new ConcurrentHashMap<>();
    /** alias → typeTag */
    private final Map<String, String> tagsByAlias = new ConcurrentHashMap<>();

    /**
     * Registers a handler.
     *
     * @param typeTag      canonical type tag (the type component of addresses it serves)
     * @param pageClass    class of produced pages
     * @param producer     blocking or suspending producer
     * @param cacheEnabled whether produced pages are cached
     * @param aliases      alternative type names routed to the same handler
     * @throws DuplicateRegistrationException if the tag or an alias is already taken
     * @throws IllegalArgumentException       if a name is blank or not a valid address type
     */
    public synchronized <P extends Page> PageHandlerEntry<P> register(String typeTag, Class<P> pageClass,
                                                                      PageProducer<P> producer, boolean cacheEnabled,
                                                                      Collection<String> aliases) {
        requireTypeName(typeTag);
        List<String> aliasList = aliases == null ? List.of() : List.copyOf(aliases);
        if (isTaken(typeTag)) {
            throw new DuplicateRegistrationException("Page handler", typeTag);
        }
        for (int i = 0; i < aliasList.size(); i++) {
            String alias = aliasList.get(i);
            requireTypeName(alias);
            if (isTaken(alias) || alias.equals(typeTag) || aliasList.subList(0, i).contains(alias)) {
                throw new DuplicateRegistrationException("Type alias", alias);
            }
        }
        PageHandlerEntry<P> entry = new PageHandlerEntry<>(typeTag, aliasList, pageClass, producer, cacheEnabled);
        handlersByTag.put(typeTag, entry);
        for (String alias : aliasList) {
            tagsByAlias.put(alias, typeTag);
        }
        log.debug("Registered page handler type={} aliases={} cache={}", typeTag, aliasList, cacheEnabled);
        return entry;
    }

    /**
     * Handler for a canonical tag or an alias.
     *
     * @throws UnknownPageTypeException if neither a tag nor an alias matches
     */
    public PageHandlerEntry<?> resolve(String typeOrAlias) {
        return find(typeOrAlias).orElseThrow(() -> new UnknownPageTypeException(typeOrAlias));
    }

    public Optional<PageHandlerEntry<?>> find(String typeOrAlias) {
        if (typeOrAlias == null) {
            return Optional.empty();
        }
        PageHandlerEntry<?> entry = handlersByTag.get(typeOrAlias);
        if (entry == null) {
            String tag = tagsByAlias.get(typeOrAlias);
            entry = tag != null ? handlersByTag.get(tag) : null;
        }
        return Optional.ofNullable(entry);
    }

    /** Canonical tag for a tag or alias; the name itself when nothing is registered under it. */
    public String canonicalTag(String typeOrAlias) {
        return find(typeOrAlias).map(PageHandlerEntry::typeTag).orElse(typeOrAlias);
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(handlersByTag.keySet());
    }

    /** Removes all handlers and aliases (mainly for tests). */
    public synchronized void clear() {
        handlersByTag.clear();
        tagsByAlias.clear();
    }

    private boolean isTaken(String name) {
        return handlersByTag.containsKey(name) || tagsByAlias.containsKey(name);
    }

    private static void requireTypeName(String name) {
        Objects.requireNonNull(name, "typeTag");
        if (name.isBlank() || name.indexOf('/') >= 0 || name.indexOf(':') >= 0 || name.indexOf('@') >= 0) {
            throw new IllegalArgumentException("Page type must be non-blank without '/', ':' or '@': " + name);
        }
    }
}
