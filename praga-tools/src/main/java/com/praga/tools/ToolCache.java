package com.praga.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.praga.page.PageAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Result cache of one tool, keyed by the fingerprint of function identity and arguments.
 * Entries expire after the TTL (if any) and are evicted when the invalidator rejects them.
 * Concurrent misses on the same key may both run the function; the last write wins.
 */
final class ToolCache {

    private static final Logger log = LoggerFactory.getLogger(ToolCache.class);
    private static final ObjectMapper FINGERPRINT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private record Entry(Object value, Instant createdAt) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final ToolCacheInvalidator invalidator;
    private final Clock clock;

    ToolCache(Duration ttl, ToolCacheInvalidator invalidator, Clock clock) {
        this.ttl = ttl;
        this.invalidator = invalidator;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    Optional<Object> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (ttl != null && clock.instant().isAfter(entry.createdAt().plus(ttl))) {
            entries.remove(key, entry);
            log.debug("Tool cache entry {} expired", key);
            return Optional.empty();
        }
        if (invalidator != null && !stillValid(key, entry.value())) {
            entries.remove(key, entry);
            log.debug("Tool cache entry {} rejected by invalidator", key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    void put(String key, Object value) {
        entries.put(key, new Entry(value, clock.instant()));
    }

    int size() {
        return entries.size();
    }

    void clear() {
        entries.clear();
    }

    private boolean stillValid(String key, Object value) {
        try {
            return invalidator.isValid(key, value);
        } catch (RuntimeException e) {
            log.warn("Tool cache invalidator failed for {}; treating entry as stale: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * SHA-256 hex of {@code [identity, {arguments sorted by name}]} as JSON. Values that are not
     * JSON-native are rendered with {@code String.valueOf}.
     */
    static String fingerprint(String identity, Map<String, ?> arguments) {
        Map<String, Object> sorted = new TreeMap<>();
        arguments.forEach((k, v) -> sorted.put(k, normalize(v)));
        List<Object> key = new ArrayList<>(2);
        key.add(identity);
        key.add(sorted);
        try {
            byte[] json = FINGERPRINT_MAPPER.writeValueAsBytes(key);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool arguments cannot be fingerprinted: " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof PageAddress || value instanceof Enum<?> || value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), normalize(v)));
            return sorted;
        }
        if (value instanceof Collection<?> items) {
            List<Object> list = new ArrayList<>(items.size());
            for (Object item : items) {
                list.add(normalize(item));
            }
            return list;
        }
        if (value instanceof Object[] array) {
            return normalize(Arrays.asList(array));
        }
        return String.valueOf(value);
    }
}
