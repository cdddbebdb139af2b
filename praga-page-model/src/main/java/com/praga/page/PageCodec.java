package com.praga.page;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;
import java.util.Objects;

/**
 * JSON mapping for pages: cache payloads and the attribute maps returned by tools.
 * Addresses render as canonical strings; {@code java.time} values as ISO-8601.
 */
public final class PageCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {};

    private PageCodec() {
    }

    /** Shared mapper configured for pages. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Page page) {
        Objects.requireNonNull(page, "page");
        try {
            return MAPPER.writeValueAsString(page);
        } catch (JsonProcessingException e) {
            throw new PageCodecException("Failed to serialize page " + page.getAddress() + ": " + e.getMessage(), e);
        }
    }

    public static <P extends Page> P fromJson(String json, Class<P> pageClass) {
        Objects.requireNonNull(pageClass, "pageClass");
        try {
            return MAPPER.readValue(json, pageClass);
        } catch (JsonProcessingException e) {
            throw new PageCodecException("Failed to read " + pageClass.getSimpleName() + " from JSON: " + e.getMessage(), e);
        }
    }

    /** Attribute map of the page (property name to JSON-compatible value). */
    public static Map<String, Object> toAttributes(Page page) {
        Objects.requireNonNull(page, "page");
        try {
            return MAPPER.convertValue(page, ATTRIBUTES);
        } catch (IllegalArgumentException e) {
            throw new PageCodecException("Failed to convert page " + page.getAddress() + " to attributes: " + e.getMessage(), e);
        }
    }
}
