package com.praga.config;

/**
 * Backing store for the page cache (PRAGA_CACHE_STORE).
 */
public enum CacheStoreType {

    /** Process-local map; contents are lost on restart. */
    MEMORY,

    /** PostgreSQL table via JDBC (PRAGA_DB_*). */
    JDBC,

    /** Redis hashes via Jedis (PRAGA_CACHE_HOST, PRAGA_CACHE_PORT). */
    REDIS;

    /** Parses a case-insensitive name; blank or unknown values give the default. */
    public static CacheStoreType parse(String value, CacheStoreType defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        for (CacheStoreType t : values()) {
            if (t.name().equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        return defaultValue;
    }
}
