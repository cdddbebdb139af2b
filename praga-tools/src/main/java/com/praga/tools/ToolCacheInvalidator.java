package com.praga.tools;

/**
 * Decides whether a cached tool result may still be served. Returning {@code false} evicts the entry
 * and the function runs again.
 */
@FunctionalInterface
public interface ToolCacheInvalidator {

    /**
     * @param cacheKey    fingerprint of the call
     * @param cachedValue value the function returned for that call
     */
    boolean isValid(String cacheKey, Object cachedValue);
}
