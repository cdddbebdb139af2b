/**
 * Page cache: the {@link com.praga.cache.PageCacheStore} contract, cache records and the in-memory
 * store. Database and Redis stores live in {@code com.praga.cache.store}; per-type freshness checks
 * in {@code com.praga.cache.validation}.
 */
package com.praga.cache;
