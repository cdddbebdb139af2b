package com.praga.tools;

import java.time.Duration;

/**
 * Registration options for a tool.
 * <p>
 * Caching applies to the function's raw result. Pagination ({@code paginate}) slices the full
 * result list with a numeric cursor and a per-page item cap and token budget; it must stay off for
 * functions that already return a {@link PaginatedResponse}.
 */
public final class ToolOptions {

    public static final int DEFAULT_MAX_ITEMS = 20;
    public static final int DEFAULT_MAX_TOKENS = 2048;

    private static final ToolOptions DEFAULTS = builder().build();

    private final String name;
    private final String description;
    private final boolean cache;
    private final Duration ttl;
    private final ToolCacheInvalidator invalidator;
    private final boolean paginate;
    private final int maxItems;
    private final int maxTokens;

    private ToolOptions(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.cache = b.cache;
        this.ttl = b.ttl;
        this.invalidator = b.invalidator;
        this.paginate = b.paginate;
        this.maxItems = b.maxItems;
        this.maxTokens = b.maxTokens;
    }

    /** No caching, no pagination, name taken from the function. */
    public static ToolOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Tool name override; {@code null} means the function's own name. */
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isCache() {
        return cache;
    }

    /** Time-to-live of cache entries; {@code null} means entries do not expire. */
    public Duration getTtl() {
        return ttl;
    }

    public ToolCacheInvalidator getInvalidator() {
        return invalidator;
    }

    public boolean isPaginate() {
        return paginate;
    }

    public int getMaxItems() {
        return maxItems;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public static final class Builder {
        private String name;
        private String description = "";
        private boolean cache;
        private Duration ttl;
        private ToolCacheInvalidator invalidator;
        private boolean paginate;
        private int maxItems = DEFAULT_MAX_ITEMS;
        private int maxTokens = DEFAULT_MAX_TOKENS;

        public Builder name(String name) {
            this.name = name != null && !name.isBlank() ? name.trim() : null;
            return this;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder cache(boolean cache) {
            this.cache = cache;
            return this;
        }

        public Builder ttl(Duration ttl) {
            if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
                throw new IllegalArgumentException("ttl must be positive: " + ttl);
            }
            this.ttl = ttl;
            return this;
        }

        public Builder invalidator(ToolCacheInvalidator invalidator) {
            this.invalidator = invalidator;
            return this;
        }

        public Builder paginate(boolean paginate) {
            this.paginate = paginate;
            return this;
        }

        public Builder maxItems(int maxItems) {
            if (maxItems <= 0) {
                throw new IllegalArgumentException("maxItems must be > 0: " + maxItems);
            }
            this.maxItems = maxItems;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            if (maxTokens <= 0) {
                throw new IllegalArgumentException("maxTokens must be > 0: " + maxTokens);
            }
            this.maxTokens = maxTokens;
            return this;
        }

        public ToolOptions build() {
            return new ToolOptions(this);
        }
    }
}
