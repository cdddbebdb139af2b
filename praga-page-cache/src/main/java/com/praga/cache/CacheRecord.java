package com.praga.cache;

import com.praga.page.PageAddress;

import java.time.Instant;
import java.util.Objects;

/**
 * One cached page: its address, the page JSON, when it was written, whether it is still valid and
 * the page it was derived from ({@code parent}, or {@code null}).
 * An invalid record stays in the store so it can be served on a stale read.
 */
public record CacheRecord(PageAddress address, String payload, Instant createdAt, boolean valid, PageAddress parent) {

    public CacheRecord {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /** A valid record without a parent. */
    public static CacheRecord of(PageAddress address, String payload, Instant createdAt) {
        return new CacheRecord(address, payload, createdAt, true, null);
    }

    /** A valid record derived from {@code parent} (may be {@code null}). */
    public static CacheRecord of(PageAddress address, String payload, Instant createdAt, PageAddress parent) {
        return new CacheRecord(address, payload, createdAt, true, parent);
    }

    public boolean hasParent() {
        return parent != null;
    }

    public CacheRecord invalidated() {
        return valid ? new CacheRecord(address, payload, createdAt, false, parent) : this;
    }
}
