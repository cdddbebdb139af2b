package com.praga.cache;

import com.praga.page.PageAddress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Persistent map from page address to {@link CacheRecord}. Writes for the same address are
 * last-write-wins. Implementations must be safe for concurrent use.
 * <p>
 * Failures are reported as {@link PageCacheException}.
 */
public interface PageCacheStore extends AutoCloseable {

    /** Record for exactly this address (all four components), valid or not. */
    Optional<CacheRecord> find(PageAddress address);

    /** Stores the record, replacing any record for the same address. */
    void put(CacheRecord record);

    /**
     * Marks the record for this address invalid.
     *
     * @return true if a record existed
     */
    boolean markInvalid(PageAddress address);

    /**
     * Marks every version of the page (same root, type and id as {@code address}) invalid.
     *
     * @return number of records marked
     */
    int markInvalidAllVersions(PageAddress address);

    /** Highest cached version of the page with the same root, type and id as {@code address}. */
    OptionalInt latestVersion(PageAddress address);

    /** Removes the record for this address; returns true if one existed. */
    boolean remove(PageAddress address);

    /** Records whose parent is exactly {@code parent}, valid or not, ordered by address. */
    List<CacheRecord> children(PageAddress parent);

    /** Records of one page type under one root, valid or not, ordered by address. */
    List<CacheRecord> findByType(String root, String type);

    /**
     * Records from the oldest cached ancestor down to {@code address} itself, following
     * {@link CacheRecord#parent()}. Stops at the first ancestor that is not cached or already
     * visited. Empty if {@code address} is not cached.
     */
    default List<CacheRecord> provenanceChain(PageAddress address) {
        List<CacheRecord> chain = new ArrayList<>();
        Set<PageAddress> seen = new HashSet<>();
        PageAddress current = address;
        while (current != null && seen.add(current)) {
            Optional<CacheRecord> record = find(current);
            if (record.isEmpty()) {
                break;
            }
            chain.add(record.get());
            current = record.get().parent();
        }
        Collections.reverse(chain);
        return chain;
    }

    @Override
    default void close() {
    }
}
