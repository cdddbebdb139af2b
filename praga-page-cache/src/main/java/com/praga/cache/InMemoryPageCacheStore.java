package com.praga.cache;

import com.praga.page.PageAddress;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local {@link PageCacheStore}. Default store and the one used in tests.
 */
public final class InMemoryPageCacheStore implements PageCacheStore {

    private final Map<PageAddress, CacheRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheRecord> find(PageAddress address) {
        return Optional.ofNullable(records.get(address));
    }

    @Override
    public void put(CacheRecord record) {
        records.put(record.address(), record);
    }

    @Override
    public boolean markInvalid(PageAddress address) {
        return records.computeIfPresent(address, (k, r) -> r.invalidated()) != null;
    }

    @Override
    public int markInvalidAllVersions(PageAddress address) {
        AtomicInteger marked = new AtomicInteger();
        for (PageAddress key : records.keySet()) {
            if (samePage(key, address) && records.computeIfPresent(key, (k, r) -> r.invalidated()) != null) {
                marked.incrementAndGet();
            }
        }
        return marked.get();
    }

    @Override
    public OptionalInt latestVersion(PageAddress address) {
        return records.keySet().stream()
                .filter(k -> samePage(k, address))
                .mapToInt(PageAddress::version)
                .max();
    }

    @Override
    public boolean remove(PageAddress address) {
        return records.remove(address) != null;
    }

    @Override
    public List<CacheRecord> children(PageAddress parent) {
        return records.values().stream()
                .filter(r -> parent.equals(r.parent()))
                .sorted(Comparator.comparing(CacheRecord::address))
                .toList();
    }

    @Override
    public List<CacheRecord> findByType(String root, String type) {
        return records.values().stream()
                .filter(r -> r.address().root().equals(root) && r.address().type().equals(type))
                .sorted(Comparator.comparing(CacheRecord::address))
                .toList();
    }

    /** Number of records, valid or not. */
    public int size() {
        return records.size();
    }

    /** Removes all records (mainly for tests). */
    public void clear() {
        records.clear();
    }

    private static boolean samePage(PageAddress a, PageAddress b) {
        return a.root().equals(b.root()) && a.type().equals(b.type()) && a.id().equals(b.id());
    }
}
