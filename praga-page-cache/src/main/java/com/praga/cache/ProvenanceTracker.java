package com.praga.cache;

import com.praga.page.PageAddress;

import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Checks parent links before a derived page is stored. A child may be linked to a parent when:
 * <ul>
 *   <li>the parent is cached and has a fixed version ({@code > 0});</li>
 *   <li>the child is not cached yet;</li>
 *   <li>parent and child have different page types;</li>
 *   <li>the link does not close a cycle in the parent chain.</li>
 * </ul>
 */
public final class ProvenanceTracker {

    private final PageCacheStore store;

    public ProvenanceTracker(PageCacheStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @throws ProvenanceException if any check fails
     */
    public void validate(PageAddress child, PageAddress parent) {
        Objects.requireNonNull(child, "child");
        Objects.requireNonNull(parent, "parent");
        if (parent.version() <= 0) {
            throw new ProvenanceException(child, parent, "parent version must be fixed (> 0)");
        }
        if (store.find(parent).isEmpty()) {
            throw new ProvenanceException(child, parent, "parent is not cached");
        }
        if (store.find(child).isPresent()) {
            throw new ProvenanceException(child, parent, "child is already cached");
        }
        if (child.type().equals(parent.type())) {
            throw new ProvenanceException(child, parent, "parent and child have the same page type " + child.type());
        }
        checkForCycles(child, parent);
    }

    private void checkForCycles(PageAddress child, PageAddress parent) {
        Set<PageAddress> visited = new HashSet<>();
        visited.add(child);
        PageAddress current = parent;
        while (current != null) {
            if (!visited.add(current)) {
                throw new ProvenanceException(child, parent, "link would create a cycle at " + current);
            }
            Optional<CacheRecord> record = store.find(current);
            current = record.map(CacheRecord::parent).orElse(null);
        }
    }
}
