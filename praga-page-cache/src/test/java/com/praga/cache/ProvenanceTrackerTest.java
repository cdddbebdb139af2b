package com.praga.cache;

import com.praga.page.PageAddress;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProvenanceTrackerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
    private static final PageAddress DOC = PageAddress.parse("root/doc:1");
    private static final PageAddress SUMMARY = PageAddress.parse("root/summary:1");

    private final InMemoryPageCacheStore store = new InMemoryPageCacheStore();
    private final ProvenanceTracker tracker = new ProvenanceTracker(store);

    @Test
    void validate_acceptsCachedParentOfOtherType() {
        store.put(CacheRecord.of(DOC, "{}", NOW));

        assertDoesNotThrow(() -> tracker.validate(SUMMARY, DOC));
    }

    @Test
    void validate_rejectsMissingParent() {
        ProvenanceException e = assertThrows(ProvenanceException.class, () -> tracker.validate(SUMMARY, DOC));

        assertEquals(DOC, e.getParent());
        assertEquals(SUMMARY, e.getChild());
        assertTrue(e.getMessage().contains("not cached"));
    }

    @Test
    void validate_rejectsExistingChild() {
        store.put(CacheRecord.of(DOC, "{}", NOW));
        store.put(CacheRecord.of(SUMMARY, "{}", NOW));

        assertThrows(ProvenanceException.class, () -> tracker.validate(SUMMARY, DOC));
    }

    @Test
    void validate_rejectsSameType() {
        store.put(CacheRecord.of(DOC, "{}", NOW));

        ProvenanceException e = assertThrows(ProvenanceException.class,
                () -> tracker.validate(PageAddress.parse("root/doc:2"), DOC));
        assertTrue(e.getMessage().contains("same page type"));
    }

    @Test
    void validate_rejectsUnversionedParent() {
        PageAddress unversioned = PageAddress.parse("root/doc:1@0");
        store.put(CacheRecord.of(unversioned, "{}", NOW));

        assertThrows(ProvenanceException.class, () -> tracker.validate(SUMMARY, unversioned));
    }

    @Test
    void validate_rejectsCycle() {
        // summary:1 was removed from the cache but doc:1 still names it as parent
        store.put(CacheRecord.of(DOC, "{}", NOW, SUMMARY));

        ProvenanceException e = assertThrows(ProvenanceException.class, () -> tracker.validate(SUMMARY, DOC));
        assertTrue(e.getMessage().contains("cycle"));
    }
}
