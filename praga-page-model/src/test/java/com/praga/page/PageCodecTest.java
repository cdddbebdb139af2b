package com.praga.page;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PageCodecTest {

    private static final Instant MODIFIED = Instant.parse("2024-03-01T10:15:30Z");

    private static NotePage note() {
        return new NotePage(PageAddress.parse("praga/note:n1@2"), "Quarterly plan", MODIFIED,
                PageAddress.parse("praga/folder:f9"), List.of("planning", "q2"));
    }

    @Test
    void toAttributes_rendersAddressesAsCanonicalStrings() {
        Map<String, Object> attrs = PageCodec.toAttributes(note());

        assertEquals("praga/note:n1@2", attrs.get("uri"));
        assertEquals("praga/folder:f9", attrs.get("parent"));
        assertEquals("Quarterly plan", attrs.get("title"));
        assertEquals("2024-03-01T10:15:30Z", attrs.get("modifiedAt"));
        assertEquals(List.of("planning", "q2"), attrs.get("tags"));
    }

    @Test
    void fromJson_restoresTypedPage() {
        String json = PageCodec.toJson(note());

        NotePage restored = PageCodec.fromJson(json, NotePage.class);

        assertEquals(PageAddress.parse("praga/note:n1@2"), restored.getAddress());
        assertEquals(PageAddress.parse("praga/folder:f9"), restored.getParent());
        assertEquals(MODIFIED, restored.getModifiedAt());
        assertEquals("Quarterly plan", restored.getTitle());
    }

    @Test
    void fromJson_ignoresUnknownProperties() {
        NotePage restored = PageCodec.fromJson(
                "{\"uri\":\"praga/note:n2\",\"title\":\"t\",\"legacyField\":1}", NotePage.class);

        assertEquals(PageAddress.parse("praga/note:n2"), restored.getAddress());
    }

    @Test
    void fromJson_malformedAddressFails() {
        assertThrows(PageCodecException.class,
                () -> PageCodec.fromJson("{\"uri\":\"not-an-address\"}", NotePage.class));
    }
}
