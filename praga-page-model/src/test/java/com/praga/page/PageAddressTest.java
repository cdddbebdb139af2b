package com.praga.page;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PageAddressTest {

    @Test
    void parse_readsAllComponents() {
        PageAddress address = PageAddress.parse("praga/email:msg-17@3");

        assertEquals("praga", address.root());
        assertEquals("email", address.type());
        assertEquals("msg-17", address.id());
        assertEquals(3, address.version());
    }

    @Test
    void parse_withoutVersionUsesDefault() {
        PageAddress address = PageAddress.parse("root/doc:42");

        assertEquals(PageAddress.DEFAULT_VERSION, address.version());
        assertTrue(address.isDefaultVersion());
        assertEquals(PageAddress.of("root", "doc", "42"), address);
    }

    @Test
    void toString_omitsDefaultVersion() {
        assertEquals("root/doc:42", PageAddress.parse("root/doc:42@1").toString());
        assertEquals("root/doc:42@0", new PageAddress("root", "doc", "42", 0).toString());
        assertEquals("root/doc:42@7", PageAddress.of("root", "doc", "42").withVersion(7).toString());
    }

    @Test
    void format_parse_roundTripsOddButValidComponents() {
        List<PageAddress> samples = List.of(
                new PageAddress("", "doc", "1", 1),
                new PageAddress("root", "calendar_event", "a/b/c", 12),
                new PageAddress("r@x:y", "t", "id with spaces", 0),
                new PageAddress("root", "t", "1", Integer.MAX_VALUE));
        for (PageAddress a : samples) {
            assertEquals(a, PageAddress.parse(a.toString()), a.toString());
        }
    }

    @Test
    void parse_rejectsMalformedStrings() {
        for (String bad : List.of("", "doc:42", "root/doc", "root/:42", "root/doc:", "root/doc:42@",
                "root/doc:42@abc", "root/doc:42@-1", "root/doc:42@1@2", "root/doc:4:2",
                "root/doc:42@99999999999")) {
            assertThrows(MalformedAddressException.class, () -> PageAddress.parse(bad), bad);
        }
        assertThrows(MalformedAddressException.class, () -> PageAddress.parse(null));
    }

    @Test
    void constructor_rejectsForbiddenCharacters() {
        assertThrows(MalformedAddressException.class, () -> new PageAddress("a/b", "doc", "1", 1));
        assertThrows(MalformedAddressException.class, () -> new PageAddress("root", "do:c", "1", 1));
        assertThrows(MalformedAddressException.class, () -> new PageAddress("root", "doc", "1@2", 1));
        assertThrows(MalformedAddressException.class, () -> new PageAddress("root", "doc", "1", -1));
        assertThrows(MalformedAddressException.class, () -> new PageAddress("root", null, "1", 1));
    }

    @Test
    void equality_coversAllFourComponents() {
        PageAddress a = PageAddress.parse("root/doc:42@2");

        assertEquals(a, PageAddress.parse("root/doc:42@2"));
        assertEquals(a.hashCode(), PageAddress.parse("root/doc:42@2").hashCode());
        assertNotEquals(a, a.withVersion(3));
        assertNotEquals(a, PageAddress.parse("other/doc:42@2"));
        assertEquals("root/doc:42", a.prefix());
    }

    @Test
    void compareTo_ordersByRootTypeIdVersion() {
        List<PageAddress> list = new ArrayList<>(List.of(
                PageAddress.parse("b/doc:1"),
                PageAddress.parse("a/doc:2"),
                PageAddress.parse("a/doc:1@5"),
                PageAddress.parse("a/doc:1@0"),
                PageAddress.parse("a/chat:9")));
        list.sort(null);

        assertEquals(List.of(
                PageAddress.parse("a/chat:9"),
                PageAddress.parse("a/doc:1@0"),
                PageAddress.parse("a/doc:1@5"),
                PageAddress.parse("a/doc:2"),
                PageAddress.parse("b/doc:1")), list);
        assertFalse(PageAddress.parse("a/doc:1").compareTo(PageAddress.parse("a/doc:1")) != 0);
    }
}
