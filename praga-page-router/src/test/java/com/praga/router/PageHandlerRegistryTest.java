package com.praga.router;

import com.praga.page.DuplicateRegistrationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PageHandlerRegistryTest {

    private static final PageProducer<DocPage> PRODUCER = PageProducer.blocking(a -> new DocPage(a, "t"));

    private final PageHandlerRegistry registry = new PageHandlerRegistry();

    @Test
    void resolve_followsAliases() {
        PageHandlerEntry<DocPage> entry = registry.register("gmail_message", DocPage.class, PRODUCER, true, List.of("email", "mail"));

        assertSame(entry, registry.resolve("gmail_message"));
        assertSame(entry, registry.resolve("email"));
        assertSame(entry, registry.resolve("mail"));
        assertEquals("gmail_message", registry.canonicalTag("email"));
        assertEquals("unregistered", registry.canonicalTag("unregistered"));
        assertEquals(Set.of("gmail_message"), registry.registeredTypes());
    }

    @Test
    void register_duplicateTagFails() {
        registry.register("doc", DocPage.class, PRODUCER, true, List.of());

        DuplicateRegistrationException e = assertThrows(DuplicateRegistrationException.class,
                () -> registry.register("doc", DocPage.class, PRODUCER, false, List.of()));
        assertEquals("doc", e.getName());
    }

    @Test
    void register_aliasCollidingWithTagOrAliasFails() {
        registry.register("doc", DocPage.class, PRODUCER, true, List.of("document"));

        assertThrows(DuplicateRegistrationException.class,
                () -> registry.register("note", DocPage.class, PRODUCER, true, List.of("doc")));
        assertThrows(DuplicateRegistrationException.class,
                () -> registry.register("note", DocPage.class, PRODUCER, true, List.of("document")));
        assertThrows(DuplicateRegistrationException.class,
                () -> registry.register("document", DocPage.class, PRODUCER, true, List.of()));
        assertThrows(DuplicateRegistrationException.class,
                () -> registry.register("note", DocPage.class, PRODUCER, true, List.of("n", "n")));
        assertTrue(registry.find("note").isEmpty());
    }

    @Test
    void register_rejectsNamesThatCannotAppearInAddresses() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("a:b", DocPage.class, PRODUCER, true, List.of()));
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", DocPage.class, PRODUCER, true, List.of()));
        assertThrows(IllegalArgumentException.class, () -> registry.register("doc", DocPage.class, PRODUCER, true, List.of("x/y")));
    }

    @Test
    void resolve_unknownTypeFails() {
        UnknownPageTypeException e = assertThrows(UnknownPageTypeException.class, () -> registry.resolve("nope"));
        assertEquals("nope", e.getType());
    }
}
