package com.praga.cache.validation;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PageValidatorRegistryTest {

    private final PageValidatorRegistry registry = new PageValidatorRegistry();
    private final TextPage fresh = new TextPage("root/doc:1", "fresh");
    private final TextPage stale = new TextPage("root/doc:2", "stale");

    @Test
    void isValid_typeWithoutValidatorIsValid() {
        assertFalse(registry.hasValidator("doc"));
        assertTrue(registry.isValid(fresh));
        assertTrue(registry.isValidAsync(fresh).join());
    }

    @Test
    void isValid_blockingValidatorDecides() {
        registry.register("doc", PageValidator.blocking(TextPage.class, p -> "fresh".equals(p.getText())));

        assertTrue(registry.hasValidator("doc"));
        assertTrue(registry.isValid(fresh));
        assertFalse(registry.isValid(stale));
        assertFalse(registry.isValidAsync(stale).join());
    }

    @Test
    void isValid_throwingValidatorMeansInvalid() {
        registry.register("doc", PageValidator.blocking(p -> {
            throw new IllegalStateException("backend down");
        }));

        assertFalse(registry.isValid(fresh));
        assertFalse(registry.isValidAsync(fresh).join());
    }

    @Test
    void isValid_asyncValidatorOnBlockingPathIsInvalidAndNotInvoked() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("doc", PageValidator.async(p -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(true);
        }));

        assertFalse(registry.isValid(fresh));
        assertEquals(0, calls.get());
        assertTrue(registry.isValidAsync(fresh).join());
        assertEquals(1, calls.get());
    }

    @Test
    void isValidAsync_failedFutureMeansInvalid() {
        registry.register("doc", PageValidator.async(p -> CompletableFuture.failedFuture(new RuntimeException("boom"))));

        assertFalse(registry.isValidAsync(fresh).join());
    }

    @Test
    void register_replacesPreviousValidator() {
        registry.register("doc", PageValidator.blocking(p -> false));
        registry.register("doc", PageValidator.blocking(p -> true));

        assertTrue(registry.isValid(fresh));
    }

    @Test
    void isValid_explicitTypeOverridesAddressType() {
        registry.register("document", PageValidator.blocking(p -> false));

        assertTrue(registry.isValid(fresh));
        assertFalse(registry.isValid("document", fresh));
    }

    @Test
    void clear_removesAll() {
        registry.register("doc", PageValidator.blocking(p -> false));
        registry.clear();

        assertTrue(registry.isValid(fresh));
    }
}
