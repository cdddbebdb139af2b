package com.praga.cache.validation;

import com.praga.page.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-type freshness checks for cached pages. A type without a validator is always valid.
 * A validator that throws (or whose future fails) makes the page invalid; failures never reach
 * the caller. Registering a second validator for a type replaces the first.
 */
public final class PageValidatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(PageValidatorRegistry.class);

    private final Map<String, PageValidator> validators = new ConcurrentHashMap<>();

    public void register(String type, PageValidator validator) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(validator, "validator");
        if (validators.put(type, validator) != null) {
            log.debug("Replaced page validator for type {}", type);
        } else {
            log.debug("Registered page validator for type {}", type);
        }
    }

    public boolean hasValidator(String type) {
        return type != null && validators.containsKey(type);
    }

    /** Blocking check keyed by the page's own address type. */
    public boolean isValid(Page page) {
        return isValid(page.getAddress().type(), page);
    }

    /**
     * Blocking check using the validator registered for {@code type}. A {@link PageValidator.Suspending}
     * validator is not invoked here: the page is reported invalid and a warning is logged.
     */
    public boolean isValid(String type, Page page) {
        PageValidator validator = validators.get(type);
        if (validator == null) {
            return true;
        }
        if (validator instanceof PageValidator.Blocking blocking) {
            return runBlocking(type, blocking, page);
        }
        log.warn("Validator for type {} is asynchronous; blocking validation reports {} as invalid", type, page.getAddress());
        return false;
    }

    public CompletableFuture<Boolean> isValidAsync(Page page) {
        return isValidAsync(page.getAddress().type(), page);
    }

    /** Asynchronous check; the returned future never completes exceptionally. */
    public CompletableFuture<Boolean> isValidAsync(String type, Page page) {
        PageValidator validator = validators.get(type);
        if (validator == null) {
            return CompletableFuture.completedFuture(true);
        }
        if (validator instanceof PageValidator.Blocking blocking) {
            return CompletableFuture.completedFuture(runBlocking(type, blocking, page));
        }
        PageValidator.Suspending suspending = (PageValidator.Suspending) validator;
        CompletionStage<Boolean> stage;
        try {
            stage = suspending.check().test(page);
        } catch (RuntimeException e) {
            log.warn("Validator for type {} failed on {}: {}", type, page.getAddress(), e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(false);
        }
        return stage.toCompletableFuture().handle((ok, err) -> {
            if (err != null) {
                log.warn("Validator for type {} failed on {}: {}", type, page.getAddress(), err.getMessage());
                return false;
            }
            return Boolean.TRUE.equals(ok);
        });
    }

    /** Removes all validators (mainly for tests). */
    public void clear() {
        validators.clear();
    }

    private static boolean runBlocking(String type, PageValidator.Blocking validator, Page page) {
        try {
            return validator.check().test(page);
        } catch (Exception e) {
            log.warn("Validator for type {} failed on {}: {}", type, page.getAddress(), e.getMessage());
            return false;
        }
    }
}
