package com.praga.cache.validation;

import com.praga.page.Page;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Freshness check for cached pages of one type. Either {@link Blocking} (answers on the calling
 * thread) or {@link Suspending} (answers through a {@link CompletionStage}); the registry dispatches
 * on the variant.
 */
public sealed interface PageValidator permits PageValidator.Blocking, PageValidator.Suspending {

    /** Validator that answers on the calling thread. */
    record Blocking(Check check) implements PageValidator {
        public Blocking {
            Objects.requireNonNull(check, "check");
        }
    }

    /** Validator that answers asynchronously. Cannot be used from a blocking lookup. */
    record Suspending(AsyncCheck check) implements PageValidator {
        public Suspending {
            Objects.requireNonNull(check, "check");
        }
    }

    @FunctionalInterface
    interface Check {
        boolean test(Page page) throws Exception;
    }

    @FunctionalInterface
    interface AsyncCheck {
        CompletionStage<Boolean> test(Page page);
    }

    @FunctionalInterface
    interface TypedCheck<P extends Page> {
        boolean test(P page) throws Exception;
    }

    static PageValidator blocking(Check check) {
        return new Blocking(check);
    }

    /** Blocking validator for pages of a known class. */
    static <P extends Page> PageValidator blocking(Class<P> pageClass, TypedCheck<P> check) {
        Objects.requireNonNull(pageClass, "pageClass");
        Objects.requireNonNull(check, "check");
        return new Blocking(page -> check.test(pageClass.cast(page)));
    }

    static PageValidator async(AsyncCheck check) {
        return new Suspending(check);
    }
}
