package com.praga.router;

import com.praga.page.Page;
import com.praga.page.PageAddress;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Produces the page for an address. Either {@link Blocking} (returns the page on the calling
 * thread) or {@link Suspending} (returns a {@link CompletionStage}); the router dispatches on the
 * variant and can call either from its blocking and its asynchronous entry points.
 *
 * @param <P> page class produced
 */
public sealed interface PageProducer<P extends Page> permits PageProducer.Blocking, PageProducer.Suspending {

    record Blocking<P extends Page>(Producer<P> producer) implements PageProducer<P> {
        public Blocking {
            Objects.requireNonNull(producer, "producer");
        }
    }

    record Suspending<P extends Page>(AsyncProducer<P> producer) implements PageProducer<P> {
        public Suspending {
            Objects.requireNonNull(producer, "producer");
        }
    }

    @FunctionalInterface
    interface Producer<P extends Page> {
        P produce(PageAddress address) throws Exception;
    }

    @FunctionalInterface
    interface AsyncProducer<P extends Page> {
        CompletionStage<P> produce(PageAddress address);
    }

    static <P extends Page> PageProducer<P> blocking(Producer<P> producer) {
        return new Blocking<>(producer);
    }

    static <P extends Page> PageProducer<P> async(AsyncProducer<P> producer) {
        return new Suspending<>(producer);
    }
}
