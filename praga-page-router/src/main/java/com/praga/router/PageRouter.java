package com.praga.router;

import com.praga.cache.CacheRecord;
import com.praga.cache.InMemoryPageCacheStore;
import com.praga.cache.PageCacheStore;
import com.praga.cache.ProvenanceException;
import com.praga.cache.ProvenanceTracker;
import com.praga.cache.validation.PageValidator;
import com.praga.cache.validation.PageValidatorRegistry;
import com.praga.page.Page;
import com.praga.page.PageAddress;
import com.praga.page.PageCodec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Resolves page addresses to pages: cache lookup, validator check, then the registered producer,
 * with the produced page written back to the cache.
 * <p>
 * Every lookup exists in a blocking form ({@link #get}, {@link #getMany}) and an asynchronous form
 * ({@link #getAsync}, {@link #getManyAsync}). Both accept blocking and suspending producers: the
 * blocking path joins a suspending producer; the asynchronous path runs blocking producers and
 * cache I/O on the worker pool.
 * <p>
 * A cached page may record the page it was derived from ({@link #storePage(Page, PageAddress)}).
 * Such a page is served from cache only while every ancestor in its provenance chain also passes
 * its validator; a failing ancestor is marked invalid together with the page.
 * <p>
 * Cache read and write failures are logged and treated as a miss or a skipped write. Producer
 * failures reach the caller: unchecked exceptions unchanged, checked ones wrapped in
 * {@link ProducerFailureException}.
 */
public final class PageRouter implements AutoCloseable {

    static final String METRIC_REQUESTS = "praga.page.requests";
    static final String OUTCOME_CACHE_HIT = "cache_hit";
    static final String OUTCOME_PRODUCED = "produced";
    static final String OUTCOME_FAILED = "failed";

    private static final Logger log = LoggerFactory.getLogger(PageRouter.class);

    private final String root;
    private final PageHandlerRegistry handlers;
    private final PageValidatorRegistry validators;
    private final PageCacheStore store;
    private final ProvenanceTracker provenance;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private PageRouter(Builder b) {
        this.root = b.root;
        this.handlers = b.handlers != null ? b.handlers : new PageHandlerRegistry();
        this.validators = b.validators != null ? b.validators : new PageValidatorRegistry();
        this.store = b.store != null ? b.store : new InMemoryPageCacheStore();
        this.provenance = new ProvenanceTracker(this.store);
        this.ownsExecutor = b.executor == null;
        this.executor = b.executor != null ? b.executor : newWorkerPool(b.workerThreads);
        this.meterRegistry = b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Root used when minting addresses with {@link #newAddress(String, String)}. */
    public String getRoot() {
        return root;
    }

    public PageHandlerRegistry getHandlers() {
        return handlers;
    }

    public PageValidatorRegistry getValidators() {
        return validators;
    }

    public PageCacheStore getStore() {
        return store;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /** Registers a cached handler without aliases. */
    public <P extends Page> PageHandlerEntry<P> registerHandler(String typeTag, Class<P> pageClass, PageProducer<P> producer) {
        return handlers.register(typeTag, pageClass, producer, true, List.of());
    }

    public <P extends Page> PageHandlerEntry<P> registerHandler(String typeTag, Class<P> pageClass, PageProducer<P> producer,
                                                                boolean cacheEnabled, String... aliases) {
        return handlers.register(typeTag, pageClass, producer, cacheEnabled, Arrays.asList(aliases));
    }

    /** Registers a validator under the canonical tag of {@code typeOrAlias}. */
    public void registerValidator(String typeOrAlias, PageValidator validator) {
        validators.register(handlers.canonicalTag(typeOrAlias), validator);
    }

    // --- blocking lookups ---

    public Page get(String address) {
        return get(PageAddress.parse(address), false);
    }

    public Page get(PageAddress address) {
        return get(address, false);
    }

    /**
     * Resolves one address on the calling thread.
     *
     * @param allowStale serve a cached record even if it was invalidated or its validator rejects it
     * @throws UnknownPageTypeException  if no handler serves the address type
     * @throws ProducerFailureException  if the producer threw a checked exception
     * @throws IllegalStateException     if the producer returned a page for another address
     */
    public Page get(PageAddress address, boolean allowStale) {
        Objects.requireNonNull(address, "address");
        PageHandlerEntry<?> entry = resolveCounted(address);
        try {
            CacheLookup cached = CacheLookup.MISS;
            if (entry.cacheEnabled()) {
                cached = readCache(entry, address, allowStale);
                if (cached.hit()) {
                    if (allowStale) {
                        count(entry.typeTag(), OUTCOME_CACHE_HIT);
                        return cached.page();
                    }
                    if (!validators.isValid(entry.typeTag(), cached.page())) {
                        invalidateQuietly(address);
                    } else if (ancestorsValid(cached.record())) {
                        count(entry.typeTag(), OUTCOME_CACHE_HIT);
                        return cached.page();
                    }
                }
            }
            Page page = produceBlocking(entry, address);
            checkAddress(entry, address, page);
            if (entry.cacheEnabled()) {
                writeCache(address, page, cached.parent());
            }
            count(entry.typeTag(), OUTCOME_PRODUCED);
            return page;
        } catch (RuntimeException e) {
            count(entry.typeTag(), OUTCOME_FAILED);
            throw e;
        }
    }

    /** Resolves addresses one after another; the result is in input order. */
    public List<Page> getMany(List<?> addresses) {
        return getMany(addresses, false);
    }

    public List<Page> getMany(List<?> addresses, boolean allowStale) {
        Objects.requireNonNull(addresses, "addresses");
        List<Page> pages = new ArrayList<>(addresses.size());
        for (Object a : addresses) {
            pages.add(get(toAddress(a), allowStale));
        }
        return pages;
    }

    // --- asynchronous lookups ---

    public CompletableFuture<Page> getAsync(String address) {
        try {
            return getAsync(PageAddress.parse(address), false);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public CompletableFuture<Page> getAsync(PageAddress address) {
        return getAsync(address, false);
    }

    /** Same policy as {@link #get(PageAddress, boolean)}; failures complete the future exceptionally. */
    public CompletableFuture<Page> getAsync(PageAddress address, boolean allowStale) {
        Objects.requireNonNull(address, "address");
        PageHandlerEntry<?> entry;
        try {
            entry = resolveCounted(address);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<CacheLookup> cached;
        if (entry.cacheEnabled()) {
            cached = onWorker(() -> readCache(entry, address, allowStale))
                    .thenCompose(lookup -> !lookup.hit() || allowStale
                            ? CompletableFuture.completedFuture(lookup)
                            : validateAsync(entry, address, lookup));
        } else {
            cached = CompletableFuture.completedFuture(CacheLookup.MISS);
        }
        CompletableFuture<Page> result = cached.thenCompose(lookup -> {
            if (lookup.hit()) {
                count(entry.typeTag(), OUTCOME_CACHE_HIT);
                return CompletableFuture.completedFuture(lookup.page());
            }
            return produceAsync(entry, address).thenApplyAsync(page -> {
                checkAddress(entry, address, page);
                if (entry.cacheEnabled()) {
                    writeCache(address, page, lookup.parent());
                }
                count(entry.typeTag(), OUTCOME_PRODUCED);
                return page;
            }, executor);
        });
        return result.whenComplete((page, err) -> {
            if (err != null) {
                count(entry.typeTag(), OUTCOME_FAILED);
            }
        });
    }

    public CompletableFuture<List<Page>> getManyAsync(List<?> addresses) {
        return getManyAsync(addresses, false);
    }

    /**
     * Resolves all addresses concurrently. The result lists pages in input order. The returned future
     * fails with the first failing item's exception as soon as that item fails; items that already
     * completed keep their cache writes.
     */
    public CompletableFuture<List<Page>> getManyAsync(List<?> addresses, boolean allowStale) {
        Objects.requireNonNull(addresses, "addresses");
        List<PageAddress> parsed = new ArrayList<>(addresses.size());
        try {
            for (Object a : addresses) {
                parsed.add(toAddress(a));
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        List<CompletableFuture<Page>> futures = new ArrayList<>(parsed.size());
        for (PageAddress a : parsed) {
            futures.add(getAsync(a, allowStale));
        }
        CompletableFuture<List<Page>> batch = new CompletableFuture<>();
        for (CompletableFuture<Page> f : futures) {
            f.whenComplete((page, err) -> {
                if (err != null) {
                    batch.completeExceptionally(unwrap(err));
                }
            });
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).thenRun(() -> {
            List<Page> pages = new ArrayList<>(futures.size());
            for (CompletableFuture<Page> f : futures) {
                pages.add(f.join());
            }
            batch.complete(pages);
        });
        return batch;
    }

    // --- cache management ---

    /**
     * Next address to use for a new version of {@code type:id} under this router's root: one past the
     * highest cached version, or the default version when nothing is cached or the type is not cached.
     */
    public PageAddress newAddress(String type, String id) {
        PageHandlerEntry<?> entry = handlers.resolve(type);
        PageAddress base = PageAddress.of(root, type, id);
        if (!entry.cacheEnabled()) {
            return base;
        }
        OptionalInt latest = store.latestVersion(base);
        return latest.isPresent() ? base.withVersion(latest.getAsInt() + 1) : base;
    }

    /**
     * Latest cached version of {@code type:id} under this router's root, if that version is valid
     * and passes the validators of the page and its ancestors. Never calls the producer.
     */
    public Optional<Page> latestPage(String typeOrAlias, String id) {
        PageHandlerEntry<?> entry = handlers.resolve(typeOrAlias);
        OptionalInt latest = store.latestVersion(PageAddress.of(root, typeOrAlias, id));
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        PageAddress address = new PageAddress(root, typeOrAlias, id, latest.getAsInt());
        CacheLookup cached = readCache(entry, address, false);
        if (!cached.hit()) {
            return Optional.empty();
        }
        if (!validators.isValid(entry.typeTag(), cached.page())) {
            invalidateQuietly(address);
            return Optional.empty();
        }
        return ancestorsValid(cached.record()) ? Optional.of(cached.page()) : Optional.empty();
    }

    /**
     * Writes a page to the cache without a parent.
     *
     * @return true if no record existed for the page address
     */
    public boolean storePage(Page page) {
        return storePage(page, null);
    }

    /**
     * Writes a page to the cache, linked to the page it was derived from.
     *
     * @param parent cached page this one was derived from, or {@code null}
     * @return true if no record existed for the page address
     * @throws ProvenanceException      if {@code parent} cannot be linked (see {@link ProvenanceTracker})
     * @throws UnknownPageTypeException if no handler serves the page type
     */
    public boolean storePage(Page page, PageAddress parent) {
        Objects.requireNonNull(page, "page");
        PageAddress address = Objects.requireNonNull(page.getAddress(), "page address");
        PageHandlerEntry<?> entry = handlers.resolve(address.type());
        if (!entry.pageClass().isInstance(page)) {
            throw new IllegalArgumentException("Page " + address + " is a " + page.getClass().getName()
                    + " but page type " + entry.typeTag() + " holds " + entry.pageClass().getName());
        }
        if (parent != null) {
            provenance.validate(address, parent);
        }
        boolean created = store.find(address).isEmpty();
        store.put(CacheRecord.of(address, PageCodec.toJson(page), clock.instant(), parent));
        log.debug("Stored {} (parent={}, created={})", address, parent, created);
        return created;
    }

    /** Valid cached pages whose parent is {@code parent}, ordered by address. */
    public List<Page> children(PageAddress parent) {
        Objects.requireNonNull(parent, "parent");
        List<Page> pages = new ArrayList<>();
        for (CacheRecord record : store.children(parent)) {
            if (record.valid()) {
                pages.add(decode(record));
            }
        }
        return pages;
    }

    /**
     * Cached pages from the oldest ancestor down to {@code address}; empty if the address is not
     * cached.
     */
    public List<Page> provenanceChain(PageAddress address) {
        Objects.requireNonNull(address, "address");
        List<Page> pages = new ArrayList<>();
        for (CacheRecord record : store.provenanceChain(address)) {
            pages.add(decode(record));
        }
        return pages;
    }

    /**
     * Valid cached pages of one type under this router's root that match {@code filter}.
     *
     * @throws IllegalArgumentException if the type's pages are not instances of {@code pageClass}
     */
    public <P extends Page> List<P> findPages(Class<P> pageClass, String typeOrAlias, Predicate<? super P> filter) {
        Objects.requireNonNull(pageClass, "pageClass");
        Objects.requireNonNull(filter, "filter");
        PageHandlerEntry<?> entry = handlers.resolve(typeOrAlias);
        if (!pageClass.isAssignableFrom(entry.pageClass())) {
            throw new IllegalArgumentException("Page type " + entry.typeTag() + " holds " + entry.pageClass().getName()
                    + ", not " + pageClass.getName());
        }
        List<P> matches = new ArrayList<>();
        for (CacheRecord record : store.findByType(root, typeOrAlias)) {
            if (!record.valid()) {
                continue;
            }
            P page = pageClass.cast(PageCodec.fromJson(record.payload(), entry.pageClass()));
            if (filter.test(page)) {
                matches.add(page);
            }
        }
        return matches;
    }

    /** Marks the cached record for this address invalid; returns true if one existed. */
    public boolean invalidate(PageAddress address) {
        boolean marked = store.markInvalid(address);
        log.debug("Invalidated {} (found={})", address, marked);
        return marked;
    }

    /** Marks every cached version of the page invalid; returns the number of records marked. */
    public int invalidateAllVersions(PageAddress address) {
        int marked = store.markInvalidAllVersions(address);
        log.debug("Invalidated {} cached version(s) of {}", marked, address.prefix());
        return marked;
    }

    /** Shuts down the worker pool if this router created it. */
    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
        }
    }

    // --- internals ---

    private PageHandlerEntry<?> resolveCounted(PageAddress address) {
        try {
            return handlers.resolve(address.type());
        } catch (UnknownPageTypeException e) {
            count(address.type(), OUTCOME_FAILED);
            throw e;
        }
    }

    private CacheLookup readCache(PageHandlerEntry<?> entry, PageAddress address, boolean allowStale) {
        try {
            Optional<CacheRecord> record = store.find(address);
            if (record.isEmpty()) {
                log.debug("Cache miss {}", address);
                return CacheLookup.MISS;
            }
            if (!record.get().valid() && !allowStale) {
                log.debug("Cached record for {} is invalid", address);
                return new CacheLookup(record.get(), null);
            }
            Page page = PageCodec.fromJson(record.get().payload(), entry.pageClass());
            log.debug("Cache hit {}", address);
            return new CacheLookup(record.get(), page);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for {}; producing a fresh page: {}", address, e.getMessage());
            return CacheLookup.MISS;
        }
    }

    private CompletableFuture<CacheLookup> validateAsync(PageHandlerEntry<?> entry, PageAddress address, CacheLookup lookup) {
        return validators.isValidAsync(entry.typeTag(), lookup.page()).thenCompose(valid -> {
            if (!valid) {
                return onWorker(() -> {
                    invalidateQuietly(address);
                    return lookup.stale();
                });
            }
            return ancestorsValidAsync(lookup.record())
                    .thenApply(ancestorsValid -> ancestorsValid ? lookup : lookup.stale());
        });
    }

    /** Blocking check of every ancestor of {@code record}; a failure invalidates it and the record. */
    private boolean ancestorsValid(CacheRecord record) {
        if (!record.hasParent()) {
            return true;
        }
        try {
            for (Ancestor ancestor : ancestorsToValidate(record)) {
                if (!validators.isValid(ancestor.typeTag(), ancestor.page())) {
                    invalidateLineage(ancestor, record);
                    return false;
                }
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("Could not validate ancestors of {}; treating it as invalid: {}", record.address(), e.getMessage());
            return false;
        }
    }

    private CompletableFuture<Boolean> ancestorsValidAsync(CacheRecord record) {
        if (!record.hasParent()) {
            return CompletableFuture.completedFuture(true);
        }
        return onWorker(() -> ancestorsToValidate(record)).thenCompose(ancestors -> {
            CompletableFuture<Boolean> chain = CompletableFuture.completedFuture(true);
            for (Ancestor ancestor : ancestors) {
                chain = chain.thenCompose(ok -> !ok
                        ? CompletableFuture.completedFuture(false)
                        : validators.isValidAsync(ancestor.typeTag(), ancestor.page()).thenApplyAsync(valid -> {
                            if (!valid) {
                                invalidateLineage(ancestor, record);
                            }
                            return valid;
                        }, executor));
            }
            return chain;
        }).exceptionally(e -> {
            log.warn("Could not validate ancestors of {}; treating it as invalid: {}", record.address(), unwrap(e).getMessage());
            return false;
        });
    }

    /** Ancestors of {@code record}, oldest first, that have both a handler and a validator. */
    private List<Ancestor> ancestorsToValidate(CacheRecord record) {
        List<Ancestor> ancestors = new ArrayList<>();
        for (CacheRecord r : store.provenanceChain(record.address())) {
            if (r.address().equals(record.address())) {
                continue;
            }
            Optional<PageHandlerEntry<?>> entry = handlers.find(r.address().type());
            if (entry.isEmpty() || !validators.hasValidator(entry.get().typeTag())) {
                continue;
            }
            Page page = PageCodec.fromJson(r.payload(), entry.get().pageClass());
            ancestors.add(new Ancestor(entry.get().typeTag(), page));
        }
        return ancestors;
    }

    private void invalidateLineage(Ancestor ancestor, CacheRecord record) {
        log.debug("Ancestor {} of {} rejected by validator", ancestor.page().getAddress(), record.address());
        invalidateQuietly(ancestor.page().getAddress());
        invalidateQuietly(record.address());
    }

    private Page decode(CacheRecord record) {
        PageHandlerEntry<?> entry = handlers.resolve(record.address().type());
        return PageCodec.fromJson(record.payload(), entry.pageClass());
    }

    private void writeCache(PageAddress address, Page page, PageAddress parent) {
        try {
            store.put(CacheRecord.of(address, PageCodec.toJson(page), clock.instant(), parent));
        } catch (RuntimeException e) {
            log.warn("Cache write failed for {}: {}", address, e.getMessage());
        }
    }

    private void invalidateQuietly(PageAddress address) {
        try {
            store.markInvalid(address);
            log.debug("Cached page {} rejected by validator; marked invalid", address);
        } catch (RuntimeException e) {
            log.warn("Failed to mark {} invalid: {}", address, e.getMessage());
        }
    }

    private static Page produceBlocking(PageHandlerEntry<?> entry, PageAddress address) {
        PageProducer<?> producer = entry.producer();
        if (producer instanceof PageProducer.Blocking<?> blocking) {
            return callBlocking(entry, blocking, address);
        }
        PageProducer.Suspending<?> suspending = (PageProducer.Suspending<?>) producer;
        CompletionStage<? extends Page> stage = suspending.producer().produce(address);
        if (stage == null) {
            throw new IllegalStateException("Producer for page type " + entry.typeTag() + " returned no future for " + address);
        }
        try {
            return stage.toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProducerFailureException(entry.typeTag(), address, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ProducerFailureException(entry.typeTag(), address, cause);
        }
    }

    private CompletableFuture<Page> produceAsync(PageHandlerEntry<?> entry, PageAddress address) {
        PageProducer<?> producer = entry.producer();
        if (producer instanceof PageProducer.Blocking<?> blocking) {
            return onWorker(() -> callBlocking(entry, blocking, address));
        }
        PageProducer.Suspending<?> suspending = (PageProducer.Suspending<?>) producer;
        try {
            CompletionStage<? extends Page> stage = suspending.producer().produce(address);
            if (stage == null) {
                throw new IllegalStateException("Producer for page type " + entry.typeTag() + " returned no future for " + address);
            }
            return stage.toCompletableFuture().thenApply(page -> (Page) page);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** Runs {@code task} on the worker pool; a rejected submission fails the returned future. */
    private <T> CompletableFuture<T> onWorker(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Page callBlocking(PageHandlerEntry<?> entry, PageProducer.Blocking<?> blocking, PageAddress address) {
        try {
            return blocking.producer().produce(address);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ProducerFailureException(entry.typeTag(), address, e);
        }
    }

    private static void checkAddress(PageHandlerEntry<?> entry, PageAddress requested, Page page) {
        if (page == null) {
            throw new IllegalStateException("Producer for page type " + entry.typeTag() + " returned no page for " + requested);
        }
        if (!requested.equals(page.getAddress())) {
            throw new IllegalStateException("Producer for page type " + entry.typeTag() + " returned page "
                    + page.getAddress() + " for requested address " + requested);
        }
    }

    private void count(String type, String outcome) {
        meterRegistry.counter(METRIC_REQUESTS, "type", type, "outcome", outcome).increment();
    }

    static PageAddress toAddress(Object value) {
        if (value instanceof PageAddress address) {
            return address;
        }
        if (value instanceof CharSequence s) {
            return PageAddress.parse(s.toString());
        }
        throw new IllegalArgumentException("Expected a PageAddress or address string but got: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    private static Throwable unwrap(Throwable err) {
        return err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "praga-router-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Result of a cache read: the stored record (if any) and its decoded page when usable. */
    private record CacheLookup(CacheRecord record, Page page) {

        static final CacheLookup MISS = new CacheLookup(null, null);

        boolean hit() {
            return page != null;
        }

        /** Same record, no usable page. */
        CacheLookup stale() {
            return new CacheLookup(record, null);
        }

        PageAddress parent() {
            return record == null ? null : record.parent();
        }
    }

    private record Ancestor(String typeTag, Page page) {
    }

    public static final class Builder {
        private String root = "praga";
        private PageHandlerRegistry handlers;
        private PageValidatorRegistry validators;
        private PageCacheStore store;
        private ExecutorService executor;
        private int workerThreads = 8;
        private MeterRegistry meterRegistry;
        private Clock clock;

        public Builder root(String root) {
            this.root = Objects.requireNonNull(root, "root");
            return this;
        }

        public Builder handlers(PageHandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        public Builder validators(PageValidatorRegistry validators) {
            this.validators = validators;
            return this;
        }

        public Builder store(PageCacheStore store) {
            this.store = store;
            return this;
        }

        /** Worker pool supplied by the caller; the router does not shut it down. */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /** Size of the worker pool the router creates when no executor is supplied. */
        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be > 0: " + workerThreads);
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PageRouter build() {
            return new PageRouter(this);
        }
    }
}
