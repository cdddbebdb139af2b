package com.praga.bootstrap;

import com.praga.cache.PageCacheStore;
import com.praga.cache.validation.PageValidatorRegistry;
import com.praga.config.PragaConfig;
import com.praga.page.DuplicateRegistrationException;
import com.praga.router.PageRouter;
import com.praga.tools.RetrieverToolkit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wired server state: configuration, the page router with its cache store and validators, and the
 * named toolkits. Closing the context shuts down the router's worker pool and closes the store.
 */
public final class ServerContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServerContext.class);

    private final PragaConfig config;
    private final PageRouter router;
    private final Map<String, RetrieverToolkit> toolkits = new ConcurrentHashMap<>();

    public ServerContext(PragaConfig config, PageRouter router) {
        this.config = Objects.requireNonNull(config, "config");
        this.router = Objects.requireNonNull(router, "router");
    }

    public PragaConfig getConfig() {
        return config;
    }

    public String getRoot() {
        return router.getRoot();
    }

    public PageRouter getRouter() {
        return router;
    }

    public PageValidatorRegistry getValidators() {
        return router.getValidators();
    }

    public PageCacheStore getStore() {
        return router.getStore();
    }

    /**
     * @throws DuplicateRegistrationException if a toolkit with the same name is already registered
     */
    public <T extends RetrieverToolkit> T registerToolkit(T toolkit) {
        Objects.requireNonNull(toolkit, "toolkit");
        if (toolkits.putIfAbsent(toolkit.getName(), toolkit) != null) {
            throw new DuplicateRegistrationException("Toolkit", toolkit.getName());
        }
        log.info("Registered toolkit {} with {} tool(s)", toolkit.getName(), toolkit.getTools().size());
        return toolkit;
    }

    public Optional<RetrieverToolkit> findToolkit(String name) {
        return name != null ? Optional.ofNullable(toolkits.get(name)) : Optional.empty();
    }

    /** Toolkits sorted by name. */
    public List<RetrieverToolkit> getToolkits() {
        List<RetrieverToolkit> list = new ArrayList<>(toolkits.values());
        list.sort(Comparator.comparing(RetrieverToolkit::getName));
        return list;
    }

    @Override
    public void close() {
        router.close();
        try {
            router.getStore().close();
        } catch (Exception e) {
            log.warn("Failed to close page cache store: {}", e.getMessage(), e);
        }
        log.info("Server context for root {} closed", getRoot());
    }
}
