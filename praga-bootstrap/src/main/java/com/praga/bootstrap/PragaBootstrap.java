package com.praga.bootstrap;

import com.praga.cache.InMemoryPageCacheStore;
import com.praga.cache.PageCacheException;
import com.praga.cache.PageCacheStore;
import com.praga.cache.store.JdbcConnectionProvider;
import com.praga.cache.store.JdbcPageCacheStore;
import com.praga.cache.store.RedisPageCacheStore;
import com.praga.config.PragaConfig;
import com.praga.router.PageRouter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the {@link ServerContext} from configuration and installs it as the {@link GlobalContext}.
 */
public final class PragaBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PragaBootstrap.class);

    private PragaBootstrap() {
    }

    /** Loads {@link PragaConfig} from the environment and initializes from it. */
    public static ServerContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(PragaConfig.fromEnvironment());
    }

    /**
     * Creates the cache store and router for {@code config} and registers the context globally.
     *
     * @throws IllegalStateException if a global context already exists
     */
    public static ServerContext initialize(PragaConfig config) {
        return initialize(config, null);
    }

    /**
     * As {@link #initialize(PragaConfig)}, recording router metrics in {@code meterRegistry}
     * ({@code null} gives the router its own simple registry).
     */
    public static ServerContext initialize(PragaConfig config, MeterRegistry meterRegistry) {
        Objects.requireNonNull(config, "config");
        if (GlobalContext.isInitialized()) {
            throw new IllegalStateException("Server context already initialized; clear it before creating another");
        }
        log.info("Bootstrap: root={}, cacheStore={}, workerThreads={}",
                config.getRoot(), config.getCacheStoreType(), config.getWorkerThreads());
        PageCacheStore store = createStore(config);
        PageRouter router = PageRouter.builder()
                .root(config.getRoot())
                .store(store)
                .workerThreads(config.getWorkerThreads())
                .meterRegistry(meterRegistry)
                .build();
        ServerContext context = new ServerContext(config, router);
        try {
            GlobalContext.set(context);
        } catch (IllegalStateException e) {
            context.close();
            throw e;
        }
        log.info("Bootstrap: server context ready for root {}", config.getRoot());
        return context;
    }

    static PageCacheStore createStore(PragaConfig config) {
        switch (config.getCacheStoreType()) {
            case JDBC:
                JdbcPageCacheStore jdbc = new JdbcPageCacheStore(JdbcConnectionProvider.fromConfig(config));
                try {
                    jdbc.ensureSchema();
                    log.info("Bootstrap: page cache in PostgreSQL at {}", config.getJdbcUrl());
                    return jdbc;
                } catch (PageCacheException e) {
                    log.warn("Bootstrap: page cache schema could not be initialized at {}; using in-memory cache: {}",
                            config.getJdbcUrl(), e.getMessage());
                    return new InMemoryPageCacheStore();
                }
            case REDIS:
                log.info("Bootstrap: page cache in Redis at {}:{} (prefix {})",
                        config.getCacheHost(), config.getCachePort(), config.getCacheKeyPrefix());
                return new RedisPageCacheStore(config.getCacheHost(), config.getCachePort(), config.getCacheKeyPrefix());
            case MEMORY:
            default:
                log.info("Bootstrap: page cache in memory");
                return new InMemoryPageCacheStore();
        }
    }
}
