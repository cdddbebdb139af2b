package com.praga.config;

import java.util.Objects;

/**
 * Configuration loaded from environment variables for the page server.
 * <p>
 * Root: PRAGA_ROOT. Store: PRAGA_CACHE_STORE (memory, jdbc, redis).
 * DB: PRAGA_DB_HOST, PRAGA_DB_PORT, PRAGA_DB_NAME, PRAGA_DB_USER, PRAGA_DB_PASSWORD.
 * Cache: PRAGA_CACHE_HOST, PRAGA_CACHE_PORT, PRAGA_CACHE_KEY_PREFIX. Workers: PRAGA_WORKER_THREADS.
 */
public final class PragaConfig {

    private static final String ENV_ROOT = "PRAGA_ROOT";
    private static final String ENV_CACHE_STORE = "PRAGA_CACHE_STORE";
    private static final String ENV_DB_HOST = "PRAGA_DB_HOST";
    private static final String ENV_DB_PORT = "PRAGA_DB_PORT";
    private static final String ENV_DB_NAME = "PRAGA_DB_NAME";
    private static final String ENV_DB_USER = "PRAGA_DB_USER";
    private static final String ENV_DB_PASSWORD = "PRAGA_DB_PASSWORD";
    private static final String ENV_CACHE_HOST = "PRAGA_CACHE_HOST";
    private static final String ENV_CACHE_PORT = "PRAGA_CACHE_PORT";
    private static final String ENV_CACHE_KEY_PREFIX = "PRAGA_CACHE_KEY_PREFIX";
    private static final String ENV_WORKER_THREADS = "PRAGA_WORKER_THREADS";

    private static final String DEFAULT_ROOT = "praga";
    private static final String DEFAULT_DB_NAME = "praga";
    private static final String DEFAULT_DB_USER = "praga";
    private static final String DEFAULT_CACHE_KEY_PREFIX = "praga:pages";
    private static final int DEFAULT_DB_PORT = 5432;
    private static final int DEFAULT_CACHE_PORT = 6379;
    private static final int DEFAULT_WORKER_THREADS = 8;

    private final String root;
    private final CacheStoreType cacheStoreType;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final String cacheHost;
    private final int cachePort;
    private final String cacheKeyPrefix;
    private final int workerThreads;

    private PragaConfig(Builder b) {
        this.root = b.root;
        this.cacheStoreType = b.cacheStoreType;
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName != null ? b.dbName : DEFAULT_DB_NAME;
        this.dbUser = b.dbUser != null ? b.dbUser : DEFAULT_DB_USER;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.cacheKeyPrefix = b.cacheKeyPrefix;
        this.workerThreads = b.workerThreads;
    }

    /** Root namespace of every address this server mints (PRAGA_ROOT). Default {@code praga}. */
    public String getRoot() {
        return root;
    }

    /** Page cache backend (PRAGA_CACHE_STORE). Default {@link CacheStoreType#MEMORY}. */
    public CacheStoreType getCacheStoreType() {
        return cacheStoreType;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    /** JDBC URL built from host, port and database name. */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + dbHost + ":" + dbPort + "/" + dbName;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /** Redis key prefix for cached pages. Default {@code praga:pages}. */
    public String getCacheKeyPrefix() {
        return cacheKeyPrefix;
    }

    /** Size of the worker pool used for blocking producers and cache I/O. Default 8. */
    public int getWorkerThreads() {
        return workerThreads;
    }

    public static PragaConfig fromEnvironment() {
        return builder()
                .root(getEnv(ENV_ROOT, DEFAULT_ROOT))
                .cacheStoreType(CacheStoreType.parse(System.getenv(ENV_CACHE_STORE), CacheStoreType.MEMORY))
                .dbHost(getEnv(ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(System.getenv(ENV_DB_PORT), DEFAULT_DB_PORT))
                .dbName(getEnv(ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(getEnv(ENV_DB_USER, DEFAULT_DB_USER))
                .dbPassword(getEnv(ENV_DB_PASSWORD, ""))
                .cacheHost(getEnv(ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(System.getenv(ENV_CACHE_PORT), DEFAULT_CACHE_PORT))
                .cacheKeyPrefix(getEnv(ENV_CACHE_KEY_PREFIX, DEFAULT_CACHE_KEY_PREFIX))
                .workerThreads(parseInt(System.getenv(ENV_WORKER_THREADS), DEFAULT_WORKER_THREADS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String root = DEFAULT_ROOT;
        private CacheStoreType cacheStoreType = CacheStoreType.MEMORY;
        private String dbHost = "localhost";
        private int dbPort = DEFAULT_DB_PORT;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private String cacheHost = "localhost";
        private int cachePort = DEFAULT_CACHE_PORT;
        private String cacheKeyPrefix = DEFAULT_CACHE_KEY_PREFIX;
        private int workerThreads = DEFAULT_WORKER_THREADS;

        public Builder root(String root) {
            this.root = Objects.requireNonNull(root, "root");
            return this;
        }

        public Builder cacheStoreType(CacheStoreType cacheStoreType) {
            this.cacheStoreType = Objects.requireNonNull(cacheStoreType, "cacheStoreType");
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder cacheKeyPrefix(String cacheKeyPrefix) {
            this.cacheKeyPrefix = cacheKeyPrefix != null ? cacheKeyPrefix : DEFAULT_CACHE_KEY_PREFIX;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads > 0 ? workerThreads : DEFAULT_WORKER_THREADS;
            return this;
        }

        public PragaConfig build() {
            return new PragaConfig(this);
        }
    }
}
