package com.praga.cache.store;

import com.praga.config.PragaConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Provides JDBC connections to the page cache database.
 */
@FunctionalInterface
public interface JdbcConnectionProvider {

    Connection getConnection() throws SQLException;

    /** PostgreSQL connections from {@link PragaConfig#getJdbcUrl()} and the configured credentials. */
    static JdbcConnectionProvider fromConfig(PragaConfig config) {
        Objects.requireNonNull(config, "config");
        return () -> DriverManager.getConnection(config.getJdbcUrl(), config.getDbUser(), config.getDbPassword());
    }
}
