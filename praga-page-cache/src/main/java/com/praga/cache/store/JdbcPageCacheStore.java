package com.praga.cache.store;

import com.praga.cache.CacheRecord;
import com.praga.cache.PageCacheException;
import com.praga.cache.PageCacheStore;
import com.praga.page.PageAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * JDBC implementation of {@link PageCacheStore}. Persists to table {@code praga_page_cache}
 * (PostgreSQL). Schema (CREATE TABLE IF NOT EXISTS) is executed once at bootstrap via
 * {@link #ensureSchema()}.
 */
public final class JdbcPageCacheStore implements PageCacheStore {

    private static final String SCHEMA_RESOURCE = "schema/praga-page-cache.sql";
    private static final Logger log = LoggerFactory.getLogger(JdbcPageCacheStore.class);

    private static final String SELECT = "SELECT payload, created_at, valid, parent_uri FROM praga_page_cache"
            + " WHERE root = ? AND page_type = ? AND page_id = ? AND version = ?";
    private static final String UPSERT = "INSERT INTO praga_page_cache (root, page_type, page_id, version, payload, created_at, valid, parent_uri)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)"
            + " ON CONFLICT (root, page_type, page_id, version)"
            + " DO UPDATE SET payload = EXCLUDED.payload, created_at = EXCLUDED.created_at, valid = EXCLUDED.valid,"
            + " parent_uri = EXCLUDED.parent_uri";
    private static final String ROW_COLUMNS = "SELECT root, page_type, page_id, version, payload, created_at, valid, parent_uri"
            + " FROM praga_page_cache";
    private static final String SELECT_CHILDREN = ROW_COLUMNS
            + " WHERE parent_uri = ? ORDER BY root, page_type, page_id, version";
    private static final String SELECT_BY_TYPE = ROW_COLUMNS
            + " WHERE root = ? AND page_type = ? ORDER BY page_id, version";
    private static final String INVALIDATE = "UPDATE praga_page_cache SET valid = FALSE"
            + " WHERE root = ? AND page_type = ? AND page_id = ? AND version = ?";
    private static final String INVALIDATE_ALL_VERSIONS = "UPDATE praga_page_cache SET valid = FALSE"
            + " WHERE root = ? AND page_type = ? AND page_id = ?";
    private static final String LATEST_VERSION = "SELECT MAX(version) FROM praga_page_cache"
            + " WHERE root = ? AND page_type = ? AND page_id = ?";
    private static final String DELETE = "DELETE FROM praga_page_cache"
            + " WHERE root = ? AND page_type = ? AND page_id = ? AND version = ?";

    private final JdbcConnectionProvider connectionProvider;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public JdbcPageCacheStore(JdbcConnectionProvider connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    }

    /**
     * Creates the cache table and index if they do not exist. Idempotent; safe to call at bootstrap.
     * Loads and executes schema/praga-page-cache.sql from classpath.
     */
    public void ensureSchema() {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Page cache schema already initialized; skipping");
            return;
        }
        String sql;
        try {
            sql = loadSchemaScript();
        } catch (PageCacheException e) {
            schemaInitialized.set(false);
            log.error("Page cache schema could not be loaded: {}", e.getMessage(), e);
            throw e;
        }
        try (Connection c = connectionProvider.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String raw : sql.split(";")) {
                String stmt = raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
                if (stmt.isEmpty()) continue;
                index++;
                st.execute(stmt);
            }
            log.info("Page cache schema: {} statement(s) executed; table praga_page_cache is ready", index);
        } catch (SQLException e) {
            schemaInitialized.set(false);
            log.error("Page cache schema execution failed: error={} SQLState={}", e.getMessage(), e.getSQLState(), e);
            throw new PageCacheException("Page cache schema execution failed: " + e.getMessage(), e);
        }
    }

    static String loadSchemaScript() {
        return loadSchemaScript(SCHEMA_RESOURCE);
    }

    static String loadSchemaScript(String resource) {
        try (var in = JdbcPageCacheStore.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new PageCacheException("Page cache schema resource not found: " + resource);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new PageCacheException("Page cache schema load failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<CacheRecord> find(PageAddress address) {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(SELECT)) {
            bindAddress(ps, address);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CacheRecord(address, rs.getString(1), rs.getTimestamp(2).toInstant(), rs.getBoolean(3),
                        parseParent(rs.getString(4))));
            }
        } catch (SQLException e) {
            throw failure("find", address, e);
        }
    }

    @Override
    public void put(CacheRecord record) {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(UPSERT)) {
            bindAddress(ps, record.address());
            ps.setString(5, record.payload());
            ps.setTimestamp(6, Timestamp.from(record.createdAt()));
            ps.setBoolean(7, record.valid());
            ps.setString(8, record.hasParent() ? record.parent().toString() : null);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("put", record.address(), e);
        }
    }

    @Override
    public boolean markInvalid(PageAddress address) {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(INVALIDATE)) {
            bindAddress(ps, address);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("markInvalid", address, e);
        }
    }

    @Override
    public int markInvalidAllVersions(PageAddress address) {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(INVALIDATE_ALL_VERSIONS)) {
            bindPage(ps, address);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("markInvalidAllVersions", address, e);
        }
    }

    @Override
    public OptionalInt latestVersion(PageAddress address) {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(LATEST_VERSION)) {
            bindPage(ps, address);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    int max = rs.getInt(1);
                    if (!rs.wasNull()) {
                        return OptionalInt.of(max);
                    }
                }
                return OptionalInt.empty();
            }
        } catch (SQLException e) {
            throw failure("latestVersion", address, e);
        }
    }

    @Override
    public boolean remove(PageAddress address) {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(DELETE)) {
            bindAddress(ps, address);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("remove", address, e);
        }
    }

    @Override
    public List<CacheRecord> children(PageAddress parent) {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(SELECT_CHILDREN)) {
            ps.setString(1, parent.toString());
            return readRows(ps);
        } catch (SQLException e) {
            throw failure("children", parent, e);
        }
    }

    @Override
    public List<CacheRecord> findByType(String root, String type) {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(SELECT_BY_TYPE)) {
            ps.setString(1, root);
            ps.setString(2, type);
            return readRows(ps);
        } catch (SQLException e) {
            log.error("Page cache findByType failed for {}/{}: {} SQLState={}", root, type, e.getMessage(), e.getSQLState(), e);
            throw new PageCacheException("Page cache findByType failed for " + root + "/" + type + ": " + e.getMessage(), e);
        }
    }

    private static List<CacheRecord> readRows(PreparedStatement ps) throws SQLException {
        List<CacheRecord> rows = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                PageAddress address = new PageAddress(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4));
                rows.add(new CacheRecord(address, rs.getString(5), rs.getTimestamp(6).toInstant(), rs.getBoolean(7),
                        parseParent(rs.getString(8))));
            }
        }
        return rows;
    }

    private static PageAddress parseParent(String value) {
        return value == null ? null : PageAddress.parse(value);
    }

    private static void bindPage(PreparedStatement ps, PageAddress address) throws SQLException {
        ps.setString(1, address.root());
        ps.setString(2, address.type());
        ps.setString(3, address.id());
    }

    private static void bindAddress(PreparedStatement ps, PageAddress address) throws SQLException {
        bindPage(ps, address);
        ps.setInt(4, address.version());
    }

    private static PageCacheException failure(String operation, PageAddress address, SQLException e) {
        log.error("Page cache {} failed for {}: {} SQLState={}", operation, address, e.getMessage(), e.getSQLState(), e);
        return new PageCacheException("Page cache " + operation + " failed for " + address + ": " + e.getMessage(), e);
    }
}
