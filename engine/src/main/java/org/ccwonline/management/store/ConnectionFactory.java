package org.ccwonline.management.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens JDBC connections for a {@link DataSourceConfig}.
 *
 * Supports DuckDB and SQLite, in memory or file based. In-memory connections are cached
 * per URL so that tables persist across stores sharing the configuration.
 */
public class ConnectionFactory {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionFactory.class);

    // Force-load JDBC drivers at class initialization
    static {
        loadDriver("org.duckdb.DuckDBDriver");
        loadDriver("org.sqlite.JDBC");
    }

    private static final Map<String, Connection> connectionCache = new ConcurrentHashMap<>();

    private final DataSourceConfig config;

    public ConnectionFactory(DataSourceConfig config) {
        this.config = config;
    }

    public DataSourceConfig config() {
        return config;
    }

    /**
     * @return A live connection; in-memory connections are shared and must not be closed by callers
     * @throws SQLException If connection fails
     */
    public Connection open() throws SQLException {
        if (config.isInMemory()) {
            return getOrCreateCached(config.url(), this::connect);
        }
        return connect();
    }

    private Connection connect() throws SQLException {
        logger.debug("Opening connection to {}", config.url());
        if (config.user() != null) {
            return DriverManager.getConnection(config.url(), config.user(), config.password());
        }
        return DriverManager.getConnection(config.url());
    }

    private static Connection getOrCreateCached(String key, ConnectionSupplier supplier) throws SQLException {
        Connection cached = connectionCache.get(key);
        if (cached != null && !cached.isClosed()) {
            return cached;
        }

        Connection newConn = supplier.get();
        connectionCache.put(key, newConn);
        return newConn;
    }

    @FunctionalInterface
    private interface ConnectionSupplier {
        Connection get() throws SQLException;
    }

    /**
     * Creates a private in-memory DuckDB connection. The caller owns it.
     */
    public static Connection createInMemoryDuckDB() throws SQLException {
        return DriverManager.getConnection("jdbc:duckdb:");
    }

    /**
     * Creates a private in-memory SQLite connection. The caller owns it.
     */
    public static Connection createInMemorySQLite() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite::memory:");
    }

    /**
     * Closes and forgets all cached connections.
     */
    public static void clearCache() {
        connectionCache.values().forEach(conn -> {
            try {
                conn.close();
            } catch (SQLException e) {
                logger.warn("Failed to close cached connection", e);
            }
        });
        connectionCache.clear();
    }

    private static void loadDriver(String className) {
        try {
            Class.forName(className);
        } catch (ClassNotFoundException e) {
            logger.warn("JDBC driver {} not found in classpath", className);
        }
    }
}
