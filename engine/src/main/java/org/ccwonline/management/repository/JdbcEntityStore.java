package org.ccwonline.management.repository;

import org.ccwonline.management.store.EntityMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Entity store over a JDBC connection.
 *
 * Writes run in an implicit transaction:
 * - autoCommit = false
 * - Commit on success
 * - Rollback on failure, with rollback errors attached as suppressed
 *
 * Operations are serialized on the store's connection.
 *
 * @param <T> The entity type
 */
public class JdbcEntityStore<T> implements EntityStore<T> {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEntityStore.class);

    private final Connection connection;
    private final EntityMapping<T> mapping;
    private final int fetchSize;

    public JdbcEntityStore(Connection connection, EntityMapping<T> mapping) {
        this(connection, mapping, 0);
    }

    public JdbcEntityStore(Connection connection, EntityMapping<T> mapping, int fetchSize) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
        this.mapping = Objects.requireNonNull(mapping, "Mapping cannot be null");
        this.fetchSize = fetchSize;
    }

    public EntityMapping<T> mapping() {
        return mapping;
    }

    /**
     * Creates the entity's table if it does not exist.
     */
    public synchronized JdbcEntityStore<T> ensureTable() {
        String ddl = mapping.table().createTableSql();
        logger.debug("{}", ddl);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(ddl);
        } catch (SQLException e) {
            throw new RepositoryException("Failed to create table: " + e.getMessage(), e);
        }
        return this;
    }

    // ==================== Writes ====================

    @Override
    public synchronized void insert(T entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        executeWithTransaction(() -> {
            try (PreparedStatement stmt = prepare(mapping.insertSql())) {
                mapping.bindInsert(stmt, entity);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public synchronized boolean update(T entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        String sql = mapping.updateSql();
        if (sql == null) {
            return !select("SELECT 1 FROM " + mapping.table().qualifiedName() + " WHERE "
                    + mapping.table().keyColumn().name() + " = ?", mapping.keyOf(entity)).isEmpty();
        }
        int rows = executeWithTransaction(() -> {
            try (PreparedStatement stmt = prepare(sql)) {
                mapping.bindUpdate(stmt, entity);
                return stmt.executeUpdate();
            }
        });
        return rows > 0;
    }

    @Override
    public synchronized boolean delete(T entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        int rows = executeWithTransaction(() -> {
            try (PreparedStatement stmt = prepare(mapping.deleteByKeySql())) {
                EntityMapping.bind(stmt, 1, mapping.keyOf(entity));
                return stmt.executeUpdate();
            }
        });
        return rows > 0;
    }

    /**
     * Reads the matching keys and deletes them as one batch, both in a single transaction.
     */
    @Override
    public synchronized int deleteWhere(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return executeWithTransaction(() -> {
            List<Object> keys = new ArrayList<>();
            try (PreparedStatement stmt = prepare(mapping.selectSql());
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    T entity = mapping.map(rs);
                    if (predicate.test(entity)) {
                        keys.add(mapping.keyOf(entity));
                    }
                }
            }
            if (keys.isEmpty()) {
                return 0;
            }
            try (PreparedStatement stmt = prepare(mapping.deleteByKeySql())) {
                for (Object key : keys) {
                    EntityMapping.bind(stmt, 1, key);
                    stmt.addBatch();
                }
                int total = 0;
                for (int count : stmt.executeBatch()) {
                    total += Math.max(count, 0);
                }
                return total;
            }
        });
    }

    // ==================== Reads ====================

    @Override
    public synchronized List<T> findAll() {
        return query(mapping.selectSql());
    }

    @Override
    public synchronized List<T> findMatching(Predicate<? super T> predicate, int limit) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return scan(rows -> rows.filter(predicate).limit(limit).collect(Collectors.toList()));
    }

    @Override
    public synchronized boolean anyMatch(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return scan(rows -> rows.anyMatch(predicate));
    }

    @Override
    public synchronized long count() {
        Object count = select("SELECT COUNT(*) FROM " + mapping.table().qualifiedName()).get(0);
        return ((Number) count).longValue();
    }

    @Override
    public synchronized long count(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return scan(rows -> rows.filter(predicate).count());
    }

    @Override
    public synchronized List<T> sqlQuery(String sql, Object... params) {
        Objects.requireNonNull(sql, "SQL cannot be null");
        return query(sql, params);
    }

    private List<T> query(String sql, Object... params) {
        logger.debug("{}", sql);
        try (PreparedStatement stmt = prepare(sql)) {
            bindAll(stmt, params);
            List<T> result = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(mapping.map(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new RepositoryException("Query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Streams the table row by row; the statement is closed once the function returns.
     */
    private <R> R scan(Function<Stream<T>, R> function) {
        String sql = mapping.selectSql();
        logger.debug("{}", sql);
        try (PreparedStatement stmt = prepare(sql);
             ResultSet rs = stmt.executeQuery()) {
            return function.apply(StreamSupport.stream(new RowSpliterator(rs), false));
        } catch (SQLException e) {
            throw new RepositoryException("Query failed: " + e.getMessage(), e);
        }
    }

    private final class RowSpliterator extends Spliterators.AbstractSpliterator<T> {

        private final ResultSet rs;

        RowSpliterator(ResultSet rs) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.rs = rs;
        }

        @Override
        public boolean tryAdvance(Consumer<? super T> action) {
            try {
                if (!rs.next()) {
                    return false;
                }
                action.accept(mapping.map(rs));
                return true;
            } catch (SQLException e) {
                throw new RepositoryException("Query failed: " + e.getMessage(), e);
            }
        }
    }

    private List<Object> select(String sql, Object... params) {
        logger.debug("{}", sql);
        try (PreparedStatement stmt = prepare(sql)) {
            bindAll(stmt, params);
            List<Object> result = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getObject(1));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new RepositoryException("Query failed: " + e.getMessage(), e);
        }
    }

    // ==================== Helpers ====================

    private PreparedStatement prepare(String sql) throws SQLException {
        PreparedStatement stmt = connection.prepareStatement(sql);
        if (fetchSize > 0) {
            stmt.setFetchSize(fetchSize);
        }
        return stmt;
    }

    private static void bindAll(PreparedStatement stmt, Object[] params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.length; i++) {
            EntityMapping.bind(stmt, i + 1, params[i]);
        }
    }

    private int executeWithTransaction(SqlWork work) {
        boolean originalAutoCommit = true;

        try {
            originalAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);

            int rowsAffected = work.run();

            connection.commit();
            logger.debug("Committed {} row(s) on {}", rowsAffected, mapping.table().qualifiedName());
            return rowsAffected;

        } catch (SQLException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
            throw new RepositoryException("Write operation failed: " + e.getMessage(), e);

        } catch (RuntimeException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
            throw e;

        } finally {
            try {
                connection.setAutoCommit(originalAutoCommit);
            } catch (SQLException e) {
                logger.warn("Failed to restore auto-commit", e);
            }
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        int run() throws SQLException;
    }
}
