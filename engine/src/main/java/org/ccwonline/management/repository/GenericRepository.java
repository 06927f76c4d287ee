package org.ccwonline.management.repository;

import org.ccwonline.management.dynamic.DynamicExpression;
import org.ccwonline.management.query.OrderByClause;
import org.ccwonline.management.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * CRUD and query operations over one entity type.
 *
 * Predicates are given either as Java code or as dynamic expression text over the
 * entity's properties, e.g. {@code findOne("ConferenceId == @0", 48)}. Filtering and
 * ordering run on the entities enumerated from the store; ordering is stable.
 *
 * @param <T> The entity type
 */
public abstract class GenericRepository<T> {

    private static final Logger logger = LoggerFactory.getLogger(GenericRepository.class);

    private final Class<T> entityType;
    private final EntityStore<T> store;

    protected GenericRepository(Class<T> entityType, EntityStore<T> store) {
        this.entityType = Objects.requireNonNull(entityType, "Entity type cannot be null");
        this.store = Objects.requireNonNull(store, "Store cannot be null");
    }

    public Class<T> entityType() {
        return entityType;
    }

    protected EntityStore<T> store() {
        return store;
    }

    // ==================== Writes ====================

    public T create(T entity) {
        store.insert(entity);
        return entity;
    }

    /**
     * @throws RepositoryException if no stored entity has the same key
     */
    public T update(T entity) {
        if (!store.update(entity)) {
            throw new RepositoryException(entityType.getSimpleName() + " not found: " + entity);
        }
        return entity;
    }

    public boolean delete(T entity) {
        return store.delete(entity);
    }

    /**
     * Deletes every matching entity. Matching and removal happen atomically in the store.
     *
     * @return The number of entities deleted
     */
    public int delete(Predicate<T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        int deleted = store.deleteWhere(predicate);
        logger.debug("Deleted {} {}", deleted, entityType.getSimpleName());
        return deleted;
    }

    public int delete(String predicate, Object... values) {
        return delete(compile(predicate, values));
    }

    // ==================== Single results ====================

    /**
     * @return The only matching entity, or null if none matches
     * @throws NonUniqueResultException if more than one entity matches
     */
    public T findOne(Predicate<T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        List<T> matches = store.findMatching(predicate, 2);
        if (matches.size() > 1) {
            throw new NonUniqueResultException(entityType.getSimpleName());
        }
        return matches.isEmpty() ? null : matches.get(0);
    }

    public T findOne(String predicate, Object... values) {
        return findOne(compile(predicate, values));
    }

    public long count() {
        return store.count();
    }

    public long count(Predicate<T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return store.count(predicate);
    }

    public long count(String predicate, Object... values) {
        return count(compile(predicate, values));
    }

    public boolean isExist(Predicate<T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return store.anyMatch(predicate);
    }

    public boolean isExist(String predicate, Object... values) {
        return isExist(compile(predicate, values));
    }

    // ==================== Collections ====================

    public Stream<T> findAll() {
        return store.findAll().stream();
    }

    /**
     * @param orderBy The ordering, or null to keep storage order
     */
    public List<T> findAll(Predicate<T> predicate, OrderByClause<T> orderBy) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        List<T> result = filter(predicate);
        if (orderBy != null && !orderBy.isEmpty()) {
            result.sort(orderBy.comparator());
        }
        return result;
    }

    /**
     * Filters, orders, then applies the query's limit.
     */
    public List<T> findAll(Query<T> query) {
        List<T> result = filterAndOrder(query);
        Integer limit = query.limit();
        if (limit != null && limit < result.size()) {
            return new ArrayList<>(result.subList(0, limit));
        }
        return result;
    }

    /**
     * Filters, orders, then returns the requested page. The query's limit is ignored.
     *
     * @param pageIndex The 1-based page number
     * @param pageSize  The page size
     */
    public Page<T> findAll(Query<T> query, int pageIndex, int pageSize) {
        if (pageIndex < 1) {
            throw new IllegalArgumentException("Page index must be at least 1: " + pageIndex);
        }
        if (pageSize < 0) {
            throw new IllegalArgumentException("Page size must be non-negative: " + pageSize);
        }
        List<T> result = filterAndOrder(query);
        long skip = (long) (pageIndex - 1) * pageSize;
        List<T> items = result.stream()
                .skip(skip)
                .limit(pageSize)
                .collect(Collectors.toList());
        return new Page<>(items, pageIndex, pageSize, result.size());
    }

    /**
     * Runs raw SQL against a relational store and maps the rows to entities.
     *
     * @throws UnsupportedOperationException if the store is not relational
     */
    public List<T> sqlQuery(String sql, Object... params) {
        return store.sqlQuery(sql, params);
    }

    // ==================== Helpers ====================

    private List<T> filterAndOrder(Query<T> query) {
        Objects.requireNonNull(query, "Query cannot be null");
        Predicate<T> predicate = query.predicate(entityType);
        Comparator<T> comparator = query.comparator(entityType);

        List<T> result = predicate == null ? new ArrayList<>(store.findAll()) : filter(predicate);
        if (comparator != null) {
            result.sort(comparator);
        }
        return result;
    }

    private List<T> filter(Predicate<T> predicate) {
        List<T> result = new ArrayList<>();
        for (T entity : store.findAll()) {
            if (predicate.test(entity)) {
                result.add(entity);
            }
        }
        return result;
    }

    private Predicate<T> compile(String predicate, Object... values) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return DynamicExpression.parsePredicate(entityType, predicate, values);
    }
}
