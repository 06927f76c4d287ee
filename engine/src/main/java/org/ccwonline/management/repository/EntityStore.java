package org.ccwonline.management.repository;

import java.util.List;
import java.util.function.Predicate;

/**
 * Storage backend of a {@link GenericRepository}.
 *
 * Predicates are evaluated inside the store, so a store can stop reading as soon as the
 * answer is known and can apply conditional writes atomically.
 *
 * @param <T> The entity type
 */
public interface EntityStore<T> {

    void insert(T entity);

    /**
     * @return true if an entity with the same key existed
     */
    boolean update(T entity);

    /**
     * @return true if an entity with the same key existed
     */
    boolean delete(T entity);

    /**
     * Removes every entity matching the predicate. Matching and removal form one atomic
     * step: no other write to the store is applied in between.
     *
     * @return The number of entities removed
     */
    int deleteWhere(Predicate<? super T> predicate);

    /**
     * @return A snapshot of all entities in storage order
     */
    List<T> findAll();

    /**
     * Returns the first matching entities in storage order, reading no further than needed.
     *
     * @param limit The maximum number of entities to return
     */
    List<T> findMatching(Predicate<? super T> predicate, int limit);

    /**
     * Stops at the first match.
     */
    boolean anyMatch(Predicate<? super T> predicate);

    long count();

    long count(Predicate<? super T> predicate);

    /**
     * Runs raw SQL and maps the rows to entities.
     *
     * @throws UnsupportedOperationException if the store is not relational
     */
    default List<T> sqlQuery(String sql, Object... params) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support SQL queries");
    }
}
