package org.ccwonline.management.query;

import org.ccwonline.management.dynamic.DynamicExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Query definition: a filter, an ordering and a result limit.
 *
 * Each part can be given as Java code or as dynamic expression text:
 * <pre>
 *   Query&lt;Conference&gt; q = new Query&lt;&gt;("ConferenceId &lt; 100");
 *   q.whereAnd("Status = {0}", 1);
 *   q.orderBy("ConferenceId DESC");
 * </pre>
 * A typed filter takes precedence over a textual one, and likewise for orderings.
 * Textual clauses joined with {@code whereAnd}/{@code whereOr} have their placeholders
 * renumbered, so each clause counts its values from {@code @0}. A trailing
 * {@code Map<String, ?>} value supplies named values.
 *
 * @param <T> The entity type
 */
public class Query<T> {

    private Predicate<T> whereClause;
    private String whereString;
    private final List<Object> whereValues = new ArrayList<>();
    private final Map<String, Object> namedValues = new LinkedHashMap<>();

    private OrderByClause<T> orderByClause;
    private String orderByString;
    private final List<Object> orderByValues = new ArrayList<>();

    private Integer limit;

    public Query() {
    }

    public Query(Predicate<T> whereClause) {
        this.whereClause = whereClause;
    }

    public Query(String whereString, Object... values) {
        where(whereString, values);
    }

    // ==================== Filter ====================

    public Query<T> where(Predicate<T> predicate) {
        this.whereClause = Objects.requireNonNull(predicate, "Predicate cannot be null");
        return this;
    }

    public Query<T> where(String predicate, Object... values) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        this.whereString = predicate;
        this.whereValues.clear();
        this.namedValues.clear();
        addValues(whereValues, values);
        return this;
    }

    public Query<T> whereAnd(Predicate<T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        whereClause = whereClause == null ? predicate : whereClause.and(predicate);
        return this;
    }

    public Query<T> whereOr(Predicate<T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        whereClause = whereClause == null ? predicate : whereClause.or(predicate);
        return this;
    }

    public Query<T> whereAnd(String predicate, Object... values) {
        return combine("and", predicate, values);
    }

    public Query<T> whereOr(String predicate, Object... values) {
        return combine("or", predicate, values);
    }

    private Query<T> combine(String operator, String predicate, Object... values) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        if (whereString == null) {
            return where(predicate, values);
        }
        String renumbered = Placeholders.renumber(predicate, whereValues.size());
        whereString = "(" + whereString + ") " + operator + " (" + renumbered + ")";
        addValues(whereValues, values);
        return this;
    }

    private void addValues(List<Object> target, Object[] values) {
        if (values == null) {
            return;
        }
        for (int i = 0; i < values.length; i++) {
            if (i == values.length - 1 && values[i] instanceof Map<?, ?> named) {
                named.forEach((k, v) -> namedValues.put(String.valueOf(k), v));
            } else {
                target.add(values[i]);
            }
        }
    }

    // ==================== Ordering ====================

    /**
     * Starts a typed ordering; chain {@code thenBy}/{@code thenByDescending} on the result.
     */
    public OrderByClause<T> orderBy(Function<? super T, ? extends Comparable<?>> selector) {
        orderByClause = OrderByClause.by(selector);
        return orderByClause;
    }

    public OrderByClause<T> orderByDescending(Function<? super T, ? extends Comparable<?>> selector) {
        orderByClause = OrderByClause.byDescending(selector);
        return orderByClause;
    }

    public Query<T> orderBy(OrderByClause<T> clause) {
        this.orderByClause = clause;
        return this;
    }

    /**
     * Sets a textual ordering such as {@code "Status, ConferenceId desc"}.
     */
    public Query<T> orderBy(String ordering, Object... values) {
        Objects.requireNonNull(ordering, "Ordering cannot be null");
        this.orderByString = ordering;
        this.orderByValues.clear();
        if (values != null) {
            Collections.addAll(orderByValues, values);
        }
        return this;
    }

    // ==================== Limit ====================

    public Query<T> limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit must be non-negative: " + limit);
        }
        this.limit = limit;
        return this;
    }

    // ==================== Accessors ====================

    public Predicate<T> whereClause() {
        return whereClause;
    }

    public String whereString() {
        return whereString;
    }

    /**
     * @return The values for the textual filter, followed by the named values map if any
     */
    public Object[] whereValues() {
        List<Object> values = new ArrayList<>(whereValues);
        if (!namedValues.isEmpty()) {
            values.add(new LinkedHashMap<>(namedValues));
        }
        return values.toArray();
    }

    public OrderByClause<T> orderByClause() {
        return orderByClause;
    }

    public String orderByString() {
        return orderByString;
    }

    public Object[] orderByValues() {
        return orderByValues.toArray();
    }

    public Integer limit() {
        return limit;
    }

    // ==================== Compilation ====================

    /**
     * Resolves the filter for an entity type.
     *
     * @return The typed filter if set, else the compiled textual filter, else null
     */
    public Predicate<T> predicate(Class<T> entityType) {
        if (whereClause != null) {
            return whereClause;
        }
        if (whereString != null && !whereString.isBlank()) {
            return DynamicExpression.parsePredicate(entityType, whereString, whereValues());
        }
        return null;
    }

    /**
     * Resolves the ordering for an entity type.
     *
     * @return The typed ordering if set, else the compiled textual ordering, else null
     */
    public Comparator<T> comparator(Class<T> entityType) {
        if (orderByClause != null && !orderByClause.isEmpty()) {
            return orderByClause.comparator();
        }
        if (orderByString != null && !orderByString.isBlank()) {
            return DynamicExpression.parseComparator(entityType, orderByString, orderByValues());
        }
        return null;
    }
}
