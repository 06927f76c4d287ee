package org.ccwonline.management.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Ordered list of typed sort keys, primary key first.
 *
 * <pre>
 *   query.orderBy(Conference::status).thenByDescending(Conference::conferenceId);
 * </pre>
 *
 * @param <T> The entity type
 */
public class OrderByClause<T> {

    private final List<OrderBySelector<T>> selectors = new ArrayList<>();

    public OrderByClause() {
    }

    public static <T> OrderByClause<T> by(Function<? super T, ? extends Comparable<?>> selector) {
        return new OrderByClause<T>().thenBy(selector);
    }

    public static <T> OrderByClause<T> byDescending(Function<? super T, ? extends Comparable<?>> selector) {
        return new OrderByClause<T>().thenByDescending(selector);
    }

    public OrderByClause<T> thenBy(Function<? super T, ? extends Comparable<?>> selector) {
        selectors.add(new OrderBySelector<>(selector, Sort.ASC));
        return this;
    }

    public OrderByClause<T> thenByDescending(Function<? super T, ? extends Comparable<?>> selector) {
        selectors.add(new OrderBySelector<>(selector, Sort.DESC));
        return this;
    }

    public List<OrderBySelector<T>> selectors() {
        return Collections.unmodifiableList(selectors);
    }

    public boolean isEmpty() {
        return selectors.isEmpty();
    }

    /**
     * Builds the multi-key comparator. Null keys sort first in ascending order.
     *
     * @return The comparator, or null if no key was added
     */
    public Comparator<T> comparator() {
        Comparator<T> comparator = null;
        for (OrderBySelector<T> selector : selectors) {
            Function<? super T, ? extends Comparable<?>> extractor = selector.selector();
            Comparator<T> key = (left, right) -> compareKeys(extractor.apply(left), extractor.apply(right));
            if (selector.sort() == Sort.DESC) {
                key = key.reversed();
            }
            comparator = comparator == null ? key : comparator.thenComparing(key);
        }
        return comparator;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareKeys(Comparable left, Comparable right) {
        if (left == right) return 0;
        if (left == null) return -1;
        if (right == null) return 1;
        return left.compareTo(right);
    }
}
