package org.ccwonline.management.query;

import java.util.Objects;
import java.util.function.Function;

/**
 * One typed ordering key.
 *
 * @param selector Extracts the sort key from an entity; null keys sort first
 * @param sort     The direction
 * @param <T>      The entity type
 */
public record OrderBySelector<T>(Function<? super T, ? extends Comparable<?>> selector, Sort sort) {

    public OrderBySelector {
        Objects.requireNonNull(selector, "Selector cannot be null");
        Objects.requireNonNull(sort, "Sort cannot be null");
    }
}
