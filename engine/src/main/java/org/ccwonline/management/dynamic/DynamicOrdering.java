package org.ccwonline.management.dynamic;

import org.ccwonline.management.dynamic.ast.Expression;

import java.util.Objects;

/**
 * One key of a parsed ordering such as {@code "Status, ConferenceId desc"}.
 *
 * @param selector  The key expression
 * @param ascending true for ascending order
 */
public record DynamicOrdering(Expression selector, boolean ascending) {

    public DynamicOrdering {
        Objects.requireNonNull(selector, "Selector cannot be null");
    }
}
