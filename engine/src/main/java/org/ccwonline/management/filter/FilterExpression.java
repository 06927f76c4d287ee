package org.ccwonline.management.filter;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Fluent builder composing predicates with {@code and}/{@code or}.
 *
 * Every operation accepts a condition flag; a clause whose flag is false is skipped,
 * which lets optional search criteria be chained without branching:
 * <pre>
 *   Predicate&lt;Conference&gt; filter = new FilterExpression&lt;Conference&gt;()
 *       .start(c -&gt; c.status() == 1)
 *       .and(c -&gt; c.name().contains(keyword), keyword != null)
 *       .or(c -&gt; c.participantsNum() &gt; 100, includeLarge)
 *       .expression();
 * </pre>
 *
 * Clauses combine left to right: {@code a.and(b).or(c)} is {@code (a && b) || c}.
 *
 * @param <T> The entity type
 */
public class FilterExpression<T> {

    private Predicate<T> expression;

    public FilterExpression() {
    }

    public FilterExpression(Predicate<T> expression) {
        this.expression = expression;
    }

    public FilterExpression<T> start(Predicate<T> predicate) {
        return start(predicate, true);
    }

    /**
     * Replaces the composed predicate, or clears it when the condition is false.
     */
    public FilterExpression<T> start(Predicate<T> predicate, boolean condition) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        this.expression = condition ? predicate : null;
        return this;
    }

    public FilterExpression<T> and(Predicate<T> predicate) {
        return and(predicate, true);
    }

    public FilterExpression<T> and(Predicate<T> predicate, boolean condition) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        if (condition) {
            expression = expression == null ? predicate : expression.and(predicate);
        }
        return this;
    }

    public FilterExpression<T> or(Predicate<T> predicate) {
        return or(predicate, true);
    }

    public FilterExpression<T> or(Predicate<T> predicate, boolean condition) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        if (condition) {
            expression = expression == null ? predicate : expression.or(predicate);
        }
        return this;
    }

    /**
     * @return The composed predicate, or null if no clause was applied
     */
    public Predicate<T> expression() {
        return expression;
    }

    /**
     * Evaluates the composed predicate; an empty filter matches everything.
     */
    public boolean test(T value) {
        return expression == null || expression.test(value);
    }

    public boolean isEmpty() {
        return expression == null;
    }
}
