package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.AggregateFunction;
import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.Objects;

/**
 * Sequence function applied to a collection member, e.g. {@code Attendees.Count(Age > 30)}.
 *
 * The argument is evaluated once per element with {@code element} bound to it, except for
 * {@code Contains} whose argument is a plain value from the outer scope.
 *
 * @param source   The sequence
 * @param function The function
 * @param element  The element variable, null when the function has no per-element argument
 * @param argument The predicate, selector or searched value; null if omitted
 * @param type     The result type
 */
public record AggregateCall(
        Expression source,
        AggregateFunction function,
        ParameterRef element,
        Expression argument,
        TypeRef type) implements Expression {

    public AggregateCall {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }
}
