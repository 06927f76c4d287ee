package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.Objects;

/**
 * Element access {@code x[i]} on arrays, lists, strings and maps.
 */
public record Indexer(Expression instance, Expression index, TypeRef type) implements Expression {

    public Indexer {
        Objects.requireNonNull(instance, "Instance cannot be null");
        Objects.requireNonNull(index, "Index cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitIndexer(this);
    }
}
