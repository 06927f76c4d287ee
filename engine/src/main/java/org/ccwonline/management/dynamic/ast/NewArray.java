package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.List;
import java.util.Objects;

/**
 * Inline sequence {@code new[] {1, 2, 3}}; all elements share the element type.
 */
public record NewArray(TypeRef elementType, List<Expression> elements) implements Expression {

    public NewArray {
        Objects.requireNonNull(elementType, "Element type cannot be null");
        elements = List.copyOf(elements);
    }

    @Override
    public TypeRef type() {
        return TypeRef.sequenceOf(elementType);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitNewArray(this);
    }
}
