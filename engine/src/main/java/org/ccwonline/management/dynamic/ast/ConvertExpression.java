package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.Objects;

/**
 * Implicit or explicit conversion of a value to another type.
 */
public record ConvertExpression(Expression operand, TypeRef type) implements Expression {

    public ConvertExpression {
        Objects.requireNonNull(operand, "Operand cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConvert(this);
    }
}
