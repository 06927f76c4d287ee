package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.Objects;

/**
 * {@code test ? ifTrue : ifFalse} and {@code iif(test, ifTrue, ifFalse)}.
 * Both branches share one type.
 */
public record ConditionalExpression(Expression test, Expression ifTrue, Expression ifFalse) implements Expression {

    public ConditionalExpression {
        Objects.requireNonNull(test, "Test cannot be null");
        Objects.requireNonNull(ifTrue, "True branch cannot be null");
        Objects.requireNonNull(ifFalse, "False branch cannot be null");
    }

    @Override
    public TypeRef type() {
        return ifTrue.type();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConditional(this);
    }
}
