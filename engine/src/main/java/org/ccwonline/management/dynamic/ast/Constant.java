package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.Objects;

/**
 * A constant value: a literal written in the expression text, or an external value
 * substituted for a placeholder.
 *
 * @param value       The value, may be null
 * @param type        The static type
 * @param literalText The source text for literals, null for substituted values.
 *                    Literals can be re-typed during overload resolution.
 */
public record Constant(Object value, TypeRef type, String literalText) implements Expression {

    public static final String NULL_TEXT = "null";

    public Constant {
        Objects.requireNonNull(type, "Type cannot be null");
    }

    public static Constant of(Object value, TypeRef type) {
        return new Constant(value, type, null);
    }

    public static Constant nullLiteral() {
        return new Constant(null, TypeRef.OBJECT, NULL_TEXT);
    }

    public boolean isLiteral() {
        return literalText != null;
    }

    public boolean isNullLiteral() {
        return value == null && NULL_TEXT.equals(literalText);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }
}
