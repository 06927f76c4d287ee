package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.Objects;

/**
 * Binary operation. Operands have already been converted to the chosen signature.
 *
 * @param operator The operator
 * @param left     The left operand
 * @param right    The right operand
 * @param type     The result type
 */
public record BinaryExpression(
        BinaryOperator operator,
        Expression left,
        Expression right,
        TypeRef type) implements Expression {

    public enum BinaryOperator {
        OR("||"),
        AND("&&"),
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS("<"),
        LESS_EQUAL("<="),
        GREATER(">"),
        GREATER_EQUAL(">="),
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),
        CONCAT("&");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isRelational() {
            return this == LESS || this == LESS_EQUAL || this == GREATER || this == GREATER_EQUAL;
        }
    }

    public BinaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }
}
