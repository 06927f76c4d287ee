package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.Objects;

/**
 * Reference to a lambda parameter or to the element variable of a sequence function.
 *
 * @param name The parameter name, empty for the implicit {@code it}
 * @param type The parameter type
 * @param slot The frame slot holding the value at run time
 */
public record ParameterRef(String name, TypeRef type, int slot) implements Expression {

    public ParameterRef {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
        if (slot < 0) {
            throw new IllegalArgumentException("Slot must be non-negative: " + slot);
        }
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitParameter(this);
    }
}
