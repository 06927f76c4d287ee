package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.BuiltinMethod;
import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.List;
import java.util.Objects;

/**
 * Call of a built-in method, constructor or conversion.
 *
 * @param instance  The target, null for static methods
 * @param method    The resolved method
 * @param arguments The arguments, converted to the method's parameter types
 */
public record MethodCall(Expression instance, BuiltinMethod method, List<Expression> arguments) implements Expression {

    public MethodCall {
        Objects.requireNonNull(method, "Method cannot be null");
        arguments = List.copyOf(arguments);
    }

    @Override
    public TypeRef type() {
        return method.returnType();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitMethodCall(this);
    }
}
