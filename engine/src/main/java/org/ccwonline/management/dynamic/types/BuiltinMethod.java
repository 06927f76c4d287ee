package org.ccwonline.management.dynamic.types;

import java.util.List;
import java.util.Objects;

/**
 * A method of the closed built-in catalog, callable from expression text.
 *
 * @param name           The method name as written in expressions
 * @param isStatic       true for type-level calls such as {@code Math.Abs(x)}
 * @param parameterTypes The declared parameter types
 * @param returnType     The result type
 * @param invoker        The implementation
 */
public record BuiltinMethod(
        String name,
        boolean isStatic,
        List<TypeRef> parameterTypes,
        TypeRef returnType,
        Invoker invoker) implements Overload {

    public BuiltinMethod {
        Objects.requireNonNull(name, "Method name cannot be null");
        Objects.requireNonNull(returnType, "Return type cannot be null");
        Objects.requireNonNull(invoker, "Invoker cannot be null");
        parameterTypes = List.copyOf(parameterTypes);
    }

    /**
     * Invokes a built-in method on already converted arguments.
     */
    @FunctionalInterface
    public interface Invoker {
        Object invoke(Object target, Object[] args);
    }

    @Override
    public String toString() {
        return name + parameterTypes;
    }
}
