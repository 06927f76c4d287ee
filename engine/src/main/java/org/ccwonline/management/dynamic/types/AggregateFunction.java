package org.ccwonline.management.dynamic.types;

import java.util.Arrays;
import java.util.Optional;

/**
 * Sequence functions callable on collection members.
 */
public enum AggregateFunction {
    WHERE("Where", ArgumentKind.PREDICATE, true),
    ANY("Any", ArgumentKind.PREDICATE, false),
    ALL("All", ArgumentKind.PREDICATE, true),
    COUNT("Count", ArgumentKind.PREDICATE, false),
    MIN("Min", ArgumentKind.SELECTOR, false),
    MAX("Max", ArgumentKind.SELECTOR, false),
    SUM("Sum", ArgumentKind.SELECTOR, false),
    AVERAGE("Average", ArgumentKind.SELECTOR, false),
    CONTAINS("Contains", ArgumentKind.VALUE, true);

    /**
     * How the single argument is parsed.
     */
    public enum ArgumentKind {
        /** A boolean expression over the element. */
        PREDICATE,
        /** A value expression over the element. */
        SELECTOR,
        /** A value from the enclosing scope. */
        VALUE
    }

    private final String methodName;
    private final ArgumentKind argumentKind;
    private final boolean argumentRequired;

    AggregateFunction(String methodName, ArgumentKind argumentKind, boolean argumentRequired) {
        this.methodName = methodName;
        this.argumentKind = argumentKind;
        this.argumentRequired = argumentRequired;
    }

    public String methodName() {
        return methodName;
    }

    public ArgumentKind argumentKind() {
        return argumentKind;
    }

    public boolean argumentRequired() {
        return argumentRequired;
    }

    /**
     * Case-insensitive lookup by method name.
     */
    public static Optional<AggregateFunction> find(String name) {
        return Arrays.stream(values())
                .filter(f -> f.methodName.equalsIgnoreCase(name))
                .findFirst();
    }
}
