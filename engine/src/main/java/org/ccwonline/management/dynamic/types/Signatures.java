package org.ccwonline.management.dynamic.types;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator signature catalog.
 *
 * Each set lists the operand type combinations an operator accepts. Sets extend one
 * another the same way the operators do: relational adds text and time to arithmetic,
 * equality adds booleans to relational, subtract adds {@code DateTime - DateTime} to add.
 */
public enum Signatures {
    LOGICAL,
    ARITHMETIC,
    RELATIONAL,
    EQUALITY,
    ADD,
    SUBTRACT,
    NEGATION,
    NOT;

    /**
     * One operand type combination of an operator.
     */
    public record OperatorSignature(List<TypeRef> parameterTypes) implements Overload {
        public OperatorSignature {
            parameterTypes = List.copyOf(parameterTypes);
        }

        @Override
        public String toString() {
            return parameterTypes.toString();
        }
    }

    private static final Class<?>[] NUMERIC = {
            int.class, long.class, float.class, double.class, BigDecimal.class,
            Integer.class, Long.class, Float.class, Double.class
    };

    private List<OperatorSignature> signatures;

    public List<OperatorSignature> signatures() {
        if (signatures == null) {
            signatures = List.copyOf(build(this));
        }
        return signatures;
    }

    private static List<OperatorSignature> build(Signatures set) {
        List<OperatorSignature> result = new ArrayList<>();
        switch (set) {
            case LOGICAL -> {
                binary(result, boolean.class, boolean.class);
                binary(result, Boolean.class, Boolean.class);
            }
            case ARITHMETIC -> {
                for (Class<?> type : NUMERIC) {
                    binary(result, type, type);
                }
            }
            case RELATIONAL -> {
                result.addAll(ARITHMETIC.signatures());
                binary(result, String.class, String.class);
                binary(result, char.class, char.class);
                binary(result, LocalDateTime.class, LocalDateTime.class);
                binary(result, Duration.class, Duration.class);
                binary(result, Character.class, Character.class);
            }
            case EQUALITY -> {
                result.addAll(RELATIONAL.signatures());
                binary(result, boolean.class, boolean.class);
                binary(result, Boolean.class, Boolean.class);
            }
            case ADD -> {
                result.addAll(ARITHMETIC.signatures());
                binary(result, LocalDateTime.class, Duration.class);
                binary(result, Duration.class, Duration.class);
            }
            case SUBTRACT -> {
                result.addAll(ADD.signatures());
                binary(result, LocalDateTime.class, LocalDateTime.class);
            }
            case NEGATION -> {
                for (Class<?> type : NUMERIC) {
                    unary(result, type);
                }
            }
            case NOT -> {
                unary(result, boolean.class);
                unary(result, Boolean.class);
            }
        }
        return result;
    }

    private static void binary(List<OperatorSignature> result, Class<?> left, Class<?> right) {
        result.add(new OperatorSignature(List.of(TypeRef.of(left), TypeRef.of(right))));
    }

    private static void unary(List<OperatorSignature> result, Class<?> operand) {
        result.add(new OperatorSignature(List.of(TypeRef.of(operand))));
    }
}
