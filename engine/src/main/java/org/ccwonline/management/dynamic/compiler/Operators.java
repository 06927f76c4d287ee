package org.ccwonline.management.dynamic.compiler;

import org.ccwonline.management.dynamic.ast.BinaryExpression.BinaryOperator;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Run-time semantics of the operators.
 *
 * Operators are lifted over null: arithmetic with a null operand yields null, a relational
 * comparison with a null operand is false, and equality treats null as equal only to null.
 * Operands arrive already converted to the operator signature's type.
 */
final class Operators {

    private Operators() {
    }

    // ==================== Arithmetic ====================

    static Object arithmetic(BinaryOperator op, Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (left instanceof Integer l && right instanceof Integer r) {
            return switch (op) {
                case ADD -> l + r;
                case SUBTRACT -> l - r;
                case MULTIPLY -> l * r;
                case DIVIDE -> l / r;
                default -> l % r;
            };
        }
        if (left instanceof Long l && right instanceof Long r) {
            return switch (op) {
                case ADD -> l + r;
                case SUBTRACT -> l - r;
                case MULTIPLY -> l * r;
                case DIVIDE -> l / r;
                default -> l % r;
            };
        }
        if (left instanceof Double l && right instanceof Double r) {
            return switch (op) {
                case ADD -> l + r;
                case SUBTRACT -> l - r;
                case MULTIPLY -> l * r;
                case DIVIDE -> l / r;
                default -> l % r;
            };
        }
        if (left instanceof Float l && right instanceof Float r) {
            return switch (op) {
                case ADD -> l + r;
                case SUBTRACT -> l - r;
                case MULTIPLY -> l * r;
                case DIVIDE -> l / r;
                default -> l % r;
            };
        }
        if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
            return switch (op) {
                case ADD -> l.add(r);
                case SUBTRACT -> l.subtract(r);
                case MULTIPLY -> l.multiply(r);
                case DIVIDE -> l.divide(r, MathContext.DECIMAL128);
                default -> l.remainder(r);
            };
        }
        if (left instanceof LocalDateTime l) {
            if (right instanceof Duration r) {
                return op == BinaryOperator.ADD ? l.plus(r) : l.minus(r);
            }
            return Duration.between((LocalDateTime) right, l);
        }
        if (left instanceof Duration l && right instanceof Duration r) {
            return op == BinaryOperator.ADD ? l.plus(r) : l.minus(r);
        }
        throw new IllegalStateException("Operator '" + op.symbol() + "' not defined for "
                + left.getClass().getSimpleName() + " and " + right.getClass().getSimpleName());
    }

    static Object negate(Object operand) {
        if (operand == null) return null;
        if (operand instanceof Integer i) return -i;
        if (operand instanceof Long l) return -l;
        if (operand instanceof Double d) return -d;
        if (operand instanceof Float f) return -f;
        if (operand instanceof BigDecimal bd) return bd.negate();
        throw new IllegalStateException("Operator '-' not defined for " + operand.getClass().getSimpleName());
    }

    static Object not(Object operand) {
        return operand == null ? null : !(Boolean) operand;
    }

    static String concat(Object left, Object right) {
        return (left == null ? "" : left.toString()) + (right == null ? "" : right.toString());
    }

    // ==================== Comparison ====================

    static boolean equal(Object left, Object right) {
        if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
            return l.compareTo(r) == 0;
        }
        return Objects.equals(left, right);
    }

    static boolean relational(BinaryOperator op, Object left, Object right) {
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Double l && right instanceof Double r) {
            return relational(op, l.doubleValue(), r.doubleValue());
        }
        if (left instanceof Float l && right instanceof Float r) {
            return relational(op, l.doubleValue(), r.doubleValue());
        }
        int c = compare(left, right);
        return switch (op) {
            case LESS -> c < 0;
            case LESS_EQUAL -> c <= 0;
            case GREATER -> c > 0;
            default -> c >= 0;
        };
    }

    private static boolean relational(BinaryOperator op, double l, double r) {
        return switch (op) {
            case LESS -> l < r;
            case LESS_EQUAL -> l <= r;
            case GREATER -> l > r;
            default -> l >= r;
        };
    }

    /**
     * Total order used by comparisons and orderings; null sorts before any value.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compare(Object left, Object right) {
        if (left == right) return 0;
        if (left == null) return -1;
        if (right == null) return 1;
        if (left instanceof String l && right instanceof String r) {
            return Integer.signum(l.compareTo(r));
        }
        if (left instanceof Comparable l && left.getClass() == right.getClass()) {
            return Integer.signum(l.compareTo(right));
        }
        if (left instanceof Number l && right instanceof Number r) {
            return Conversions.toBigDecimal(l).compareTo(Conversions.toBigDecimal(r));
        }
        throw new IllegalArgumentException("Values of type " + left.getClass().getSimpleName()
                + " and " + right.getClass().getSimpleName() + " are not comparable");
    }

    // ==================== Sequences ====================

    static Iterable<?> iterable(Object sequence) {
        if (sequence instanceof Iterable<?> iterable) {
            return iterable;
        }
        if (sequence.getClass().isArray()) {
            int length = Array.getLength(sequence);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(sequence, i));
            }
            return elements;
        }
        throw new IllegalArgumentException("Not a sequence: " + sequence.getClass().getSimpleName());
    }

    static Object elementAt(Object target, Object index) {
        if (target instanceof Map<?, ?> map) {
            return map.get(index);
        }
        int i = (Integer) index;
        if (target instanceof String s) {
            return s.charAt(i);
        }
        if (target instanceof List<?> list) {
            return list.get(i);
        }
        if (target.getClass().isArray()) {
            return Array.get(target, i);
        }
        int position = 0;
        for (Object element : iterable(target)) {
            if (position++ == i) {
                return element;
            }
        }
        throw new IndexOutOfBoundsException("Index " + i + " out of bounds for length " + position);
    }
}
