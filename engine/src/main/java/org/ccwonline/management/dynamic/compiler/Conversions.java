package org.ccwonline.management.dynamic.compiler;

import org.ccwonline.management.dynamic.types.TypeRef;
import org.ccwonline.management.dynamic.types.Types;

import java.math.BigDecimal;

/**
 * Run-time value conversions matching the static conversions allowed by {@link Types}.
 */
final class Conversions {

    private Conversions() {
    }

    static Object convert(Object value, TypeRef target) {
        if (value == null || !(target instanceof TypeRef.ClassType ct)) {
            return value;
        }
        Class<?> type = Types.unbox(ct.type());
        if (type.isEnum()) {
            if (value instanceof Number n) {
                Object[] constants = type.getEnumConstants();
                int ordinal = n.intValue();
                if (ordinal < 0 || ordinal >= constants.length) {
                    throw new IllegalArgumentException("No " + type.getSimpleName() + " constant with ordinal " + ordinal);
                }
                return constants[ordinal];
            }
            return value;
        }
        if (value instanceof Enum<?> e && isNumericTarget(type)) {
            return toNumber(e.ordinal(), type);
        }
        if (value instanceof Character c && isNumericTarget(type)) {
            return toNumber((int) c, type);
        }
        if (value instanceof Number n) {
            if (type == char.class) {
                return (char) n.intValue();
            }
            if (isNumericTarget(type)) {
                return toNumber(n, type);
            }
        }
        return value;
    }

    private static boolean isNumericTarget(Class<?> type) {
        return type == BigDecimal.class || (type.isPrimitive() && type != boolean.class && type != char.class);
    }

    private static Object toNumber(Number n, Class<?> type) {
        if (type == int.class) return n.intValue();
        if (type == long.class) return n.longValue();
        if (type == double.class) return n.doubleValue();
        if (type == float.class) return n.floatValue();
        if (type == short.class) return n.shortValue();
        if (type == byte.class) return n.byteValue();
        return toBigDecimal(n);
    }

    static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
