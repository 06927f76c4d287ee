package org.ccwonline.management.dynamic.types;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Type predicates and implicit conversion rules of the expression language.
 *
 * Implicit numeric conversions (non-nullable to nullable wrapping is always allowed,
 * nullable to non-nullable never):
 * <pre>
 *   byte  -> short, int, long, float, double, decimal
 *   short -> int, long, float, double, decimal
 *   char  -> int, long, float, double, decimal
 *   int   -> long, float, double, decimal
 *   long  -> float, double, decimal
 *   float -> double
 * </pre>
 * {@code decimal} is {@link BigDecimal}.
 */
public final class Types {

    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
            boolean.class, Boolean.class,
            char.class, Character.class,
            byte.class, Byte.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class);

    private static final Map<Class<?>, Class<?>> UNBOXES = Map.of(
            Boolean.class, boolean.class,
            Character.class, char.class,
            Byte.class, byte.class,
            Short.class, short.class,
            Integer.class, int.class,
            Long.class, long.class,
            Float.class, float.class,
            Double.class, double.class);

    private static final Map<Class<?>, Set<Class<?>>> WIDENINGS = Map.of(
            byte.class, Set.of(short.class, int.class, long.class, float.class, double.class),
            short.class, Set.of(int.class, long.class, float.class, double.class),
            char.class, Set.of(int.class, long.class, float.class, double.class),
            int.class, Set.of(long.class, float.class, double.class),
            long.class, Set.of(float.class, double.class),
            float.class, Set.of(double.class));

    private static final Set<Class<?>> INTEGRAL = Set.of(byte.class, short.class, int.class, long.class);

    private static final Map<Class<?>, String> DISPLAY_NAMES = Map.ofEntries(
            Map.entry(boolean.class, "Boolean"),
            Map.entry(char.class, "Char"),
            Map.entry(byte.class, "Byte"),
            Map.entry(short.class, "Int16"),
            Map.entry(int.class, "Int32"),
            Map.entry(long.class, "Int64"),
            Map.entry(float.class, "Single"),
            Map.entry(double.class, "Double"),
            Map.entry(BigDecimal.class, "Decimal"),
            Map.entry(LocalDateTime.class, "DateTime"),
            Map.entry(Duration.class, "TimeSpan"),
            Map.entry(UUID.class, "Guid"));

    private Types() {
    }

    // ==================== Boxing ====================

    public static Class<?> box(Class<?> type) {
        return BOXES.getOrDefault(type, type);
    }

    public static Class<?> unbox(Class<?> type) {
        return UNBOXES.getOrDefault(type, type);
    }

    /**
     * @return The nullable form of a type ({@code int -> Integer}); reference types are returned as is
     */
    public static TypeRef nullable(TypeRef type) {
        if (type instanceof TypeRef.ClassType ct && ct.type().isPrimitive()) {
            return TypeRef.of(box(ct.type()));
        }
        return type;
    }

    public static TypeRef nonNullable(TypeRef type) {
        if (type instanceof TypeRef.ClassType ct) {
            return TypeRef.of(unbox(ct.type()));
        }
        return type;
    }

    public static boolean isNullable(TypeRef type) {
        return !(type instanceof TypeRef.ClassType ct) || !ct.type().isPrimitive();
    }

    /**
     * Value types go through the operator signature catalog; everything else is compared by reference rules.
     */
    public static boolean isValueType(TypeRef type) {
        if (type instanceof TypeRef.ClassType ct) {
            Class<?> c = ct.type();
            return c.isPrimitive() || UNBOXES.containsKey(c)
                    || c == BigDecimal.class || c == LocalDateTime.class || c == Duration.class;
        }
        return false;
    }

    public static boolean isEnum(TypeRef type) {
        return type instanceof TypeRef.ClassType ct && ct.type().isEnum();
    }

    public static boolean isString(TypeRef type) {
        return type instanceof TypeRef.ClassType ct && ct.type() == String.class;
    }

    public static boolean isBoolean(TypeRef type) {
        return type instanceof TypeRef.ClassType ct && unbox(ct.type()) == boolean.class;
    }

    public static boolean isNumeric(TypeRef type) {
        if (type instanceof TypeRef.ClassType ct) {
            Class<?> c = unbox(ct.type());
            return c == BigDecimal.class || (c.isPrimitive() && c != boolean.class && c != char.class);
        }
        return false;
    }

    public static boolean isIntegral(TypeRef type) {
        return type instanceof TypeRef.ClassType ct && INTEGRAL.contains(unbox(ct.type()));
    }

    public static boolean isComparable(TypeRef type) {
        if (type instanceof TypeRef.ClassType ct) {
            return ct.type().isPrimitive() || Comparable.class.isAssignableFrom(ct.type());
        }
        return false;
    }

    public static String displayName(Class<?> type) {
        String name = DISPLAY_NAMES.get(unbox(type));
        if (name == null) {
            return type.getSimpleName();
        }
        return UNBOXES.containsKey(type) ? name + "?" : name;
    }

    // ==================== Implicit conversions ====================

    /**
     * @return true if a value of the source type converts implicitly to the target type
     */
    public static boolean isCompatibleWith(TypeRef source, TypeRef target) {
        if (source.equals(target)) {
            return true;
        }
        if (target.equals(TypeRef.OBJECT)) {
            return true;
        }
        if (source instanceof TypeRef.SequenceType ss && target instanceof TypeRef.SequenceType ts) {
            return !isValueType(ss.elementType()) && isCompatibleWith(ss.elementType(), ts.elementType());
        }
        if (!(source instanceof TypeRef.ClassType sct) || !(target instanceof TypeRef.ClassType tct)) {
            return false;
        }
        Class<?> s = sct.type();
        Class<?> t = tct.type();

        if (t == BigDecimal.class) {
            Class<?> st = unbox(s);
            return st == BigDecimal.class || INTEGRAL.contains(st) || st == char.class;
        }
        if (!t.isPrimitive() && !UNBOXES.containsKey(t)) {
            return t.isAssignableFrom(box(s));
        }

        Class<?> st = unbox(s);
        Class<?> tt = unbox(t);
        if (st != s && tt == t) {
            return false;
        }
        if (st == tt) {
            return true;
        }
        Set<Class<?>> widenings = WIDENINGS.get(st);
        return widenings != null && widenings.contains(tt);
    }

    /**
     * @return 1 if {@code source -> t1} is a better conversion than {@code source -> t2},
     *         -1 if it is worse, 0 if neither is better
     */
    public static int compareConversions(TypeRef source, TypeRef t1, TypeRef t2) {
        if (t1.equals(t2)) return 0;
        if (source.equals(t1)) return 1;
        if (source.equals(t2)) return -1;
        boolean t1t2 = isCompatibleWith(t1, t2);
        boolean t2t1 = isCompatibleWith(t2, t1);
        if (t1t2 && !t2t1) return 1;
        if (t2t1 && !t1t2) return -1;
        return 0;
    }

    /**
     * Explicit conversion as written with a type name call, e.g. {@code Int32(Price)}.
     */
    public static boolean isExplicitlyConvertible(TypeRef source, TypeRef target) {
        if (isCompatibleWith(source, target)) {
            return true;
        }
        if (source instanceof TypeRef.ClassType sct && target instanceof TypeRef.ClassType tct) {
            Class<?> s = unbox(sct.type());
            Class<?> t = unbox(tct.type());
            boolean sNumeric = isNumeric(source) || s == char.class;
            boolean tNumeric = isNumeric(target) || t == char.class;
            if (sNumeric && tNumeric) {
                return true;
            }
            if (s == t) {
                return true;
            }
            if ((s.isEnum() && INTEGRAL.contains(t)) || (t.isEnum() && INTEGRAL.contains(s))) {
                return true;
            }
            return !s.isPrimitive() && !t.isPrimitive() && s.isAssignableFrom(t);
        }
        return false;
    }
}
