package org.ccwonline.management.dynamic.types;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The closed catalog of methods and constructors callable from expressions.
 *
 * Nothing outside this catalog can be invoked; entity members are only ever read.
 */
public final class BuiltinMethods {

    private static final String CONSTRUCTOR = ".ctor";

    private static final Map<Class<?>, Map<String, List<BuiltinMethod>>> INSTANCE_METHODS = new HashMap<>();
    private static final Map<Class<?>, Map<String, List<BuiltinMethod>>> STATIC_METHODS = new HashMap<>();

    private static final BuiltinMethod TO_STRING = new BuiltinMethod("ToString", false, List.of(), TypeRef.STRING,
            (target, args) -> String.valueOf(target));

    static {
        // ========== String ==========
        instance(String.class, "Contains", boolean.class, (t, a) -> str(t).contains(str(a[0])), String.class);
        instance(String.class, "StartsWith", boolean.class, (t, a) -> str(t).startsWith(str(a[0])), String.class);
        instance(String.class, "EndsWith", boolean.class, (t, a) -> str(t).endsWith(str(a[0])), String.class);
        instance(String.class, "IndexOf", int.class, (t, a) -> str(t).indexOf(str(a[0])), String.class);
        instance(String.class, "IndexOf", int.class, (t, a) -> str(t).indexOf((Character) a[0]), char.class);
        instance(String.class, "Substring", String.class, (t, a) -> str(t).substring((Integer) a[0]), int.class);
        instance(String.class, "Substring", String.class,
                (t, a) -> str(t).substring((Integer) a[0], (Integer) a[0] + (Integer) a[1]), int.class, int.class);
        instance(String.class, "ToUpper", String.class, (t, a) -> str(t).toUpperCase(Locale.ROOT));
        instance(String.class, "ToLower", String.class, (t, a) -> str(t).toLowerCase(Locale.ROOT));
        instance(String.class, "Trim", String.class, (t, a) -> str(t).trim());
        instance(String.class, "Equals", boolean.class, (t, a) -> str(t).equals(a[0]), String.class);
        instance(String.class, "Replace", String.class,
                (t, a) -> str(t).replace(str(a[0]), str(a[1])), String.class, String.class);
        instance(String.class, "CompareTo", int.class,
                (t, a) -> Integer.signum(str(t).compareTo(str(a[0]))), String.class);
        staticMethod(String.class, "IsNullOrEmpty", boolean.class,
                a -> a[0] == null || ((String) a[0]).isEmpty(), String.class);

        // ========== Math ==========
        staticMethod(Math.class, "Abs", int.class, a -> Math.abs((Integer) a[0]), int.class);
        staticMethod(Math.class, "Abs", long.class, a -> Math.abs((Long) a[0]), long.class);
        staticMethod(Math.class, "Abs", double.class, a -> Math.abs((Double) a[0]), double.class);
        staticMethod(Math.class, "Abs", BigDecimal.class, a -> ((BigDecimal) a[0]).abs(), BigDecimal.class);
        staticMethod(Math.class, "Min", int.class, a -> Math.min((Integer) a[0], (Integer) a[1]), int.class, int.class);
        staticMethod(Math.class, "Min", long.class, a -> Math.min((Long) a[0], (Long) a[1]), long.class, long.class);
        staticMethod(Math.class, "Min", double.class,
                a -> Math.min((Double) a[0], (Double) a[1]), double.class, double.class);
        staticMethod(Math.class, "Min", BigDecimal.class,
                a -> ((BigDecimal) a[0]).min((BigDecimal) a[1]), BigDecimal.class, BigDecimal.class);
        staticMethod(Math.class, "Max", int.class, a -> Math.max((Integer) a[0], (Integer) a[1]), int.class, int.class);
        staticMethod(Math.class, "Max", long.class, a -> Math.max((Long) a[0], (Long) a[1]), long.class, long.class);
        staticMethod(Math.class, "Max", double.class,
                a -> Math.max((Double) a[0], (Double) a[1]), double.class, double.class);
        staticMethod(Math.class, "Max", BigDecimal.class,
                a -> ((BigDecimal) a[0]).max((BigDecimal) a[1]), BigDecimal.class, BigDecimal.class);
        staticMethod(Math.class, "Round", double.class, a -> Math.rint((Double) a[0]), double.class);
        staticMethod(Math.class, "Round", double.class,
                a -> BigDecimal.valueOf((Double) a[0]).setScale((Integer) a[1], RoundingMode.HALF_EVEN).doubleValue(),
                double.class, int.class);
        staticMethod(Math.class, "Round", BigDecimal.class,
                a -> ((BigDecimal) a[0]).setScale(0, RoundingMode.HALF_EVEN), BigDecimal.class);
        staticMethod(Math.class, "Round", BigDecimal.class,
                a -> ((BigDecimal) a[0]).setScale((Integer) a[1], RoundingMode.HALF_EVEN), BigDecimal.class, int.class);
        staticMethod(Math.class, "Floor", double.class, a -> Math.floor((Double) a[0]), double.class);
        staticMethod(Math.class, "Ceiling", double.class, a -> Math.ceil((Double) a[0]), double.class);
        staticMethod(Math.class, "Pow", double.class, a -> Math.pow((Double) a[0], (Double) a[1]), double.class, double.class);
        staticMethod(Math.class, "Sqrt", double.class, a -> Math.sqrt((Double) a[0]), double.class);

        // ========== DateTime ==========
        instance(LocalDateTime.class, "AddYears", LocalDateTime.class, (t, a) -> date(t).plusYears((Integer) a[0]), int.class);
        instance(LocalDateTime.class, "AddMonths", LocalDateTime.class, (t, a) -> date(t).plusMonths((Integer) a[0]), int.class);
        instance(LocalDateTime.class, "AddDays", LocalDateTime.class, (t, a) -> date(t).plusDays((Integer) a[0]), int.class);
        instance(LocalDateTime.class, "AddHours", LocalDateTime.class, (t, a) -> date(t).plusHours((Integer) a[0]), int.class);
        instance(LocalDateTime.class, "AddMinutes", LocalDateTime.class, (t, a) -> date(t).plusMinutes((Integer) a[0]), int.class);
        instance(LocalDateTime.class, "AddSeconds", LocalDateTime.class, (t, a) -> date(t).plusSeconds((Integer) a[0]), int.class);

        // ========== Constructors ==========
        constructor(LocalDateTime.class, a -> LocalDateTime.of((Integer) a[0], (Integer) a[1], (Integer) a[2], 0, 0),
                int.class, int.class, int.class);
        constructor(LocalDateTime.class,
                a -> LocalDateTime.of((Integer) a[0], (Integer) a[1], (Integer) a[2],
                        (Integer) a[3], (Integer) a[4], (Integer) a[5]),
                int.class, int.class, int.class, int.class, int.class, int.class);
        constructor(Duration.class,
                a -> Duration.ofHours((Integer) a[0]).plusMinutes((Integer) a[1]).plusSeconds((Integer) a[2]),
                int.class, int.class, int.class);
        constructor(Duration.class,
                a -> Duration.ofDays((Integer) a[0]).plusHours((Integer) a[1])
                        .plusMinutes((Integer) a[2]).plusSeconds((Integer) a[3]),
                int.class, int.class, int.class, int.class);
        constructor(UUID.class, a -> UUID.fromString((String) a[0]), String.class);
    }

    private BuiltinMethods() {
    }

    /**
     * Instance methods of a type with the given name (case-insensitive). {@code ToString()}
     * is defined on every type.
     */
    public static List<BuiltinMethod> instanceMethods(TypeRef type, String name) {
        String key = name.toLowerCase(Locale.ROOT);
        if (key.equals("tostring")) {
            return List.of(TO_STRING);
        }
        if (!(type instanceof TypeRef.ClassType ct)) {
            return List.of();
        }
        return INSTANCE_METHODS.getOrDefault(Types.unbox(ct.type()), Map.of()).getOrDefault(key, List.of());
    }

    /**
     * Static methods called through a type name, e.g. {@code Math.Abs}.
     */
    public static List<BuiltinMethod> staticMethods(TypeRef type, String name) {
        if (!(type instanceof TypeRef.ClassType ct)) {
            return List.of();
        }
        return STATIC_METHODS.getOrDefault(ct.type(), Map.of())
                .getOrDefault(name.toLowerCase(Locale.ROOT), List.of());
    }

    public static List<BuiltinMethod> constructors(TypeRef type) {
        return staticMethods(type, CONSTRUCTOR);
    }

    // ==================== Registration ====================

    private static void instance(Class<?> type, String name, Class<?> returnType, BuiltinMethod.Invoker invoker,
                                 Class<?>... parameterTypes) {
        register(INSTANCE_METHODS, type,
                new BuiltinMethod(name, false, TypeRef.listOf(parameterTypes), TypeRef.of(returnType), invoker));
    }

    private static void staticMethod(Class<?> type, String name, Class<?> returnType, StaticInvoker invoker,
                                     Class<?>... parameterTypes) {
        register(STATIC_METHODS, type, new BuiltinMethod(name, true, TypeRef.listOf(parameterTypes),
                TypeRef.of(returnType), (target, args) -> invoker.invoke(args)));
    }

    private static void constructor(Class<?> type, StaticInvoker invoker, Class<?>... parameterTypes) {
        register(STATIC_METHODS, type, new BuiltinMethod(CONSTRUCTOR, true, TypeRef.listOf(parameterTypes),
                TypeRef.of(type), (target, args) -> invoker.invoke(args)));
    }

    private static void register(Map<Class<?>, Map<String, List<BuiltinMethod>>> table, Class<?> type,
                                 BuiltinMethod method) {
        table.computeIfAbsent(type, k -> new HashMap<>())
                .computeIfAbsent(method.name().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                .add(method);
    }

    @FunctionalInterface
    private interface StaticInvoker {
        Object invoke(Object[] args);
    }

    private static String str(Object value) {
        return Objects.requireNonNull((String) value, "String argument cannot be null");
    }

    private static LocalDateTime date(Object value) {
        return (LocalDateTime) value;
    }
}
