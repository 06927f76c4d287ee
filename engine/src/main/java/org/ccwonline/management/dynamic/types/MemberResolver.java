package org.ccwonline.management.dynamic.types;

import org.ccwonline.management.dynamic.classes.DynamicClass;
import org.ccwonline.management.dynamic.classes.DynamicProperty;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves member names against types, case-insensitively.
 *
 * Resolution order for a Java class: built-in members of predefined types, record
 * components, JavaBean getters ({@code getX}/{@code isX}), public fields.
 */
public final class MemberResolver {

    private static final Map<Class<?>, Map<String, Member>> REFLECTED = new ConcurrentHashMap<>();
    private static final Map<Class<?>, Map<String, Member>> INSTANCE_BUILTINS = new HashMap<>();
    private static final Map<Class<?>, Map<String, Member>> STATIC_BUILTINS = new HashMap<>();

    static {
        instance(String.class, "Length", int.class, s -> ((String) s).length());

        instance(LocalDateTime.class, "Year", int.class, d -> ((LocalDateTime) d).getYear());
        instance(LocalDateTime.class, "Month", int.class, d -> ((LocalDateTime) d).getMonthValue());
        instance(LocalDateTime.class, "Day", int.class, d -> ((LocalDateTime) d).getDayOfMonth());
        instance(LocalDateTime.class, "Hour", int.class, d -> ((LocalDateTime) d).getHour());
        instance(LocalDateTime.class, "Minute", int.class, d -> ((LocalDateTime) d).getMinute());
        instance(LocalDateTime.class, "Second", int.class, d -> ((LocalDateTime) d).getSecond());
        instance(LocalDateTime.class, "DayOfYear", int.class, d -> ((LocalDateTime) d).getDayOfYear());
        instance(LocalDateTime.class, "Date", LocalDateTime.class, d -> ((LocalDateTime) d).truncatedTo(ChronoUnit.DAYS));

        instance(Duration.class, "Days", int.class, t -> (int) ((Duration) t).toDays());
        instance(Duration.class, "Hours", int.class, t -> ((Duration) t).toHoursPart());
        instance(Duration.class, "Minutes", int.class, t -> ((Duration) t).toMinutesPart());
        instance(Duration.class, "Seconds", int.class, t -> ((Duration) t).toSecondsPart());
        instance(Duration.class, "TotalDays", double.class, t -> ((Duration) t).toMillis() / 86_400_000d);
        instance(Duration.class, "TotalHours", double.class, t -> ((Duration) t).toMillis() / 3_600_000d);
        instance(Duration.class, "TotalMinutes", double.class, t -> ((Duration) t).toMillis() / 60_000d);
        instance(Duration.class, "TotalSeconds", double.class, t -> ((Duration) t).toMillis() / 1_000d);
        instance(Duration.class, "TotalMilliseconds", double.class, t -> (double) ((Duration) t).toMillis());

        staticMember(LocalDateTime.class, "Now", LocalDateTime.class, LocalDateTime::now);
        staticMember(LocalDateTime.class, "Today", LocalDateTime.class, () -> LocalDateTime.now().truncatedTo(ChronoUnit.DAYS));
        staticMember(LocalDateTime.class, "MinValue", LocalDateTime.class, () -> LocalDateTime.of(1, 1, 1, 0, 0));
        staticMember(LocalDateTime.class, "MaxValue", LocalDateTime.class, () -> LocalDateTime.of(9999, 12, 31, 23, 59, 59, 999_999_999));
        staticMember(Duration.class, "Zero", Duration.class, () -> Duration.ZERO);
        staticMember(String.class, "Empty", String.class, () -> "");
        staticMember(UUID.class, "Empty", UUID.class, () -> new UUID(0L, 0L));
        staticMember(byte.class, "MaxValue", byte.class, () -> Byte.MAX_VALUE);
        staticMember(byte.class, "MinValue", byte.class, () -> Byte.MIN_VALUE);
        staticMember(short.class, "MaxValue", short.class, () -> Short.MAX_VALUE);
        staticMember(short.class, "MinValue", short.class, () -> Short.MIN_VALUE);
        staticMember(int.class, "MaxValue", int.class, () -> Integer.MAX_VALUE);
        staticMember(int.class, "MinValue", int.class, () -> Integer.MIN_VALUE);
        staticMember(long.class, "MaxValue", long.class, () -> Long.MAX_VALUE);
        staticMember(long.class, "MinValue", long.class, () -> Long.MIN_VALUE);
        staticMember(double.class, "MaxValue", double.class, () -> Double.MAX_VALUE);
        staticMember(double.class, "MinValue", double.class, () -> -Double.MAX_VALUE);
        staticMember(float.class, "MaxValue", float.class, () -> Float.MAX_VALUE);
        staticMember(float.class, "MinValue", float.class, () -> -Float.MAX_VALUE);
        staticMember(BigDecimal.class, "Zero", BigDecimal.class, () -> BigDecimal.ZERO);
        staticMember(BigDecimal.class, "One", BigDecimal.class, () -> BigDecimal.ONE);
        staticMember(Math.class, "PI", double.class, () -> Math.PI);
        staticMember(Math.class, "E", double.class, () -> Math.E);
    }

    private MemberResolver() {
    }

    /**
     * Finds a member by name.
     *
     * @param type         The type to search
     * @param name         The member name, matched case-insensitively
     * @param staticAccess true when accessed through a type name rather than an instance
     * @return The member, or empty if none matches
     */
    public static Optional<Member> find(TypeRef type, String name, boolean staticAccess) {
        String key = name.toLowerCase(Locale.ROOT);
        if (type instanceof RecordType recordType) {
            return staticAccess ? Optional.empty() : findRecordProperty(recordType, name);
        }
        if (type instanceof TypeRef.SequenceType) {
            return staticAccess ? Optional.empty() : sequenceCount(key);
        }
        Class<?> c = ((TypeRef.ClassType) type).type();
        if (staticAccess) {
            return Optional.ofNullable(STATIC_BUILTINS.getOrDefault(c, Map.of()).get(key));
        }
        Member builtin = INSTANCE_BUILTINS.getOrDefault(Types.unbox(c), Map.of()).get(key);
        if (builtin != null) {
            return Optional.of(builtin);
        }
        if (Types.unbox(c) != c) {
            return nullableMember(c, key);
        }
        if (Collection.class.isAssignableFrom(c)) {
            return sequenceCount(key);
        }
        return Optional.ofNullable(reflect(c).get(key));
    }

    private static Optional<Member> findRecordProperty(RecordType type, String name) {
        Optional<DynamicProperty> property = type.findProperty(name);
        if (property.isEmpty()) {
            return Optional.empty();
        }
        int index = type.indexOf(name);
        DynamicProperty p = property.get();
        return Optional.of(new RecordPropertyMember(p.name(), p.type(), index));
    }

    private static Optional<Member> sequenceCount(String key) {
        if (key.equals("count") || key.equals("length")) {
            return Optional.of(new BuiltinMember(key.equals("count") ? "Count" : "Length", TypeRef.INT, false,
                    MemberResolver::sizeOf));
        }
        return Optional.empty();
    }

    private static Optional<Member> nullableMember(Class<?> boxed, String key) {
        return switch (key) {
            case "hasvalue" -> Optional.of(new NullableMember("HasValue", TypeRef.BOOLEAN));
            case "value" -> Optional.of(new NullableMember("Value", TypeRef.of(Types.unbox(boxed))));
            default -> Optional.empty();
        };
    }

    private static Object sizeOf(Object sequence) {
        if (sequence instanceof Collection<?> collection) {
            return collection.size();
        }
        if (sequence.getClass().isArray()) {
            return Array.getLength(sequence);
        }
        int count = 0;
        for (Object ignored : (Iterable<?>) sequence) {
            count++;
        }
        return count;
    }

    // ==================== Reflection ====================

    private static Map<String, Member> reflect(Class<?> type) {
        return REFLECTED.computeIfAbsent(type, MemberResolver::scan);
    }

    private static Map<String, Member> scan(Class<?> type) {
        Map<String, Member> members = new HashMap<>();
        for (Field field : type.getFields()) {
            if (!Modifier.isStatic(field.getModifiers())) {
                members.put(field.getName().toLowerCase(Locale.ROOT), new FieldMember(field));
            }
        }
        for (Method method : type.getMethods()) {
            if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 0
                    || method.getDeclaringClass() == Object.class) {
                continue;
            }
            String propertyName = beanPropertyName(method);
            if (propertyName != null) {
                members.put(propertyName.toLowerCase(Locale.ROOT), new GetterMember(propertyName, method));
            }
        }
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                members.put(component.getName().toLowerCase(Locale.ROOT),
                        new GetterMember(component.getName(), component.getAccessor()));
            }
        }
        return Map.copyOf(members);
    }

    private static String beanPropertyName(Method method) {
        String name = method.getName();
        if (name.startsWith("get") && name.length() > 3 && method.getReturnType() != void.class) {
            return name.substring(3);
        }
        if (name.startsWith("is") && name.length() > 2
                && Types.unbox(method.getReturnType()) == boolean.class) {
            return name.substring(2);
        }
        return null;
    }

    // ==================== Member implementations ====================

    private record GetterMember(String name, Method getter) implements Member {
        GetterMember {
            getter.trySetAccessible();
        }

        @Override
        public TypeRef type() {
            return TypeRef.fromGeneric(getter.getGenericReturnType());
        }

        @Override
        public boolean isStatic() {
            return false;
        }

        @Override
        public Object get(Object instance) {
            try {
                return getter.invoke(instance);
            } catch (InvocationTargetException e) {
                throw rethrow(e.getCause());
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read member '" + name + "'", e);
            }
        }
    }

    private record FieldMember(Field field) implements Member {
        @Override
        public String name() {
            return field.getName();
        }

        @Override
        public TypeRef type() {
            return TypeRef.fromGeneric(field.getGenericType());
        }

        @Override
        public boolean isStatic() {
            return false;
        }

        @Override
        public Object get(Object instance) {
            try {
                return field.get(instance);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read field '" + field.getName() + "'", e);
            }
        }
    }

    private record RecordPropertyMember(String name, TypeRef type, int index) implements Member {
        @Override
        public boolean isStatic() {
            return false;
        }

        @Override
        public Object get(Object instance) {
            return ((DynamicClass) instance).get(index);
        }
    }

    private record BuiltinMember(String name, TypeRef type, boolean isStatic, Function<Object, Object> reader)
            implements Member {
        @Override
        public Object get(Object instance) {
            return reader.apply(instance);
        }
    }

    private record NullableMember(String name, TypeRef type) implements Member {
        @Override
        public boolean isStatic() {
            return false;
        }

        @Override
        public boolean handlesNull() {
            return true;
        }

        @Override
        public Object get(Object instance) {
            if (name.equals("HasValue")) {
                return instance != null;
            }
            if (instance == null) {
                throw new IllegalStateException("Nullable object must have a value");
            }
            return instance;
        }
    }

    private static void instance(Class<?> type, String name, Class<?> resultType, Function<Object, Object> reader) {
        INSTANCE_BUILTINS.computeIfAbsent(type, k -> new HashMap<>())
                .put(name.toLowerCase(Locale.ROOT), new BuiltinMember(name, TypeRef.of(resultType), false, reader));
    }

    private static void staticMember(Class<?> type, String name, Class<?> resultType,
                                     Supplier<Object> supplier) {
        STATIC_BUILTINS.computeIfAbsent(type, k -> new HashMap<>())
                .put(name.toLowerCase(Locale.ROOT), new BuiltinMember(name, TypeRef.of(resultType), true,
                        ignored -> supplier.get()));
    }

    static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(cause);
    }
}
