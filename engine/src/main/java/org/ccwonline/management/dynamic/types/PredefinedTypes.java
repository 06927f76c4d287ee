package org.ccwonline.management.dynamic.types;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Type names usable in expression text, for static access ({@code DateTime.Now}),
 * conversions ({@code Int64(Count)}) and constructors ({@code DateTime(2024, 1, 31)}).
 */
public final class PredefinedTypes {

    private static final Map<String, TypeRef> TYPES = new HashMap<>();

    static {
        register(Object.class, "Object", "object");
        register(boolean.class, "Boolean", "bool");
        register(char.class, "Char", "char");
        register(String.class, "String", "string");
        register(byte.class, "Byte", "byte");
        register(short.class, "Int16", "short");
        register(int.class, "Int32", "int");
        register(long.class, "Int64", "long");
        register(float.class, "Single", "float");
        register(double.class, "Double", "double");
        register(BigDecimal.class, "Decimal", "decimal");
        register(LocalDateTime.class, "DateTime");
        register(Duration.class, "TimeSpan");
        register(UUID.class, "Guid");
        register(Math.class, "Math");
    }

    private PredefinedTypes() {
    }

    private static void register(Class<?> type, String... names) {
        for (String name : names) {
            TYPES.put(name.toLowerCase(Locale.ROOT), TypeRef.of(type));
        }
    }

    /**
     * Case-insensitive lookup of a type name or alias.
     */
    public static Optional<TypeRef> find(String name) {
        return Optional.ofNullable(TYPES.get(name.toLowerCase(Locale.ROOT)));
    }
}
