package org.ccwonline.management.store;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Represents SQL data types for relational columns.
 */
public enum SqlDataType {
    VARCHAR,
    SMALLINT,
    INTEGER,
    BIGINT,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    REAL,
    DOUBLE,
    DECIMAL,
    UUID;

    /**
     * @return The type name as written in DDL
     */
    public String sqlName() {
        return switch (this) {
            case DECIMAL -> "DECIMAL(28, 10)";
            case UUID -> "VARCHAR(36)";
            default -> name();
        };
    }

    /**
     * Maps a Java property type to its SQL type.
     *
     * @param javaType The property type, primitive or boxed
     * @return The corresponding SQL data type
     * @throws IllegalArgumentException if the type has no column mapping
     */
    public static SqlDataType fromJavaType(Class<?> javaType) {
        if (javaType == String.class || javaType == char.class || javaType == Character.class
                || javaType.isEnum()) {
            return VARCHAR;
        }
        if (javaType == byte.class || javaType == Byte.class
                || javaType == short.class || javaType == Short.class) {
            return SMALLINT;
        }
        if (javaType == int.class || javaType == Integer.class) {
            return INTEGER;
        }
        if (javaType == long.class || javaType == Long.class) {
            return BIGINT;
        }
        if (javaType == boolean.class || javaType == Boolean.class) {
            return BOOLEAN;
        }
        if (javaType == float.class || javaType == Float.class) {
            return REAL;
        }
        if (javaType == double.class || javaType == Double.class) {
            return DOUBLE;
        }
        if (javaType == BigDecimal.class) {
            return DECIMAL;
        }
        if (javaType == LocalDate.class) {
            return DATE;
        }
        if (javaType == LocalDateTime.class) {
            return TIMESTAMP;
        }
        if (javaType == java.util.UUID.class) {
            return UUID;
        }
        throw new IllegalArgumentException("No SQL type for " + javaType.getName());
    }
}
