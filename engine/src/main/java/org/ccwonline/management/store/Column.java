package org.ccwonline.management.store;

import java.util.Objects;

/**
 * Represents a column in a relational table.
 *
 * @param name       The column name
 * @param dataType   The SQL data type (VARCHAR, INTEGER, etc.)
 * @param nullable   Whether the column allows NULL values
 * @param primaryKey Whether the column is the table's key
 */
public record Column(
        String name,
        SqlDataType dataType,
        boolean nullable,
        boolean primaryKey
) {
    public Column {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(dataType, "Column dataType cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
        if (primaryKey && nullable) {
            throw new IllegalArgumentException("Key column '" + name + "' cannot be nullable");
        }
    }

    public static Column required(String name, SqlDataType dataType) {
        return new Column(name, dataType, false, false);
    }

    public static Column nullable(String name, SqlDataType dataType) {
        return new Column(name, dataType, true, false);
    }

    public static Column key(String name, SqlDataType dataType) {
        return new Column(name, dataType, false, true);
    }

    /**
     * @return The column definition as it appears in CREATE TABLE
     */
    public String ddl() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(dataType.sqlName());
        if (primaryKey) {
            sb.append(" PRIMARY KEY");
        } else if (!nullable) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }
}
