package org.ccwonline.management.store;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Represents a physical relational table.
 *
 * @param schema  The database schema (can be empty for default schema)
 * @param name    The table name
 * @param columns Immutable list of columns, at most one of them the key
 */
public record Table(
        String schema,
        String name,
        List<Column> columns
) {
    public Table {
        Objects.requireNonNull(schema, "Schema cannot be null (use empty string for default)");
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " must have at least one column");
        }
        if (columns.stream().filter(Column::primaryKey).count() > 1) {
            throw new IllegalArgumentException("Table " + name + " has more than one key column");
        }

        columns = List.copyOf(columns);
    }

    /**
     * Creates a table in the default schema.
     */
    public Table(String name, List<Column> columns) {
        this("", name, columns);
    }

    /**
     * @return The fully qualified table name (schema.table or just table)
     */
    public String qualifiedName() {
        return schema.isEmpty() ? name : schema + "." + name;
    }

    /**
     * Finds a column by name, ignoring case as SQL does for unquoted names.
     *
     * @param columnName The column name to search for
     * @return Optional containing the column if found
     */
    public Optional<Column> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equalsIgnoreCase(columnName))
                .findFirst();
    }

    /**
     * @throws IllegalArgumentException if column not found
     */
    public Column getColumn(String columnName) {
        return findColumn(columnName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Column '" + columnName + "' not found in table " + qualifiedName()));
    }

    /**
     * @throws IllegalStateException if the table has no key column
     */
    public Column keyColumn() {
        return columns.stream()
                .filter(Column::primaryKey)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Table " + qualifiedName() + " has no key column"));
    }

    public String createTableSql() {
        return columns.stream()
                .map(Column::ddl)
                .collect(Collectors.joining(", ", "CREATE TABLE IF NOT EXISTS " + qualifiedName() + " (", ")"));
    }
}
