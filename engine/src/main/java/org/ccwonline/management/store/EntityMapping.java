package org.ccwonline.management.store;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps a record entity type to a table.
 *
 * Every record component becomes a column named after the component with its first
 * letter capitalized ({@code conferenceId} maps to {@code ConferenceId}), in the
 * table named after the record. The key column is the component named {@code id} or
 * {@code <entity>Id}, else the first component.
 *
 * @param <T> The entity type
 */
public final class EntityMapping<T> {

    private final Class<T> entityType;
    private final RecordComponent[] components;
    private final Constructor<T> constructor;
    private final Table table;
    private final int keyIndex;

    private EntityMapping(Class<T> entityType) {
        this.entityType = entityType;
        this.components = entityType.getRecordComponents();
        if (components.length == 0) {
            throw new IllegalArgumentException("Entity " + entityType.getSimpleName() + " has no properties");
        }
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
            components[i].getAccessor().trySetAccessible();
        }
        try {
            this.constructor = entityType.getDeclaredConstructor(parameterTypes);
            this.constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No canonical constructor on " + entityType.getName(), e);
        }
        this.keyIndex = findKey(entityType.getSimpleName(), components);

        List<Column> columns = new ArrayList<>();
        for (int i = 0; i < components.length; i++) {
            Class<?> type = components[i].getType();
            String name = columnName(components[i].getName());
            SqlDataType dataType = SqlDataType.fromJavaType(type);
            if (i == keyIndex) {
                columns.add(Column.key(name, dataType));
            } else if (type.isPrimitive()) {
                columns.add(Column.required(name, dataType));
            } else {
                columns.add(Column.nullable(name, dataType));
            }
        }
        this.table = new Table(entityType.getSimpleName(), columns);
    }

    /**
     * @throws IllegalArgumentException if the type is not a record or a property type has no column type
     */
    public static <T> EntityMapping<T> of(Class<T> entityType) {
        Objects.requireNonNull(entityType, "Entity type cannot be null");
        if (!entityType.isRecord()) {
            throw new IllegalArgumentException("Entity type must be a record: " + entityType.getName());
        }
        return new EntityMapping<>(entityType);
    }

    private static int findKey(String entityName, RecordComponent[] components) {
        String entityKey = entityName + "Id";
        for (int i = 0; i < components.length; i++) {
            String name = components[i].getName();
            if (name.equalsIgnoreCase("id") || name.equalsIgnoreCase(entityKey)) {
                return i;
            }
        }
        return 0;
    }

    static String columnName(String componentName) {
        return Character.toUpperCase(componentName.charAt(0)) + componentName.substring(1);
    }

    // ==================== Metadata ====================

    public Class<T> entityType() {
        return entityType;
    }

    public Table table() {
        return table;
    }

    public Object keyOf(T entity) {
        return valueAt(entity, keyIndex);
    }

    // ==================== SQL ====================

    public String insertSql() {
        String names = table.columns().stream().map(Column::name).collect(Collectors.joining(", "));
        String marks = table.columns().stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + table.qualifiedName() + " (" + names + ") VALUES (" + marks + ")";
    }

    /**
     * Updates every non-key column; the key is the last parameter.
     */
    public String updateSql() {
        List<String> assignments = new ArrayList<>();
        for (int i = 0; i < components.length; i++) {
            if (i != keyIndex) {
                assignments.add(table.columns().get(i).name() + " = ?");
            }
        }
        if (assignments.isEmpty()) {
            return null;
        }
        return "UPDATE " + table.qualifiedName() + " SET " + String.join(", ", assignments)
                + " WHERE " + table.keyColumn().name() + " = ?";
    }

    public String deleteByKeySql() {
        return "DELETE FROM " + table.qualifiedName() + " WHERE " + table.keyColumn().name() + " = ?";
    }

    public String selectSql() {
        String names = table.columns().stream().map(Column::name).collect(Collectors.joining(", "));
        return "SELECT " + names + " FROM " + table.qualifiedName();
    }

    // ==================== Binding ====================

    public void bindInsert(PreparedStatement statement, T entity) throws SQLException {
        for (int i = 0; i < components.length; i++) {
            bind(statement, i + 1, valueAt(entity, i));
        }
    }

    public void bindUpdate(PreparedStatement statement, T entity) throws SQLException {
        int index = 1;
        for (int i = 0; i < components.length; i++) {
            if (i != keyIndex) {
                bind(statement, index++, valueAt(entity, i));
            }
        }
        bind(statement, index, keyOf(entity));
    }

    public static void bind(PreparedStatement statement, int index, Object value) throws SQLException {
        if (value instanceof Enum<?> e) {
            statement.setString(index, e.name());
        } else if (value instanceof Character c) {
            statement.setString(index, c.toString());
        } else if (value instanceof UUID uuid) {
            statement.setString(index, uuid.toString());
        } else if (value instanceof LocalDateTime dateTime) {
            statement.setTimestamp(index, Timestamp.valueOf(dateTime));
        } else if (value instanceof LocalDate date) {
            statement.setDate(index, Date.valueOf(date));
        } else {
            statement.setObject(index, value);
        }
    }

    private Object valueAt(T entity, int index) {
        try {
            return components[index].getAccessor().invoke(entity);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read " + components[index].getName()
                    + " of " + entityType.getSimpleName(), e);
        }
    }

    // ==================== Row Mapping ====================

    /**
     * Maps the current row to an entity. Columns are matched by name ignoring case;
     * entity properties without a column in the row receive their default value.
     */
    public T map(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Integer> byName = new HashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            byName.putIfAbsent(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), i);
        }
        Object[] args = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            Class<?> type = components[i].getType();
            Integer column = byName.get(table.columns().get(i).name().toLowerCase(Locale.ROOT));
            Object value = column == null ? null : rs.getObject(column);
            args[i] = toJava(value, type);
        }
        try {
            return constructor.newInstance(args);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot create " + entityType.getSimpleName(), e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Cannot create " + entityType.getSimpleName(), e.getCause());
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static Object toJava(Object value, Class<?> type) {
        if (value == null) {
            return defaultValue(type);
        }
        if (type.isInstance(value)) {
            return value;
        }
        if (type.isEnum()) {
            return Enum.valueOf((Class) type, value.toString());
        }
        if (type == UUID.class) {
            return value instanceof UUID ? value : UUID.fromString(value.toString());
        }
        if (type == char.class || type == Character.class) {
            return value.toString().charAt(0);
        }
        if (type == LocalDateTime.class) {
            if (value instanceof Timestamp ts) {
                return ts.toLocalDateTime();
            }
            if (value instanceof OffsetDateTime odt) {
                return odt.toLocalDateTime();
            }
            return LocalDateTime.parse(value.toString().replace(' ', 'T'));
        }
        if (type == LocalDate.class) {
            if (value instanceof Date date) {
                return date.toLocalDate();
            }
            return LocalDate.parse(value.toString());
        }
        if (type == boolean.class || type == Boolean.class) {
            if (value instanceof Number n) {
                return n.intValue() != 0;
            }
            return Boolean.parseBoolean(value.toString());
        }
        if (value instanceof Number n) {
            if (type == int.class || type == Integer.class) {
                return n.intValue();
            }
            if (type == long.class || type == Long.class) {
                return n.longValue();
            }
            if (type == short.class || type == Short.class) {
                return n.shortValue();
            }
            if (type == byte.class || type == Byte.class) {
                return n.byteValue();
            }
            if (type == double.class || type == Double.class) {
                return n.doubleValue();
            }
            if (type == float.class || type == Float.class) {
                return n.floatValue();
            }
            if (type == BigDecimal.class) {
                return new BigDecimal(n.toString());
            }
        }
        if (type == String.class) {
            return value.toString();
        }
        throw new IllegalStateException("Cannot map " + value.getClass().getSimpleName()
                + " to " + type.getSimpleName());
    }

    private static Object defaultValue(Class<?> type) {
        if (!type.isPrimitive()) {
            return null;
        }
        if (type == boolean.class) {
            return false;
        }
        if (type == char.class) {
            return '\0';
        }
        if (type == long.class) {
            return 0L;
        }
        if (type == double.class) {
            return 0d;
        }
        if (type == float.class) {
            return 0f;
        }
        if (type == short.class) {
            return (short) 0;
        }
        if (type == byte.class) {
            return (byte) 0;
        }
        return 0;
    }
}
