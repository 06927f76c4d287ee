package org.ccwonline.management.dynamic.classes;

import org.ccwonline.management.dynamic.types.RecordType;
import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Instance of a dynamic record type: an ordered property bag described by a {@link RecordType}.
 *
 * Equality is structural (same type, equal values). The hash code is the XOR of the
 * property value hashes.
 */
public final class DynamicClass {

    private static final Map<Class<?>, Object> ZERO_VALUES = Map.of(
            boolean.class, false,
            char.class, '\0',
            byte.class, (byte) 0,
            short.class, (short) 0,
            int.class, 0,
            long.class, 0L,
            float.class, 0f,
            double.class, 0d);

    private final RecordType type;
    private final Object[] values;

    public DynamicClass(RecordType type) {
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.values = new Object[type.properties().size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = zeroValue(type.properties().get(i).type());
        }
    }

    public RecordType type() {
        return type;
    }

    public Object get(int index) {
        return values[index];
    }

    public Object get(String propertyName) {
        return values[requireIndex(propertyName)];
    }

    public void set(int index, Object value) {
        DynamicProperty property = type.properties().get(index);
        if (value == null) {
            values[index] = zeroValue(property.type());
            return;
        }
        Class<?> expected = property.type().runtimeClass();
        if (!expected.isInstance(value) && !(expected == Iterable.class && value.getClass().isArray())) {
            throw new IllegalArgumentException("Property '" + property.name() + "' of type '"
                    + property.type().typeName() + "' cannot hold a value of type " + value.getClass().getSimpleName());
        }
        values[index] = value;
    }

    public void set(String propertyName, Object value) {
        set(requireIndex(propertyName), value);
    }

    /**
     * @return The property values keyed by property name, in declaration order
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(type.properties().get(i).name(), values[i]);
        }
        return map;
    }

    private int requireIndex(String propertyName) {
        int index = type.indexOf(propertyName);
        if (index < 0) {
            throw new IllegalArgumentException("No property '" + propertyName + "' in " + type.typeName());
        }
        return index;
    }

    static Object zeroValue(TypeRef type) {
        if (type instanceof TypeRef.ClassType ct && ct.type().isPrimitive()) {
            return ZERO_VALUES.get(ct.type());
        }
        return null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DynamicClass other)) return false;
        if (type != other.type) return false;
        for (int i = 0; i < values.length; i++) {
            if (!Objects.equals(values[i], other.values[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Object value : values) {
            h ^= Objects.hashCode(value);
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(type.properties().get(i).name()).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }
}
