package org.ccwonline.management.dynamic.types;

import org.ccwonline.management.dynamic.classes.DynamicClass;
import org.ccwonline.management.dynamic.classes.DynamicProperty;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Schema of a dynamically created record type.
 *
 * Instances are {@link DynamicClass} property bags. Types are created and cached by
 * {@code ClassFactory}; two record types are the same type only if they are the same
 * instance, so identity equality is intended.
 */
public final class RecordType implements TypeRef {

    private final String name;
    private final List<DynamicProperty> properties;
    private final Map<String, Integer> indexByName;

    public RecordType(String name, List<DynamicProperty> properties) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.properties = List.copyOf(properties);
        this.indexByName = new HashMap<>();
        for (int i = 0; i < this.properties.size(); i++) {
            String key = this.properties.get(i).name().toLowerCase(Locale.ROOT);
            if (indexByName.put(key, i) != null) {
                throw new IllegalArgumentException("Duplicate property '" + this.properties.get(i).name() + "'");
            }
        }
    }

    @Override
    public String typeName() {
        return name;
    }

    @Override
    public Class<?> runtimeClass() {
        return DynamicClass.class;
    }

    public List<DynamicProperty> properties() {
        return properties;
    }

    /**
     * Case-insensitive property lookup.
     */
    public Optional<DynamicProperty> findProperty(String propertyName) {
        Integer index = indexByName.get(propertyName.toLowerCase(Locale.ROOT));
        return index == null ? Optional.empty() : Optional.of(properties.get(index));
    }

    /**
     * @return The index of the property, or -1 if absent
     */
    public int indexOf(String propertyName) {
        return indexByName.getOrDefault(propertyName.toLowerCase(Locale.ROOT), -1);
    }

    /**
     * Creates an instance with every property at its zero value.
     */
    public DynamicClass newInstance() {
        return new DynamicClass(this);
    }

    /**
     * Creates an instance from values given in property order.
     */
    public DynamicClass newInstance(Object... values) {
        DynamicClass instance = new DynamicClass(this);
        for (int i = 0; i < values.length; i++) {
            instance.set(i, values[i]);
        }
        return instance;
    }

    @Override
    public String toString() {
        return name + properties;
    }
}
