package org.ccwonline.management.dynamic.classes;

import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.Objects;

/**
 * A named, typed property of a dynamic record type.
 *
 * @param name The property name
 * @param type The property type
 */
public record DynamicProperty(String name, TypeRef type) {

    public DynamicProperty {
        Objects.requireNonNull(name, "Property name cannot be null");
        Objects.requireNonNull(type, "Property type cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Property name cannot be blank");
        }
    }

    public static DynamicProperty of(String name, Class<?> type) {
        return new DynamicProperty(name, TypeRef.of(type));
    }

    @Override
    public String toString() {
        return name + ": " + type.typeName();
    }
}
