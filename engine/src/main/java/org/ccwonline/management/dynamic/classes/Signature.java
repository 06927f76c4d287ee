package org.ccwonline.management.dynamic.classes;

import java.util.Comparator;
import java.util.List;

/**
 * Structural identity of a dynamic record type: the set of (name, type) pairs.
 *
 * Properties are kept sorted by name so that equality and hashing agree and neither
 * depends on declaration order. The hash is the XOR of the per-property hashes.
 */
public final class Signature {

    private static final Comparator<DynamicProperty> BY_NAME = Comparator.comparing(DynamicProperty::name);

    private final List<DynamicProperty> properties;
    private final int hashCode;

    public Signature(List<DynamicProperty> properties) {
        this.properties = properties.stream().sorted(BY_NAME).toList();
        int h = 0;
        for (DynamicProperty p : this.properties) {
            h ^= p.name().hashCode() ^ p.type().hashCode();
        }
        this.hashCode = h;
    }

    public List<DynamicProperty> properties() {
        return properties;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Signature other)) return false;
        if (properties.size() != other.properties.size()) return false;
        for (int i = 0; i < properties.size(); i++) {
            DynamicProperty a = properties.get(i);
            DynamicProperty b = other.properties.get(i);
            if (!a.name().equals(b.name()) || !a.type().equals(b.type())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
