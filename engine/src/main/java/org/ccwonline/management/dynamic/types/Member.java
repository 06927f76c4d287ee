package org.ccwonline.management.dynamic.types;

/**
 * A readable property or field resolved against a type.
 */
public interface Member {

    String name();

    TypeRef type();

    boolean isStatic();

    /**
     * Reads the member value.
     *
     * @param instance The target instance, ignored for static members
     * @return The member value
     */
    Object get(Object instance);

    /**
     * @return true if the member is defined on a null instance; otherwise reading it
     *         from null yields null
     */
    default boolean handlesNull() {
        return false;
    }
}
