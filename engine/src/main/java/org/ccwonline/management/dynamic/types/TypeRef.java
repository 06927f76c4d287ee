package org.ccwonline.management.dynamic.types;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Static type of an expression node.
 *
 * Nullability follows the Java class: a primitive ({@code int}) is a
 * non-nullable value, its wrapper ({@code Integer}) is the nullable form.
 *
 * <pre>
 *   ClassType     int, Integer, String, Conference, ...
 *   SequenceType  List&lt;Attendee&gt;, Attendee[], new[] { ... }
 *   RecordType    dynamic projection shape from ClassFactory
 * </pre>
 */
public sealed interface TypeRef permits TypeRef.ClassType, TypeRef.SequenceType, RecordType {

    String typeName();

    /**
     * @return The Java class values of this type are instances of (boxed for primitives)
     */
    Class<?> runtimeClass();

    /**
     * A plain Java class, primitive or reference.
     */
    record ClassType(Class<?> type) implements TypeRef {
        public ClassType {
            Objects.requireNonNull(type, "Type cannot be null");
        }

        @Override
        public String typeName() {
            return Types.displayName(type);
        }

        @Override
        public Class<?> runtimeClass() {
            return Types.box(type);
        }

        @Override
        public String toString() {
            return typeName();
        }
    }

    /**
     * An enumerable sequence; values are {@link Iterable}s or Java arrays.
     */
    record SequenceType(TypeRef elementType) implements TypeRef {
        public SequenceType {
            Objects.requireNonNull(elementType, "Element type cannot be null");
        }

        @Override
        public String typeName() {
            return "IEnumerable<" + elementType.typeName() + ">";
        }

        @Override
        public Class<?> runtimeClass() {
            return Iterable.class;
        }

        @Override
        public String toString() {
            return typeName();
        }
    }

    // ========== Constants ==========

    TypeRef OBJECT = new ClassType(Object.class);
    TypeRef BOOLEAN = new ClassType(boolean.class);
    TypeRef INT = new ClassType(int.class);
    TypeRef STRING = new ClassType(String.class);

    // ========== Factory methods ==========

    static TypeRef of(Class<?> type) {
        if (type.isArray()) {
            return new SequenceType(of(type.getComponentType()));
        }
        return new ClassType(type);
    }

    static TypeRef sequenceOf(TypeRef elementType) {
        return new SequenceType(elementType);
    }

    /**
     * Converts a reflected member type, keeping the element type of collections.
     */
    static TypeRef fromGeneric(Type type) {
        if (type instanceof Class<?> c) {
            if (Iterable.class.isAssignableFrom(c)) {
                return new SequenceType(OBJECT);
            }
            return of(c);
        }
        if (type instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> raw) {
            if (Iterable.class.isAssignableFrom(raw)) {
                Type[] args = pt.getActualTypeArguments();
                return new SequenceType(args.length == 1 ? fromGeneric(args[0]) : OBJECT);
            }
            return of(raw);
        }
        if (type instanceof GenericArrayType gat) {
            return new SequenceType(fromGeneric(gat.getGenericComponentType()));
        }
        if (type instanceof WildcardType wt && wt.getUpperBounds().length == 1) {
            return fromGeneric(wt.getUpperBounds()[0]);
        }
        return OBJECT;
    }

    /**
     * @return The element type if this is a sequence, null otherwise
     */
    static TypeRef elementTypeOf(TypeRef type) {
        if (type instanceof SequenceType st) {
            return st.elementType();
        }
        if (type instanceof ClassType ct && Collection.class.isAssignableFrom(ct.type())) {
            return OBJECT;
        }
        return null;
    }

    static List<TypeRef> listOf(Class<?>... types) {
        return java.util.Arrays.stream(types).map(TypeRef::of).toList();
    }
}
