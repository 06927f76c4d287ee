package org.ccwonline.management.dynamic;

import org.ccwonline.management.dynamic.classes.ClassFactory;
import org.ccwonline.management.dynamic.classes.DynamicClass;
import org.ccwonline.management.dynamic.classes.DynamicProperty;
import org.ccwonline.management.dynamic.compiler.CompiledLambda;
import org.ccwonline.management.dynamic.types.RecordType;
import org.ccwonline.management.dynamic.types.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory query pipeline driven by textual expressions.
 *
 * <pre>
 *   DynamicQueryable.of(Conference.class, conferences)
 *       .where("ConferenceId &lt; @0", 100)
 *       .orderBy("Status, ConferenceId desc")
 *       .select("new(ConferenceId, Name)")
 *       .toList();
 * </pre>
 *
 * Every step returns a new queryable; the source is never modified.
 */
public final class DynamicQueryable {

    private static final Logger logger = LoggerFactory.getLogger(DynamicQueryable.class);

    private final List<Object> elements;
    private final TypeRef elementType;

    private DynamicQueryable(List<Object> elements, TypeRef elementType) {
        this.elements = elements;
        this.elementType = elementType;
    }

    public static DynamicQueryable of(Class<?> elementType, Iterable<?> source) {
        return of(TypeRef.of(elementType), source);
    }

    public static DynamicQueryable of(TypeRef elementType, Iterable<?> source) {
        Objects.requireNonNull(elementType, "Element type cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
        List<Object> elements = new ArrayList<>();
        source.forEach(elements::add);
        return new DynamicQueryable(elements, elementType);
    }

    public static DynamicQueryable of(Class<?> elementType, Stream<?> source) {
        return new DynamicQueryable(source.collect(Collectors.toList()), TypeRef.of(elementType));
    }

    public TypeRef elementType() {
        return elementType;
    }

    // ==================== Operators ====================

    public DynamicQueryable where(String predicate, Object... values) {
        Predicate<Object> test = DynamicExpression.compile(
                DynamicExpression.parsePredicateLambda(elementType, predicate, values)).asPredicate();
        logger.debug("where {}", predicate);
        return new DynamicQueryable(elements.stream().filter(test).collect(Collectors.toList()), elementType);
    }

    public DynamicQueryable select(String selector, Object... values) {
        CompiledLambda lambda = DynamicExpression.parseSelector(elementType, selector, values);
        logger.debug("select {}", selector);
        List<Object> projected = new ArrayList<>(elements.size());
        for (Object element : elements) {
            projected.add(lambda.invoke(element));
        }
        return new DynamicQueryable(projected, lambda.returnType());
    }

    /**
     * Stable multi-key sort.
     */
    public DynamicQueryable orderBy(String ordering, Object... values) {
        Comparator<Object> comparator = DynamicExpression.parseComparator(elementType, ordering, values);
        logger.debug("orderBy {}", ordering);
        List<Object> sorted = new ArrayList<>(elements);
        sorted.sort(comparator);
        return new DynamicQueryable(sorted, elementType);
    }

    public DynamicQueryable skip(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must be non-negative: " + count);
        }
        int from = Math.min(count, elements.size());
        return new DynamicQueryable(new ArrayList<>(elements.subList(from, elements.size())), elementType);
    }

    public DynamicQueryable take(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must be non-negative: " + count);
        }
        int to = Math.min(count, elements.size());
        return new DynamicQueryable(new ArrayList<>(elements.subList(0, to)), elementType);
    }

    /**
     * Groups elements by key, in order of first appearance. Each group is a dynamic
     * record with a {@code Key} property and an {@code Items} sequence.
     *
     * @param keySelector     The grouping key
     * @param elementSelector The projection of grouped elements, e.g. {@code "it"}
     */
    public DynamicQueryable groupBy(String keySelector, String elementSelector, Object... values) {
        CompiledLambda key = DynamicExpression.parseSelector(elementType, keySelector, values);
        CompiledLambda item = DynamicExpression.parseSelector(elementType, elementSelector, values);
        Map<Object, List<Object>> groups = new LinkedHashMap<>();
        for (Object element : elements) {
            groups.computeIfAbsent(key.invoke(element), k -> new ArrayList<>()).add(item.invoke(element));
        }
        RecordType groupType = ClassFactory.instance().getDynamicClass(List.of(
                new DynamicProperty("Key", key.returnType()),
                new DynamicProperty("Items", TypeRef.sequenceOf(item.returnType()))));
        List<Object> result = new ArrayList<>(groups.size());
        for (Map.Entry<Object, List<Object>> group : groups.entrySet()) {
            result.add(newGroup(groupType, group.getKey(), group.getValue()));
        }
        logger.debug("groupBy {} produced {} group(s)", keySelector, result.size());
        return new DynamicQueryable(result, groupType);
    }

    public DynamicQueryable groupBy(String keySelector) {
        return groupBy(keySelector, "it");
    }

    private static Object newGroup(RecordType groupType, Object key, List<Object> items) {
        DynamicClass group = groupType.newInstance();
        group.set("Key", key);
        group.set("Items", Collections.unmodifiableList(items));
        return group;
    }

    // ==================== Terminal Operations ====================

    public boolean any() {
        return !elements.isEmpty();
    }

    public boolean any(String predicate, Object... values) {
        return where(predicate, values).any();
    }

    public int count() {
        return elements.size();
    }

    public int count(String predicate, Object... values) {
        return where(predicate, values).count();
    }

    /**
     * @return The elements; may contain nulls
     */
    public List<Object> toList() {
        return Collections.unmodifiableList(elements);
    }

    @SuppressWarnings("unchecked")
    public <R> List<R> toList(Class<R> type) {
        List<R> result = new ArrayList<>(elements.size());
        for (Object element : elements) {
            result.add(element == null ? null : (R) type.cast(element));
        }
        return result;
    }

    public Stream<Object> stream() {
        return elements.stream();
    }
}
