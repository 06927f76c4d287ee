package org.ccwonline.management.dynamic.classes;

import org.ccwonline.management.dynamic.types.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates dynamic record types on demand and caches them by structural signature.
 *
 * Lookups are lock-free. A miss synthesizes the type inside
 * {@link ConcurrentHashMap#computeIfAbsent}, so concurrent requests for the same missing
 * signature observe exactly one type. Entries are never evicted.
 */
public final class ClassFactory {

    private static final Logger logger = LoggerFactory.getLogger(ClassFactory.class);

    private static final ClassFactory INSTANCE = new ClassFactory();

    private final Map<Signature, RecordType> classes = new ConcurrentHashMap<>();
    private final AtomicInteger classCount = new AtomicInteger();

    ClassFactory() {
    }

    public static ClassFactory instance() {
        return INSTANCE;
    }

    /**
     * Returns the record type for the given properties, creating it on first use.
     *
     * @param properties The (name, type) pairs; order does not affect identity
     * @return The shared record type for this signature
     */
    public RecordType getDynamicClass(List<DynamicProperty> properties) {
        Objects.requireNonNull(properties, "Properties cannot be null");
        Signature signature = new Signature(properties);
        return classes.computeIfAbsent(signature, sig -> createDynamicClass(properties));
    }

    /**
     * @return The number of distinct record types created so far
     */
    public int size() {
        return classes.size();
    }

    private RecordType createDynamicClass(List<DynamicProperty> properties) {
        String typeName = "DynamicClass" + classCount.incrementAndGet();
        RecordType type = new RecordType(typeName, properties);
        logger.debug("Created dynamic class {} {}", typeName, properties);
        return type;
    }
}
