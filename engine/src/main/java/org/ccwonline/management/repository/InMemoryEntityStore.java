package org.ccwonline.management.repository;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Entity store backed by a list in memory, keyed by an extractor function.
 *
 * All operations synchronize on the store, so readers see whole writes.
 *
 * @param <T> The entity type
 */
public class InMemoryEntityStore<T> implements EntityStore<T> {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final Function<? super T, ?> keyExtractor;
    private MutableList<T> entities = Lists.mutable.empty();

    public InMemoryEntityStore(Function<? super T, ?> keyExtractor) {
        this.keyExtractor = Objects.requireNonNull(keyExtractor, "Key extractor cannot be null");
    }

    @Override
    public synchronized void insert(T entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        Object key = keyExtractor.apply(entity);
        if (indexOf(key) >= 0) {
            throw new RepositoryException("Duplicate key " + key);
        }
        entities.add(entity);
    }

    @Override
    public synchronized boolean update(T entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        int index = indexOf(keyExtractor.apply(entity));
        if (index < 0) {
            return false;
        }
        entities.set(index, entity);
        return true;
    }

    @Override
    public synchronized boolean delete(T entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        int index = indexOf(keyExtractor.apply(entity));
        if (index < 0) {
            return false;
        }
        entities.remove(index);
        return true;
    }

    @Override
    public synchronized int deleteWhere(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        MutableList<T> kept = entities.reject(predicate::test);
        int removed = entities.size() - kept.size();
        entities = kept;
        logger.debug("Deleted {} entities", removed);
        return removed;
    }

    @Override
    public synchronized List<T> findAll() {
        return entities.toImmutable().castToList();
    }

    @Override
    public synchronized List<T> findMatching(Predicate<? super T> predicate, int limit) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        MutableList<T> result = Lists.mutable.empty();
        for (T entity : entities) {
            if (result.size() >= limit) {
                break;
            }
            if (predicate.test(entity)) {
                result.add(entity);
            }
        }
        return result.toImmutable().castToList();
    }

    @Override
    public synchronized boolean anyMatch(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return entities.anySatisfy(predicate::test);
    }

    @Override
    public synchronized long count() {
        return entities.size();
    }

    @Override
    public synchronized long count(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return entities.count(predicate::test);
    }

    private int indexOf(Object key) {
        return entities.detectIndex(e -> Objects.equals(keyExtractor.apply(e), key));
    }
}
