package com.commandcenter.backend.service.storage;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * In-memory owner of one collection document.
 * <p>
 * Writers run under the write lock for the whole load-mutate-save sequence. The mutation works on a
 * deep copy that only replaces the published value once it is on disk, so a failed write leaves memory
 * and disk in agreement. Published values are never mutated again; readers must not mutate them either.
 */
public class PersistentDocument<T> {

    private final JsonCollectionStore store;
    private final String key;
    private final TypeReference<T> type;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    private T value;

    public PersistentDocument(JsonCollectionStore store, String key, TypeReference<T> type, Supplier<T> fallback) {
        this.store = store;
        this.key = key;
        this.type = type;
        this.value = store.load(key, type, fallback);
    }

    public String key() {
        return key;
    }

    public T read() {
        lock.readLock().lock();
        try {
            return value;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Applies {@code mutation} and persists unconditionally. */
    public <R> R update(Function<T, R> mutation) {
        return update(mutation, r -> true);
    }

    /**
     * Applies {@code mutation} to a working copy; persists and publishes it only when
     * {@code persistWhen} accepts the mutation's result.
     */
    public <R> R update(Function<T, R> mutation, Predicate<R> persistWhen) {
        lock.writeLock().lock();
        try {
            T working = store.copy(value, type);
            R result = mutation.apply(working);
            if (persistWhen.test(result)) {
                store.save(key, working);
                value = working;
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Replaces the whole document. */
    public void replace(T next) {
        lock.writeLock().lock();
        try {
            store.save(key, next);
            value = next;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
