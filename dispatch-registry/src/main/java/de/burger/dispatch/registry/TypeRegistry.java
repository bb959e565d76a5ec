package de.burger.dispatch.registry;

import de.burger.dispatch.config.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Key to constructor bindings with on-demand instantiation.
 *
 * <p>Re-registering a key replaces the previous binding (last write wins) and keeps the key's
 * original position in {@link #listKeys()}. Bindings are guarded by a read/write lock: one writer
 * at a time, any number of concurrent lookups. Constructors run outside the lock.
 *
 * @param <T> type of the instances produced
 */
public final class TypeRegistry<T> {
    private final Map<String, VariantConstructor<? extends T>> bindings = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** Binds {@code key} to a constructor that may read options from a {@link Configuration}. */
    public TypeRegistry<T> register(String key, VariantConstructor<? extends T> constructor) {
        requireKey(key);
        Objects.requireNonNull(constructor, "constructor");
        lock.writeLock().lock();
        try {
            bindings.put(key, constructor);
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    /** Binds {@code key} to a zero-argument constructor. */
    public TypeRegistry<T> register(String key, Supplier<? extends T> constructor) {
        Objects.requireNonNull(constructor, "constructor");
        return register(key, configuration -> constructor.get());
    }

    public T create(String key) {
        return create(key, Configuration.empty());
    }

    /**
     * Builds a new instance for {@code key}.
     *
     * @throws UnknownKeyException if nothing is registered under {@code key}
     * @throws ConstructionException if the constructor throws or returns {@code null}
     */
    public T create(String key, Configuration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        VariantConstructor<? extends T> constructor;
        lock.readLock().lock();
        try {
            constructor = bindings.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (constructor == null) {
            throw new UnknownKeyException(key, listKeys());
        }
        T instance;
        try {
            instance = constructor.construct(configuration);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ConstructionException(key, e);
        }
        if (instance == null) {
            throw new ConstructionException(key, "constructor returned null");
        }
        return instance;
    }

    /** Snapshot of registered keys in insertion order. */
    public List<String> listKeys() {
        lock.readLock().lock();
        try {
            return List.copyOf(bindings.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String key) {
        lock.readLock().lock();
        try {
            return bindings.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return bindings.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Registry key must not be blank");
        }
    }
}
