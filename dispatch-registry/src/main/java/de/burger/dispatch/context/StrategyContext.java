package de.burger.dispatch.context;

import de.burger.dispatch.capability.Capability;
import de.burger.dispatch.config.Configuration;
import de.burger.dispatch.infrastructure.logging.SuppressLogging;
import de.burger.dispatch.registry.TypeRegistry;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the currently selected strategy and forwards {@link #execute(Object)} to it.
 *
 * <p>A context starts unset. Strategies are either handed in directly through
 * {@link #setStrategy(Capability)} or built from the backing registry through
 * {@link #select(String)}. Configuration belongs to the strategy instance: the context only
 * passes its configuration to the registry when it builds a strategy by key, and
 * {@link #setConfiguration(Configuration)} rebuilds a key-selected strategy instead of touching
 * the existing one. The replaced strategy is dropped without any release call.
 *
 * @param <I> operation input
 * @param <O> operation output
 */
public final class StrategyContext<I, O> {
    private final TypeRegistry<? extends Capability<I, O>> registry;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Selection<I, O> selection;
    private Configuration configuration = Configuration.empty();

    /** Context without a registry; strategies must be supplied through {@link #setStrategy}. */
    public StrategyContext() {
        this.registry = null;
    }

    public StrategyContext(TypeRegistry<? extends Capability<I, O>> registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public StrategyContext(Capability<I, O> initial) {
        this();
        setStrategy(initial);
    }

    public void setStrategy(Capability<I, O> strategy) {
        Objects.requireNonNull(strategy, "strategy");
        lock.writeLock().lock();
        try {
            selection = new Selection<>(null, strategy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Builds the strategy registered under {@code key} with this context's configuration and
     * selects it. On failure the previous selection stays in place.
     */
    public void select(String key) {
        TypeRegistry<? extends Capability<I, O>> source = requireRegistry();
        lock.writeLock().lock();
        try {
            Capability<I, O> created = source.create(key, configuration);
            selection = new Selection<>(key, created);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the configuration used for key-based selection. A strategy that was selected by
     * key is rebuilt with the new configuration; a directly supplied strategy is kept.
     */
    public void setConfiguration(Configuration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        lock.writeLock().lock();
        try {
            Selection<I, O> current = selection;
            if (current != null && current.key() != null) {
                Capability<I, O> rebuilt = requireRegistry().create(current.key(), configuration);
                selection = new Selection<>(current.key(), rebuilt);
            }
            this.configuration = configuration;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Configuration configuration() {
        lock.readLock().lock();
        try {
            return configuration;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs the selected strategy. Exceptions thrown by the strategy reach the caller unchanged.
     *
     * @throws NoStrategySelectedException if no strategy has been selected yet
     */
    public O execute(I input) {
        Capability<I, O> strategy = currentStrategy().orElseThrow(NoStrategySelectedException::new);
        return strategy.perform(input);
    }

    public boolean isReady() {
        return currentStrategy().isPresent();
    }

    public Optional<Capability<I, O>> currentStrategy() {
        return currentSelection().map(Selection::strategy);
    }

    /** Key of the current strategy when it was selected through the registry. */
    public Optional<String> selectedKey() {
        return currentSelection().map(Selection::key);
    }

    /** The current strategy together with the key it was built from, read as one unit. */
    public Optional<Selection<I, O>> selection() {
        return currentSelection();
    }

    private Optional<Selection<I, O>> currentSelection() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(selection);
        } finally {
            lock.readLock().unlock();
        }
    }

    private TypeRegistry<? extends Capability<I, O>> requireRegistry() {
        if (registry == null) {
            throw new IllegalStateException("Context has no registry; use setStrategy instead");
        }
        return registry;
    }

    /** A selected strategy; {@code key} is {@code null} when it was supplied through {@link #setStrategy}. */
    @SuppressLogging
    public record Selection<I, O>(String key, Capability<I, O> strategy) {}
}
