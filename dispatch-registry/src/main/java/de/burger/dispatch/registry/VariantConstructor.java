package de.burger.dispatch.registry;

import de.burger.dispatch.config.Configuration;

/** Builds a new variant instance, optionally reading options from the configuration. */
@FunctionalInterface
public interface VariantConstructor<T> {
    T construct(Configuration configuration) throws Exception;
}
