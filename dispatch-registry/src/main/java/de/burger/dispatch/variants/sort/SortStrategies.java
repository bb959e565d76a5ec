package de.burger.dispatch.variants.sort;

import de.burger.dispatch.registry.TypeRegistry;

/** Registry of the built-in sort strategies; each reads {@link SortStrategy#DESCENDING}. */
public final class SortStrategies {
    public static final String QUICK = "quick";
    public static final String MERGE = "merge";
    public static final String INSERTION = "insertion";

    private SortStrategies() {
    }

    public static TypeRegistry<SortStrategy> registry() {
        return new TypeRegistry<SortStrategy>()
            .register(QUICK, configuration -> new QuickSortStrategy(configuration))
            .register(MERGE, configuration -> new MergeSortStrategy(configuration))
            .register(INSERTION, configuration -> new InsertionSortStrategy(configuration));
    }
}
