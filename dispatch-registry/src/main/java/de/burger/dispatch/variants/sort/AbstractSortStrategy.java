package de.burger.dispatch.variants.sort;

import de.burger.dispatch.config.Configuration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Copies the input, sorts the copy with the subclass algorithm and returns it unmodifiable. */
abstract class AbstractSortStrategy implements SortStrategy {
    private final boolean descending;

    AbstractSortStrategy(Configuration configuration) {
        this.descending = configuration.getBoolean(DESCENDING, false);
    }

    @Override
    public final List<Integer> sort(List<Integer> values) {
        Objects.requireNonNull(values, "values");
        List<Integer> copy = new ArrayList<>(values);
        Comparator<Integer> order = descending ? Comparator.reverseOrder() : Comparator.naturalOrder();
        sortInPlace(copy, order);
        return Collections.unmodifiableList(copy);
    }

    abstract void sortInPlace(List<Integer> values, Comparator<Integer> order);
}
