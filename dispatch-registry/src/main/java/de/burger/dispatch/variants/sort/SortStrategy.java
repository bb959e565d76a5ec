package de.burger.dispatch.variants.sort;

import de.burger.dispatch.capability.Capability;

import java.util.List;

/**
 * Sorts a list of integers into a new list. Implementations never modify their input.
 */
public interface SortStrategy extends Capability<List<Integer>, List<Integer>> {
    /** Option name: sort in descending order when {@code true}. */
    String DESCENDING = "descending";

    List<Integer> sort(List<Integer> values);

    @Override
    default List<Integer> perform(List<Integer> input) {
        return sort(input);
    }
}
