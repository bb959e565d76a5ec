package de.burger.dispatch.variants.sort;

import de.burger.dispatch.config.Configuration;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/** Lomuto-partition quicksort with the last element as pivot. */
public final class QuickSortStrategy extends AbstractSortStrategy {
    public QuickSortStrategy() {
        this(Configuration.empty());
    }

    public QuickSortStrategy(Configuration configuration) {
        super(configuration);
    }

    @Override
    void sortInPlace(List<Integer> values, Comparator<Integer> order) {
        quickSort(values, 0, values.size() - 1, order);
    }

    private static void quickSort(List<Integer> values, int low, int high, Comparator<Integer> order) {
        while (low < high) {
            int p = partition(values, low, high, order);
            // recurse into the smaller half to bound stack depth
            if (p - low < high - p) {
                quickSort(values, low, p - 1, order);
                low = p + 1;
            } else {
                quickSort(values, p + 1, high, order);
                high = p - 1;
            }
        }
    }

    private static int partition(List<Integer> values, int low, int high, Comparator<Integer> order) {
        Integer pivot = values.get(high);
        int i = low;
        for (int j = low; j < high; j++) {
            if (order.compare(values.get(j), pivot) < 0) {
                Collections.swap(values, i, j);
                i++;
            }
        }
        Collections.swap(values, i, high);
        return i;
    }
}
