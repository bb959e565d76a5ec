package de.burger.dispatch.variants.sort;

import de.burger.dispatch.config.Configuration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Stable top-down merge sort. */
public final class MergeSortStrategy extends AbstractSortStrategy {
    public MergeSortStrategy() {
        this(Configuration.empty());
    }

    public MergeSortStrategy(Configuration configuration) {
        super(configuration);
    }

    @Override
    void sortInPlace(List<Integer> values, Comparator<Integer> order) {
        if (values.size() < 2) {
            return;
        }
        List<Integer> buffer = new ArrayList<>(values);
        mergeSort(values, buffer, 0, values.size(), order);
    }

    private static void mergeSort(List<Integer> values, List<Integer> buffer, int from, int to, Comparator<Integer> order) {
        if (to - from < 2) {
            return;
        }
        int mid = (from + to) >>> 1;
        mergeSort(values, buffer, from, mid, order);
        mergeSort(values, buffer, mid, to, order);
        int left = from;
        int right = mid;
        for (int k = from; k < to; k++) {
            if (right >= to || (left < mid && order.compare(values.get(left), values.get(right)) <= 0)) {
                buffer.set(k, values.get(left++));
            } else {
                buffer.set(k, values.get(right++));
            }
        }
        for (int k = from; k < to; k++) {
            values.set(k, buffer.get(k));
        }
    }
}
