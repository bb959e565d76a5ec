package de.burger.dispatch.variants.sort;

import de.burger.dispatch.config.Configuration;

import java.util.Comparator;
import java.util.List;

public final class InsertionSortStrategy extends AbstractSortStrategy {
    public InsertionSortStrategy() {
        this(Configuration.empty());
    }

    public InsertionSortStrategy(Configuration configuration) {
        super(configuration);
    }

    @Override
    void sortInPlace(List<Integer> values, Comparator<Integer> order) {
        for (int i = 1; i < values.size(); i++) {
            Integer current = values.get(i);
            int j = i - 1;
            while (j >= 0 && order.compare(values.get(j), current) > 0) {
                values.set(j + 1, values.get(j));
                j--;
            }
            values.set(j + 1, current);
        }
    }
}
