package de.burger.dispatch.variants.sort;

import de.burger.dispatch.config.Configuration;
import de.burger.dispatch.context.StrategyContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class SortStrategiesTest {

    private static final List<Integer> INPUT = List.of(4, 2, 7, 1);

    @Test
    void swappingStrategiesKeepsCallerCodeUnchanged() {
        StrategyContext<List<Integer>, List<Integer>> context = new StrategyContext<>();

        context.setStrategy(new QuickSortStrategy());
        assertThat(context.execute(INPUT)).containsExactly(1, 2, 4, 7);

        context.setStrategy(new MergeSortStrategy());
        assertThat(context.execute(INPUT)).containsExactly(1, 2, 4, 7);
    }

    @Test
    void everyRegisteredStrategyAgreesWithListSort() {
        Random random = new Random(42);
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            values.add(random.nextInt(100) - 50);
        }
        List<Integer> expected = new ArrayList<>(values);
        expected.sort(null);

        var registry = SortStrategies.registry();
        for (String key : registry.listKeys()) {
            assertThat(registry.create(key).sort(values)).as(key).isEqualTo(expected);
        }
    }

    @Test
    void descendingOptionIsCapturedAtConstruction() {
        var registry = SortStrategies.registry();
        Configuration descending = Configuration.builder().with(SortStrategy.DESCENDING, true).build();
        assertThat(registry.create(SortStrategies.QUICK, descending).sort(INPUT)).containsExactly(7, 4, 2, 1);
        assertThat(registry.create(SortStrategies.MERGE, descending).sort(INPUT)).containsExactly(7, 4, 2, 1);
        assertThat(registry.create(SortStrategies.INSERTION, descending).sort(INPUT)).containsExactly(7, 4, 2, 1);
    }

    @Test
    void inputIsNotModified() {
        List<Integer> input = new ArrayList<>(List.of(3, 1, 2));
        List<Integer> sorted = new InsertionSortStrategy().sort(input);
        assertThat(input).containsExactly(3, 1, 2);
        assertThat(sorted).containsExactly(1, 2, 3);
    }

    @Test
    void handlesEmptySingletonAndDuplicates() {
        SortStrategy merge = new MergeSortStrategy();
        SortStrategy quick = new QuickSortStrategy();
        assertThat(merge.sort(List.of())).isEmpty();
        assertThat(quick.sort(List.of(5))).containsExactly(5);
        assertThat(quick.sort(List.of(2, 2, 1, 2))).containsExactly(1, 2, 2, 2);
        assertThat(merge.sort(List.of(2, 2, 1, 2))).containsExactly(1, 2, 2, 2);
    }
}
