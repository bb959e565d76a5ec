package de.burger.dispatch.variants.shape;

import de.burger.dispatch.context.StrategyContext;
import de.burger.dispatch.registry.TypeRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ShapesTest {

    private final TypeRegistry<Shape> registry = Shapes.registry();

    @Test
    void circleDrawsThroughRegistry() {
        assertThat(registry.create("circle").draw()).isEqualTo("Drawing a circle");
    }

    @Test
    void circleDrawsThroughContext() {
        StrategyContext<Void, String> context = new StrategyContext<>();
        context.setStrategy(registry.create(Shapes.CIRCLE));
        assertThat(context.execute(null)).isEqualTo("Drawing a circle");
    }

    @Test
    void registryListsBuiltInShapesInOrder() {
        assertThat(registry.listKeys()).containsExactly("circle", "square", "triangle");
        assertThat(registry.create(Shapes.SQUARE)).isInstanceOf(Square.class);
        assertThat(registry.create(Shapes.TRIANGLE).draw()).isEqualTo("Drawing a triangle");
    }

    @Test
    void hostCanAddShapeWithoutTouchingCore() {
        registry.register("hexagon", () -> () -> "Drawing a hexagon");
        assertThat(registry.create("hexagon").perform(null)).isEqualTo("Drawing a hexagon");
        assertThat(registry.create("hexagon").kind()).isNotBlank();
    }
}
