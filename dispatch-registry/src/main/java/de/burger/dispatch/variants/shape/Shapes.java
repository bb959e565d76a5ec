package de.burger.dispatch.variants.shape;

import de.burger.dispatch.registry.TypeRegistry;

/** Registry of the built-in shapes keyed by lower-case name. */
public final class Shapes {
    public static final String CIRCLE = "circle";
    public static final String SQUARE = "square";
    public static final String TRIANGLE = "triangle";

    private Shapes() {
    }

    public static TypeRegistry<Shape> registry() {
        return new TypeRegistry<Shape>()
            .register(CIRCLE, Circle::new)
            .register(SQUARE, Square::new)
            .register(TRIANGLE, Triangle::new);
    }
}
