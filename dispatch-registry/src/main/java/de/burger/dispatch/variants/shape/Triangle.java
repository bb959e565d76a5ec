package de.burger.dispatch.variants.shape;

public final class Triangle implements Shape {
    @Override
    public String draw() {
        return "Drawing a triangle";
    }
}
