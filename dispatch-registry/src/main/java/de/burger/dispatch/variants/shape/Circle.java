package de.burger.dispatch.variants.shape;

public final class Circle implements Shape {
    @Override
    public String draw() {
        return "Drawing a circle";
    }
}
