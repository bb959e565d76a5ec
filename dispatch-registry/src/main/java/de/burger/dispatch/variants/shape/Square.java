package de.burger.dispatch.variants.shape;

public final class Square implements Shape {
    @Override
    public String draw() {
        return "Drawing a square";
    }
}
