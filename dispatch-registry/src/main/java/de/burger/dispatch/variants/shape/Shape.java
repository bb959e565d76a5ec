package de.burger.dispatch.variants.shape;

import de.burger.dispatch.capability.Capability;

/** A drawable shape; {@link #perform(Void)} ignores its input and draws. */
public interface Shape extends Capability<Void, String> {
    String draw();

    @Override
    default String perform(Void ignored) {
        return draw();
    }
}
