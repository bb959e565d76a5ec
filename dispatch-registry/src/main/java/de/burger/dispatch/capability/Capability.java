package de.burger.dispatch.capability;

/**
 * Contract shared by every interchangeable variant.
 *
 * @param <I> operation input
 * @param <O> operation output
 */
@FunctionalInterface
public interface Capability<I, O> {
    /** Run the operation. Failures are thrown as-is to the caller. */
    O perform(I input);

    /** Optional: short type tag for debugging/tests. */
    default String kind() {
        return getClass().getSimpleName();
    }
}
