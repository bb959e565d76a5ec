package de.burger.dispatch.context;

import de.burger.dispatch.DispatchException;

/** {@link StrategyContext#execute(Object)} was called before any strategy was selected. */
public final class NoStrategySelectedException extends DispatchException {
    public NoStrategySelectedException() {
        super("no strategy selected");
    }
}
