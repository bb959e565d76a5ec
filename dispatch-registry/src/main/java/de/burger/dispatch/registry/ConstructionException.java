package de.burger.dispatch.registry;

import de.burger.dispatch.DispatchException;

/** A registered constructor failed; the original failure is kept as the cause. */
public final class ConstructionException extends DispatchException {
    private final String key;

    public ConstructionException(String key, Throwable cause) {
        super("Constructor for key '" + key + "' failed: " + describe(cause), cause);
        this.key = key;
    }

    public ConstructionException(String key, String message) {
        super("Constructor for key '" + key + "' failed: " + message);
        this.key = key;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null ? cause.getClass().getName() : message;
    }

    public String key() {
        return key;
    }
}
