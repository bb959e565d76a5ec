package de.burger.dispatch.registry;

import de.burger.dispatch.DispatchException;

import java.util.List;

/** Raised by {@link TypeRegistry#create(String)} for a key that was never registered. */
public final class UnknownKeyException extends DispatchException {
    private final String key;
    private final List<String> knownKeys;

    public UnknownKeyException(String key, List<String> knownKeys) {
        super("Unknown key '" + key + "' (registered: " + knownKeys + ")");
        this.key = key;
        this.knownKeys = List.copyOf(knownKeys);
    }

    public String key() {
        return key;
    }

    public List<String> knownKeys() {
        return knownKeys;
    }
}
