package de.burger.dispatch;

/** Base type for failures raised by the registry and the strategy context. */
public class DispatchException extends RuntimeException {
    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
