package io.liquidenergy.infrastructure.hummingbot;

/**
 * Invalid configuration or request argument. Always thrown before any I/O.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
