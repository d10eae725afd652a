package io.liquidenergy.infrastructure.hummingbot;

/**
 * Base class for failures reported by {@link HummingbotClient}.
 */
public class HummingbotClientException extends RuntimeException {

    public HummingbotClientException(String message) {
        super(message);
    }

    public HummingbotClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
