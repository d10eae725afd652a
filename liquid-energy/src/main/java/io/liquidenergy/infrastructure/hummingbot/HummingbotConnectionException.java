package io.liquidenergy.infrastructure.hummingbot;

/**
 * Exception thrown when the connection cannot be opened, is not open, or is
 * lost while a request is waiting.
 */
public class HummingbotConnectionException extends HummingbotClientException {

    private final String endpoint;

    public HummingbotConnectionException(String endpoint, String message) {
        super(String.format("[%s] %s", endpoint, message));
        this.endpoint = endpoint;
    }

    public HummingbotConnectionException(String endpoint, String message, Throwable cause) {
        super(String.format("[%s] %s", endpoint, message), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
