package io.liquidenergy.infrastructure.hummingbot.transport;

import io.liquidenergy.infrastructure.hummingbot.HummingbotConnectionException;

/**
 * The transport is closed, by either side or by a network failure.
 */
public class TransportClosedException extends HummingbotConnectionException {

    public TransportClosedException(String endpoint, String message) {
        super(endpoint, message);
    }

    public TransportClosedException(String endpoint, String message, Throwable cause) {
        super(endpoint, message, cause);
    }
}
