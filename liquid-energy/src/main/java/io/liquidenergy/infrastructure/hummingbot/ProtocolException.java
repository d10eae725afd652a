package io.liquidenergy.infrastructure.hummingbot;

/**
 * Inbound frame that cannot be decoded or classified.
 * Raised by the codec and handled inside the receive loop.
 */
public class ProtocolException extends HummingbotClientException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
