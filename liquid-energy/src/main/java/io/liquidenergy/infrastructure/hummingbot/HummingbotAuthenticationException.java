package io.liquidenergy.infrastructure.hummingbot;

/**
 * Exception thrown when the engine rejects the API key.
 */
public class HummingbotAuthenticationException extends HummingbotConnectionException {

    private final String peerMessage;

    public HummingbotAuthenticationException(String endpoint, String peerMessage) {
        super(endpoint, "Hummingbot authentication failed: " + peerMessage);
        this.peerMessage = peerMessage;
    }

    public String getPeerMessage() {
        return peerMessage;
    }
}
