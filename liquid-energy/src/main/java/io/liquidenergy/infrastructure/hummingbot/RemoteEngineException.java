package io.liquidenergy.infrastructure.hummingbot;

/**
 * Exception thrown when the engine answers with a non-success status.
 */
public class RemoteEngineException extends HummingbotClientException {

    private final String operation;
    private final String requestId;
    private final String peerMessage;

    public RemoteEngineException(String operation, String requestId, String peerMessage) {
        super(String.format("Failed to %s: %s", operation, peerMessage));
        this.operation = operation;
        this.requestId = requestId;
        this.peerMessage = peerMessage;
    }

    public String getOperation() {
        return operation;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getPeerMessage() {
        return peerMessage;
    }
}
