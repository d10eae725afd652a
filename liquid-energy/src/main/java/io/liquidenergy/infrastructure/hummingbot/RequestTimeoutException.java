package io.liquidenergy.infrastructure.hummingbot;

import java.time.Duration;

/**
 * Exception thrown when no response with a matching id arrives in time.
 */
public class RequestTimeoutException extends HummingbotClientException {

    private final String requestType;
    private final String requestId;
    private final Duration timeout;

    public RequestTimeoutException(String requestType, String requestId, Duration timeout) {
        super(String.format("Request %s (id=%s) timed out after %d ms", requestType, requestId, timeout.toMillis()));
        this.requestType = requestType;
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public String getRequestType() {
        return requestType;
    }

    public String getRequestId() {
        return requestId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
