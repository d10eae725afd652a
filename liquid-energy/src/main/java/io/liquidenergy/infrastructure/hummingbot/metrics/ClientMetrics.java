package io.liquidenergy.infrastructure.hummingbot.metrics;

import io.liquidenergy.domain.event.EventKind;

import java.time.Duration;

/**
 * Observability sink for {@code HummingbotClient}.
 *
 * Injected into the client so the protocol core carries no global state;
 * {@link #noop()} for callers that do not collect metrics.
 */
public interface ClientMetrics {

    /**
     * Record a completed request exchange.
     *
     * @param requestType wire type, e.g. {@code create_order}
     * @param outcome how the exchange ended
     * @param latency time from send to outcome
     */
    void recordRequest(String requestType, RequestOutcome outcome, Duration latency);

    /**
     * A response arrived for an id nobody is waiting on (usually timed out).
     */
    void recordLateResponse();

    void recordMalformedFrame();

    void recordPushEvent(EventKind kind);

    /**
     * A push message of a type that is not forwarded to the bus.
     */
    void recordDroppedPush(String type);

    void recordConnectionEvent(ConnectionEvent event);

    static ClientMetrics noop() {
        return NoopClientMetrics.INSTANCE;
    }

    // ════════════════════════════════════════════════════════════════════════
    // ENUMS
    // ════════════════════════════════════════════════════════════════════════

    enum RequestOutcome {
        SUCCESS,
        REMOTE_ERROR,
        TIMEOUT,
        CONNECTION_ERROR
    }

    enum ConnectionEvent {
        CONNECTING,
        CONNECTED,
        AUTH_FAILED,
        CONNECT_FAILED,
        CONNECTION_LOST,
        DISCONNECTED
    }
}
