package io.liquidenergy.infrastructure.hummingbot.metrics;

import io.liquidenergy.domain.event.EventKind;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of {@link ClientMetrics}.
 *
 * Key Metrics:
 * - hummingbot_requests_total{type, outcome} - request exchanges by outcome
 * - hummingbot_request_latency_seconds{type} - send-to-outcome latency
 * - hummingbot_late_responses_total - responses for expired/unknown ids
 * - hummingbot_malformed_frames_total - frames that failed to decode
 * - hummingbot_push_events_total{kind} - push messages forwarded to the bus
 * - hummingbot_dropped_push_total{type} - push messages of unknown type
 * - hummingbot_connection_events_total{event} - lifecycle transitions
 * - hummingbot_connected - 1 while connected, else 0
 */
public class PrometheusClientMetrics implements ClientMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusClientMetrics.class);

    private final CollectorRegistry registry;

    private final Counter requestCounter;
    private final Histogram requestLatency;
    private final Counter lateResponseCounter;
    private final Counter malformedFrameCounter;
    private final Counter pushEventCounter;
    private final Counter droppedPushCounter;
    private final Counter connectionEventCounter;
    private final Gauge connected;

    public PrometheusClientMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusClientMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.requestCounter = Counter.build()
            .name("hummingbot_requests_total")
            .help("Request exchanges with the Hummingbot gateway")
            .labelNames("type", "outcome")
            .register(registry);

        this.requestLatency = Histogram.build()
            .name("hummingbot_request_latency_seconds")
            .help("Latency from send to response or failure, in seconds")
            .labelNames("type")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0)
            .register(registry);

        this.lateResponseCounter = Counter.build()
            .name("hummingbot_late_responses_total")
            .help("Responses whose request id was no longer pending")
            .register(registry);

        this.malformedFrameCounter = Counter.build()
            .name("hummingbot_malformed_frames_total")
            .help("Inbound frames that could not be decoded")
            .register(registry);

        this.pushEventCounter = Counter.build()
            .name("hummingbot_push_events_total")
            .help("Push messages forwarded to the event engine")
            .labelNames("kind")
            .register(registry);

        this.droppedPushCounter = Counter.build()
            .name("hummingbot_dropped_push_total")
            .help("Push messages of an unknown type")
            .labelNames("type")
            .register(registry);

        this.connectionEventCounter = Counter.build()
            .name("hummingbot_connection_events_total")
            .help("Connection lifecycle events")
            .labelNames("event")
            .register(registry);

        this.connected = Gauge.build()
            .name("hummingbot_connected")
            .help("1 while the client is connected, else 0")
            .register(registry);

        log.info("Prometheus Hummingbot client metrics initialized");
    }

    @Override
    public void recordRequest(String requestType, RequestOutcome outcome, Duration latency) {
        requestCounter.labels(requestType, outcome.name()).inc();
        requestLatency.labels(requestType).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordLateResponse() {
        lateResponseCounter.inc();
    }

    @Override
    public void recordMalformedFrame() {
        malformedFrameCounter.inc();
    }

    @Override
    public void recordPushEvent(EventKind kind) {
        pushEventCounter.labels(kind.name()).inc();
    }

    @Override
    public void recordDroppedPush(String type) {
        droppedPushCounter.labels(type != null ? type : "null").inc();
    }

    @Override
    public void recordConnectionEvent(ConnectionEvent event) {
        connectionEventCounter.labels(event.name()).inc();
        switch (event) {
            case CONNECTED -> connected.set(1);
            case CONNECTION_LOST, DISCONNECTED, CONNECT_FAILED, AUTH_FAILED -> connected.set(0);
            default -> {
                // CONNECTING leaves the gauge as is
            }
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
