package io.liquidenergy.infrastructure.hummingbot.metrics;

import io.liquidenergy.domain.event.EventKind;

import java.time.Duration;

final class NoopClientMetrics implements ClientMetrics {

    static final NoopClientMetrics INSTANCE = new NoopClientMetrics();

    private NoopClientMetrics() {}

    @Override
    public void recordRequest(String requestType, RequestOutcome outcome, Duration latency) {}

    @Override
    public void recordLateResponse() {}

    @Override
    public void recordMalformedFrame() {}

    @Override
    public void recordPushEvent(EventKind kind) {}

    @Override
    public void recordDroppedPush(String type) {}

    @Override
    public void recordConnectionEvent(ConnectionEvent event) {}
}
