package io.liquidenergy.infrastructure.hummingbot;

import io.liquidenergy.domain.event.Event;
import io.liquidenergy.domain.event.EventKind;

import java.util.Map;
import java.util.Optional;

/**
 * Maps unsolicited gateway messages {@code {type, data}} onto bus events.
 */
public final class PushEventMapper {

    static final String ORIGIN = "hummingbot";

    private static final Map<String, EventKind> KINDS = Map.of(
        "order_update", EventKind.ORDER_UPDATE,
        "trade", EventKind.TRADE_UPDATE,
        "order_book_update", EventKind.MARKET_DATA,
        "ticker_update", EventKind.MARKET_DATA,
        "error", EventKind.ERROR,
        "info", EventKind.INFO
    );

    public Optional<EventKind> kindFor(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(KINDS.get(type));
    }

    /**
     * Build the bus event for a push message.
     *
     * @return empty for types that are not forwarded
     * @throws ProtocolException if {@code data} is present but not an object
     */
    @SuppressWarnings("unchecked")
    public Optional<Event> toEvent(Map<String, Object> message) {
        Object type = message.get("type");
        Optional<EventKind> kind = kindFor(type != null ? String.valueOf(type) : null);
        if (kind.isEmpty()) {
            return Optional.empty();
        }

        Object data = message.get("data");
        if (data == null) {
            return Optional.of(Event.of(kind.get(), Map.of(), ORIGIN));
        }
        if (!(data instanceof Map)) {
            throw new ProtocolException("Push message '" + type + "' has non-object data");
        }
        return Optional.of(Event.of(kind.get(), (Map<String, Object>) data, ORIGIN));
    }
}
