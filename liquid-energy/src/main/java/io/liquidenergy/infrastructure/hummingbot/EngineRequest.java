package io.liquidenergy.infrastructure.hummingbot;

import io.liquidenergy.domain.order.OrderSide;
import io.liquidenergy.domain.order.OrderType;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed outbound request.
 *
 * Factories validate their arguments and throw {@link ValidationException}
 * so a bad request never reaches the wire. The correlation id is normally
 * assigned by the client at send time; {@link #withId(String)} pins one.
 */
public final class EngineRequest {

    private final RequestType type;
    private final Map<String, Object> fields;
    private final String id;    // null until the client assigns one

    private EngineRequest(RequestType type, Map<String, Object> fields, String id) {
        this.type = type;
        this.fields = Collections.unmodifiableMap(fields);
        this.id = id;
    }

    // ═══════════════════════════════════════════════════════════════
    // FACTORIES
    // ═══════════════════════════════════════════════════════════════

    public static EngineRequest authenticate(String apiKey) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("api_key", requireText(apiKey, "API key"));
        return new EngineRequest(RequestType.AUTHENTICATE, f, null);
    }

    /**
     * Build a create_order request. A price is required for limit orders and
     * ignored for market orders.
     */
    public static EngineRequest createOrder(String exchange, String market, OrderSide side,
                                            OrderType orderType, BigDecimal amount, BigDecimal price) {
        if (side == null) {
            throw new ValidationException("Order side is required");
        }
        if (orderType == null) {
            throw new ValidationException("Order type is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Order amount must be positive");
        }
        if (orderType == OrderType.LIMIT && price == null) {
            throw new ValidationException("Price is required for limit orders");
        }

        Map<String, Object> f = market(exchange, market);
        f.put("side", side.wireValue());
        f.put("order_type", orderType.wireValue());
        f.put("amount", amount.toPlainString());
        if (orderType == OrderType.LIMIT) {
            f.put("price", price.toPlainString());
        }
        return new EngineRequest(RequestType.CREATE_ORDER, f, null);
    }

    public static EngineRequest cancelOrder(String exchange, String market, String orderId) {
        Map<String, Object> f = market(exchange, market);
        f.put("order_id", requireText(orderId, "Order id"));
        return new EngineRequest(RequestType.CANCEL_ORDER, f, null);
    }

    public static EngineRequest getOrder(String exchange, String market, String orderId) {
        Map<String, Object> f = market(exchange, market);
        f.put("order_id", requireText(orderId, "Order id"));
        return new EngineRequest(RequestType.GET_ORDER, f, null);
    }

    public static EngineRequest getOrderBook(String exchange, String market, int depth) {
        if (depth <= 0) {
            throw new ValidationException("Order book depth must be positive");
        }
        Map<String, Object> f = market(exchange, market);
        f.put("depth", depth);
        return new EngineRequest(RequestType.GET_ORDER_BOOK, f, null);
    }

    public static EngineRequest getTicker(String exchange, String market) {
        return new EngineRequest(RequestType.GET_TICKER, market(exchange, market), null);
    }

    public static EngineRequest subscribe(SubscriptionChannel channel, String exchange, String market) {
        if (channel == null) {
            throw new ValidationException("Subscription channel is required");
        }
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("channel", channel.wireValue());
        f.putAll(market(exchange, market));
        return new EngineRequest(RequestType.SUBSCRIBE, f, null);
    }

    public static EngineRequest getBalances(String exchange) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("exchange", requireText(exchange, "Exchange"));
        return new EngineRequest(RequestType.GET_BALANCES, f, null);
    }

    public static EngineRequest getOpenOrders(String exchange, String market) {
        return new EngineRequest(RequestType.GET_OPEN_ORDERS, market(exchange, market), null);
    }

    public static EngineRequest getOrderHistory(String exchange, String market, int limit) {
        if (limit <= 0) {
            throw new ValidationException("History limit must be positive");
        }
        Map<String, Object> f = market(exchange, market);
        f.put("limit", limit);
        return new EngineRequest(RequestType.GET_ORDER_HISTORY, f, null);
    }

    // ═══════════════════════════════════════════════════════════════
    // ACCESSORS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Copy of this request carrying a caller-chosen correlation id.
     */
    public EngineRequest withId(String requestId) {
        return new EngineRequest(type, new LinkedHashMap<>(fields), requireText(requestId, "Request id"));
    }

    public RequestType getType() {
        return type;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public String getId() {
        return id;
    }

    /**
     * Wire representation: {@code type}, the request fields, then {@code id}.
     */
    public Map<String, Object> toWire(String requestId) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.wireValue());
        wire.putAll(fields);
        wire.put("id", requestId);
        return wire;
    }

    @Override
    public String toString() {
        // api_key stays out of logs
        Object shown = type == RequestType.AUTHENTICATE ? "{api_key=***}" : fields;
        return "EngineRequest(" + type.wireValue() + ", " + shown + (id != null ? ", id=" + id : "") + ")";
    }

    private static Map<String, Object> market(String exchange, String market) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("exchange", requireText(exchange, "Exchange"));
        f.put("market", requireText(market, "Market"));
        return f;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " cannot be empty");
        }
        return value;
    }
}
