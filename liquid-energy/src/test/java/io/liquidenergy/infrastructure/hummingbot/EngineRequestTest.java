package io.liquidenergy.infrastructure.hummingbot;

import io.liquidenergy.domain.order.OrderSide;
import io.liquidenergy.domain.order.OrderType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineRequestTest {

    @Test
    void testLimitOrderRequiresPrice() {
        ValidationException e = assertThrows(ValidationException.class, () ->
            EngineRequest.createOrder("binance", "BTC-USDT", OrderSide.BUY, OrderType.LIMIT, BigDecimal.ONE, null));

        assertEquals("Price is required for limit orders", e.getMessage());
    }

    @Test
    void testMarketOrderDropsPrice() {
        EngineRequest request = EngineRequest.createOrder("binance", "BTC-USDT", OrderSide.SELL, OrderType.MARKET,
            new BigDecimal("1.5"), new BigDecimal("100"));

        assertEquals(RequestType.CREATE_ORDER, request.getType());
        assertFalse(request.getFields().containsKey("price"));
        assertEquals("1.5", request.getFields().get("amount"));
    }

    @Test
    void testAmountsUsePlainNotation() {
        EngineRequest request = EngineRequest.createOrder("binance", "BTC-USDT", OrderSide.BUY, OrderType.LIMIT,
            new BigDecimal("1E-8"), new BigDecimal("3E+4"));

        assertEquals("0.00000001", request.getFields().get("amount"));
        assertEquals("30000", request.getFields().get("price"));
    }

    @Test
    void testInvalidArgumentsAreRejected() {
        assertThrows(ValidationException.class, () ->
            EngineRequest.createOrder("binance", "BTC-USDT", OrderSide.BUY, OrderType.MARKET, BigDecimal.ZERO, null));
        assertThrows(ValidationException.class, () ->
            EngineRequest.createOrder("binance", "BTC-USDT", null, OrderType.MARKET, BigDecimal.ONE, null));
        assertThrows(ValidationException.class, () -> EngineRequest.getTicker(" ", "BTC-USDT"));
        assertThrows(ValidationException.class, () -> EngineRequest.cancelOrder("binance", "BTC-USDT", ""));
        assertThrows(ValidationException.class, () -> EngineRequest.getOrderBook("binance", "BTC-USDT", 0));
        assertThrows(ValidationException.class, () -> EngineRequest.getOrderHistory("binance", "BTC-USDT", -1));

        ValidationException e = assertThrows(ValidationException.class, () -> EngineRequest.getBalances(null));
        assertEquals("Exchange cannot be empty", e.getMessage());
    }

    @Test
    void testWireFormatPutsTypeFirstAndIdLast() {
        EngineRequest request = EngineRequest.getOrderBook("binance", "BTC-USDT", 20);

        Map<String, Object> wire = request.toWire("42");

        assertEquals(List.of("type", "exchange", "market", "depth", "id"), new ArrayList<>(wire.keySet()));
        assertEquals("get_order_book", wire.get("type"));
        assertEquals(20, wire.get("depth"));
        assertEquals("42", wire.get("id"));
    }

    @Test
    void testSubscribeCarriesChannel() {
        Map<String, Object> wire = EngineRequest.subscribe(SubscriptionChannel.ORDER_BOOK, "binance", "BTC-USDT")
            .toWire("7");

        assertEquals("subscribe", wire.get("type"));
        assertEquals("order_book", wire.get("channel"));
    }

    @Test
    void testWithIdPinsCorrelationId() {
        EngineRequest request = EngineRequest.getTicker("binance", "BTC-USDT");
        assertNull(request.getId());

        EngineRequest pinned = request.withId("custom-1");

        assertEquals("custom-1", pinned.getId());
        assertNull(request.getId(), "Original request is unchanged");
        assertEquals(request.getFields(), pinned.getFields());
    }

    @Test
    void testToStringMasksApiKey() {
        EngineRequest auth = EngineRequest.authenticate("super-secret");

        assertFalse(auth.toString().contains("super-secret"));
        assertEquals("super-secret", auth.toWire("1").get("api_key"));
    }
}
