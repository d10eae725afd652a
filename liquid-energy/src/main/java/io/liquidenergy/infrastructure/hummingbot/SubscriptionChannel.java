package io.liquidenergy.infrastructure.hummingbot;

/**
 * Push channels a client can subscribe to.
 */
public enum SubscriptionChannel {
    ORDER_BOOK("order_book"),
    TRADES("trades");

    private final String wireValue;

    SubscriptionChannel(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
