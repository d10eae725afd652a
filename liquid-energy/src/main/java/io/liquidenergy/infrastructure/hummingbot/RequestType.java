package io.liquidenergy.infrastructure.hummingbot;

/**
 * Request types understood by the Hummingbot gateway.
 */
public enum RequestType {
    AUTHENTICATE("authenticate"),
    CREATE_ORDER("create_order"),
    CANCEL_ORDER("cancel_order"),
    GET_ORDER("get_order"),
    GET_ORDER_BOOK("get_order_book"),
    GET_TICKER("get_ticker"),
    SUBSCRIBE("subscribe"),
    GET_BALANCES("get_balances"),
    GET_OPEN_ORDERS("get_open_orders"),
    GET_ORDER_HISTORY("get_order_history");

    private final String wireValue;

    RequestType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
