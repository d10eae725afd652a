package io.liquidenergy.domain.order;

/**
 * Order side.
 */
public enum OrderSide {
    BUY("buy"),
    SELL("sell");

    private final String wireValue;

    OrderSide(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Lowercase token used on the wire.
     */
    public String wireValue() {
        return wireValue;
    }

    public static OrderSide fromWire(String value) {
        for (OrderSide v : values()) {
            if (v.wireValue.equalsIgnoreCase(value)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown OrderSide: " + value);
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
