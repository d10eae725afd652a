package io.liquidenergy.domain.order;

/**
 * Order status as reported by the engine.
 */
public enum OrderStatus {
    OPEN("open"),
    PARTIALLY_FILLED("partially_filled"),
    FILLED("filled"),
    CANCELLED("cancelled"),
    FAILED("failed");

    private final String wireValue;

    OrderStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Lowercase token used on the wire.
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * True once the engine will send no further fills for the order.
     */
    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == FAILED;
    }

    public static OrderStatus fromWire(String value) {
        for (OrderStatus v : values()) {
            if (v.wireValue.equalsIgnoreCase(value)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown OrderStatus: " + value);
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
