package io.liquidenergy.domain.order;

/**
 * Order type sent to the engine.
 */
public enum OrderType {
    LIMIT("limit"),    // execute at the given price or better
    MARKET("market");  // execute at the best available price

    private final String wireValue;

    OrderType(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Lowercase token used on the wire.
     */
    public String wireValue() {
        return wireValue;
    }

    public static OrderType fromWire(String value) {
        for (OrderType v : values()) {
            if (v.wireValue.equalsIgnoreCase(value)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown OrderType: " + value);
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
