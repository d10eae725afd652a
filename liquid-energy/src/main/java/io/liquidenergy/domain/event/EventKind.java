package io.liquidenergy.domain.event;

/**
 * Kinds of events carried by the in-process event bus.
 */
public enum EventKind {
    // Market data (order book, ticker)
    MARKET_DATA,

    // Order and trade lifecycle
    ORDER_UPDATE,
    TRADE_UPDATE,

    // Strategy state changes
    STRATEGY_UPDATE,

    // Diagnostics
    ERROR,
    INFO,
    SYSTEM
}
