package io.liquidenergy.infrastructure.hummingbot;

/**
 * Lifecycle of the client's single connection.
 *
 * DISCONNECTED → CONNECTING → CONNECTED → DISCONNECTED, with CONNECTING → ERROR
 * and CONNECTED → ERROR on failure.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR
}
