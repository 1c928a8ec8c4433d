package io.trading.advstream.client;

/**
 * Lifecycle of one endpoint connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTED,
    RECONNECTING
}
