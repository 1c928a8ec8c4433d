package io.trading.advstream.protocol.model;

/**
 * Marker for the channel-specific entries of a message's {@code events} array.
 * The concrete type is fixed by {@link Channel#eventType()}.
 */
public interface Event {
}
