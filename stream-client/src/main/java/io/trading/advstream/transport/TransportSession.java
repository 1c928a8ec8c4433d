package io.trading.advstream.transport;

import java.io.IOException;

/**
 * Outbound sink of one open WebSocket connection.
 */
public interface TransportSession extends AutoCloseable {

    /**
     * Sends a text frame and waits until it has been written.
     *
     * @throws IOException if the frame could not be written
     */
    void send(String text) throws IOException;

    boolean isOpen();

    /**
     * Closes the connection. Idempotent; never throws.
     */
    @Override
    void close();
}
