package io.trading.advstream.transport;

import java.io.IOException;
import java.net.URI;

/**
 * Opens WebSocket connections. The only seam between the client and the network.
 */
public interface WebSocketTransport extends AutoCloseable {

    /**
     * Opens a connection and completes the WebSocket handshake.
     *
     * @param uri      Endpoint URI ({@code ws} or {@code wss})
     * @param listener Receives every inbound frame of the new session
     * @return the open session
     * @throws IOException if the connection or handshake failed
     * @throws InterruptedException if interrupted while connecting
     */
    TransportSession open(URI uri, FrameListener listener) throws IOException, InterruptedException;

    /**
     * Releases shared resources such as I/O threads.
     */
    @Override
    void close();
}
