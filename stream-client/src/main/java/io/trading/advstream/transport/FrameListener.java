package io.trading.advstream.transport;

/**
 * Receives the inbound frames of one transport session.
 * Called from the transport's I/O thread; implementations must not block.
 */
public interface FrameListener {

    void onText(String text);

    void onPing();

    void onPong();

    /**
     * The peer closed the connection, or the connection went away.
     *
     * @param statusCode WebSocket close status, or -1 when the connection dropped without one
     * @param reason     Close reason, possibly empty
     */
    void onClose(int statusCode, String reason);

    void onError(Throwable cause);
}
