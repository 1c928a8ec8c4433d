package io.trading.advstream.protocol.api;

import io.trading.advstream.protocol.model.Message;

/**
 * Parses inbound WebSocket text frames into typed messages.
 * The event shape is resolved once from the envelope's {@code channel} field.
 */
public interface MessageParser {

    /**
     * Parses a text frame.
     *
     * @param frame The raw JSON frame
     * @return The parsed message
     * @throws ProtocolException if the frame is malformed, has an unknown channel, or is a server error
     */
    Message parse(String frame);
}
