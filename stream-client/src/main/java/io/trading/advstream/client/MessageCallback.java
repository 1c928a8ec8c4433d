package io.trading.advstream.client;

import io.trading.advstream.protocol.api.ProtocolException;
import io.trading.advstream.protocol.model.Message;

/**
 * Receives the parsed messages of a listen loop.
 */
public interface MessageCallback {

    void onMessage(Message message);

    /**
     * Called for each frame that could not be parsed or that reported a server error.
     * The connection stays up.
     */
    void onError(ProtocolException error);
}
