package io.trading.advstream.client;

import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.EndpointKind;

/**
 * The request cannot be served in the client's current configuration or state.
 * Raised before any network I/O or rate-limiter consumption; never retried.
 */
public class CallerException extends StreamException {

    public CallerException(String message) {
        super(message);
    }

    public static CallerException endpointDisabled(EndpointKind endpoint, Channel channel) {
        String target = channel == null ? "" : " (channel " + channel + ")";
        return new CallerException(endpoint + " endpoint is not enabled" + target);
    }

    public static CallerException notConnected(EndpointKind endpoint) {
        return new CallerException(endpoint + " endpoint is not connected");
    }
}
