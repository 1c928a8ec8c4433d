package io.trading.advstream.client;

import io.trading.advstream.protocol.model.EndpointKind;

/**
 * The transport failed or dropped. Retried internally; surfaced once reconnection is
 * exhausted or disabled.
 */
public class ConnectionException extends StreamException {

    private final EndpointKind endpoint;

    public ConnectionException(EndpointKind endpoint, String message) {
        super(endpoint + ": " + message);
        this.endpoint = endpoint;
    }

    public ConnectionException(EndpointKind endpoint, String message, Throwable cause) {
        super(endpoint + ": " + message, cause);
        this.endpoint = endpoint;
    }

    public EndpointKind getEndpoint() {
        return endpoint;
    }
}
