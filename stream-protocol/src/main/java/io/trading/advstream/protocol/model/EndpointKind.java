package io.trading.advstream.protocol.model;

/**
 * Logical WebSocket endpoints of the streaming service.
 * PUBLIC requires no credentials, USER requires a signed token on every control message.
 */
public enum EndpointKind {
    PUBLIC("Public"),
    USER("User");

    private final String displayName;

    EndpointKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
