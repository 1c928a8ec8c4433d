package io.trading.advstream.protocol.api;

/**
 * Raised when an inbound frame does not match the expected schema, or when the server
 * answers with an error frame. Reported per frame; the connection stays open.
 */
public class ProtocolException extends RuntimeException {

    private final boolean serverError;

    public ProtocolException(String message) {
        this(message, null, false);
    }

    public ProtocolException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private ProtocolException(String message, Throwable cause, boolean serverError) {
        super(message, cause);
        this.serverError = serverError;
    }

    /**
     * Creates an exception for an error frame sent by the server.
     */
    public static ProtocolException serverError(String reason) {
        return new ProtocolException("Server error: " + reason, null, true);
    }

    /**
     * Whether the frame was a well-formed error reported by the server.
     */
    public boolean isServerError() {
        return serverError;
    }
}
