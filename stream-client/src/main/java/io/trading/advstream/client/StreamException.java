package io.trading.advstream.client;

/**
 * Base class of the errors raised by the streaming client.
 */
public class StreamException extends RuntimeException {

    public StreamException(String message) {
        super(message);
    }

    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
