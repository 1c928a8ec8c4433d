package io.trading.advstream.client;

/**
 * The signing provider is missing or could not produce a token. Never retried.
 */
public class AuthenticationException extends StreamException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
