package io.trading.advstream.client;

/**
 * Produces bearer tokens for authenticated requests.
 */
@FunctionalInterface
public interface SigningProvider {

    /**
     * Signs a request.
     *
     * @param uri The REST request URI, or {@code null} for streaming subscriptions
     * @return an opaque bearer token
     * @throws Exception if the token could not be produced
     */
    String sign(String uri) throws Exception;
}
