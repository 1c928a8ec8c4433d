package io.trading.advstream.config;

import io.trading.advstream.client.BackoffMode;
import io.trading.advstream.protocol.model.EndpointKind;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StreamConfigTest {

    @Test
    void testDefaults() {
        StreamConfig config = StreamConfig.fromEnv(Map.<String, String>of()::get);

        assertEquals(URI.create("wss://advanced-trade-ws.coinbase.com"), config.publicUrl());
        assertEquals(URI.create("wss://advanced-trade-ws-user.coinbase.com"), config.userUrl());
        assertEquals(Set.of(EndpointKind.PUBLIC), config.endpoints());
        assertTrue(config.autoReconnect());
        assertEquals(10, config.maxRetries());
        assertEquals(BackoffMode.RESET_EACH_CYCLE, config.backoffMode());
        assertEquals(750.0, config.rateLimitTokens());
        assertEquals(750.0, config.rateLimitRefill());
        assertEquals(List.of("BTC-USD", "ETH-USD"), config.products());
        assertEquals(9090, config.metricsPort());
    }

    @Test
    void testFromEnvironment() {
        Map<String, String> env = Map.of(
            "STREAM_PUBLIC_URL", "ws://localhost:8080",
            "STREAM_ENDPOINTS", "public, user",
            "STREAM_AUTO_RECONNECT", "false",
            "STREAM_MAX_RETRIES", "0",
            "STREAM_BACKOFF_MODE", "carry_over",
            "STREAM_RATE_LIMIT_TOKENS", "30",
            "STREAM_RATE_LIMIT_REFILL", "2.5",
            "STREAM_PRODUCTS", "SOL-USD",
            "METRICS_PORT", "9191"
        );

        StreamConfig config = StreamConfig.fromEnv(env::get);

        assertEquals(URI.create("ws://localhost:8080"), config.urlFor(EndpointKind.PUBLIC));
        assertEquals(StreamConfig.DEFAULT_USER_URL, config.urlFor(EndpointKind.USER));
        assertTrue(config.isEnabled(EndpointKind.PUBLIC));
        assertTrue(config.isEnabled(EndpointKind.USER));
        assertFalse(config.autoReconnect());
        assertEquals(0, config.maxRetries());
        assertEquals(BackoffMode.CARRY_OVER, config.backoffMode());
        assertEquals(30.0, config.rateLimitTokens());
        assertEquals(2.5, config.rateLimitRefill());
        assertEquals(List.of("SOL-USD"), config.products());
        assertEquals(9191, config.metricsPort());
    }

    @Test
    void testInvalidNumbersFallBackToDefaults() {
        StreamConfig config = StreamConfig.fromEnv(Map.of(
            "STREAM_MAX_RETRIES", "many",
            "STREAM_RATE_LIMIT_REFILL", "fast"
        )::get);

        assertEquals(10, config.maxRetries());
        assertEquals(750.0, config.rateLimitRefill());
    }

    @Test
    void testRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> StreamConfig.fromEnv(Map.of("STREAM_ENDPOINTS", "private")::get));
        assertThrows(IllegalArgumentException.class,
            () -> StreamConfig.fromEnv(Map.of("STREAM_BACKOFF_MODE", "linear")::get));
        assertThrows(IllegalArgumentException.class,
            () -> StreamConfig.builder().build());
        assertThrows(IllegalArgumentException.class,
            () -> StreamConfig.builder().enable(EndpointKind.PUBLIC).maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> StreamConfig.builder().enable(EndpointKind.PUBLIC).rateLimit(10, 0).build());
    }
}
