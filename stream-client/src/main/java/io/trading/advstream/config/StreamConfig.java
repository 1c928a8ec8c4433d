package io.trading.advstream.config;

import io.trading.advstream.client.BackoffMode;
import io.trading.advstream.protocol.model.EndpointKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the streaming client.
 *
 * @param publicUrl       URL of the public market data endpoint
 * @param userUrl         URL of the authenticated user endpoint
 * @param endpoints       Endpoints to enable (at least one)
 * @param autoReconnect   Whether dropped connections are reopened
 * @param maxRetries      Maximum reconnect attempts per disconnect (0 = first disconnect is fatal)
 * @param backoffMode     Whether reconnect attempts carry over between disconnects
 * @param rateLimitTokens Token bucket capacity per endpoint
 * @param rateLimitRefill Token bucket refill rate per endpoint, in tokens per second
 * @param products        Product ids watched by the application
 * @param metricsPort     Port for Prometheus metrics HTTP server
 */
public record StreamConfig(
    URI publicUrl,
    URI userUrl,
    Set<EndpointKind> endpoints,
    boolean autoReconnect,
    int maxRetries,
    BackoffMode backoffMode,
    double rateLimitTokens,
    double rateLimitRefill,
    List<String> products,
    int metricsPort
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(StreamConfig.class);

    public static final URI DEFAULT_PUBLIC_URL = URI.create("wss://advanced-trade-ws.coinbase.com");
    public static final URI DEFAULT_USER_URL = URI.create("wss://advanced-trade-ws-user.coinbase.com");
    private static final int DEFAULT_MAX_RETRIES = 10;
    private static final double DEFAULT_RATE_LIMIT_TOKENS = 750;
    private static final double DEFAULT_RATE_LIMIT_REFILL = 750;
    private static final String DEFAULT_PRODUCTS = "BTC-USD,ETH-USD";
    private static final int DEFAULT_METRICS_PORT = 9090;

    public StreamConfig {
        if (publicUrl == null) {
            throw new IllegalArgumentException("publicUrl cannot be null");
        }
        if (userUrl == null) {
            throw new IllegalArgumentException("userUrl cannot be null");
        }
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("at least one endpoint must be enabled");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        if (backoffMode == null) {
            throw new IllegalArgumentException("backoffMode cannot be null");
        }
        if (rateLimitTokens < 1) {
            throw new IllegalArgumentException("rateLimitTokens must be at least 1");
        }
        if (rateLimitRefill <= 0) {
            throw new IllegalArgumentException("rateLimitRefill must be positive");
        }
        if (metricsPort < 1 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 1 and 65535");
        }
        endpoints = Set.copyOf(endpoints);
        products = products == null ? List.of() : List.copyOf(products);
    }

    public boolean isEnabled(EndpointKind kind) {
        return endpoints.contains(kind);
    }

    public URI urlFor(EndpointKind kind) {
        return kind == EndpointKind.USER ? userUrl : publicUrl;
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - STREAM_PUBLIC_URL: Public endpoint (default: "wss://advanced-trade-ws.coinbase.com")
     * - STREAM_USER_URL: User endpoint (default: "wss://advanced-trade-ws-user.coinbase.com")
     * - STREAM_ENDPOINTS: Enabled endpoints, e.g. "public,user" (default: "public")
     * - STREAM_AUTO_RECONNECT: Reconnect dropped connections (default: true)
     * - STREAM_MAX_RETRIES: Max reconnect attempts per disconnect (default: 10)
     * - STREAM_BACKOFF_MODE: "reset_each_cycle" or "carry_over" (default: "reset_each_cycle")
     * - STREAM_RATE_LIMIT_TOKENS / STREAM_RATE_LIMIT_REFILL: Token bucket (default: 750 / 750)
     * - STREAM_PRODUCTS: Products to watch (default: "BTC-USD,ETH-USD")
     * - METRICS_PORT: Metrics HTTP port (default: 9090)
     */
    public static StreamConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Loads configuration through the given variable lookup.
     */
    public static StreamConfig fromEnv(Function<String, String> env) {
        Builder builder = builder()
            .publicUrl(URI.create(stringEnv(env, "STREAM_PUBLIC_URL", DEFAULT_PUBLIC_URL.toString())))
            .userUrl(URI.create(stringEnv(env, "STREAM_USER_URL", DEFAULT_USER_URL.toString())))
            .autoReconnect(Boolean.parseBoolean(stringEnv(env, "STREAM_AUTO_RECONNECT", "true")))
            .maxRetries(parseIntEnv(env, "STREAM_MAX_RETRIES", DEFAULT_MAX_RETRIES))
            .backoffMode(BackoffMode.fromString(stringEnv(env, "STREAM_BACKOFF_MODE", "reset_each_cycle")))
            .rateLimit(
                parseDoubleEnv(env, "STREAM_RATE_LIMIT_TOKENS", DEFAULT_RATE_LIMIT_TOKENS),
                parseDoubleEnv(env, "STREAM_RATE_LIMIT_REFILL", DEFAULT_RATE_LIMIT_REFILL)
            )
            .metricsPort(parseIntEnv(env, "METRICS_PORT", DEFAULT_METRICS_PORT));

        Arrays.stream(stringEnv(env, "STREAM_ENDPOINTS", "public").split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(StreamConfig::parseEndpoint)
            .forEach(builder::enable);

        builder.products(Arrays.stream(stringEnv(env, "STREAM_PRODUCTS", DEFAULT_PRODUCTS).split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList()));

        return builder.build();
    }

    private static EndpointKind parseEndpoint(String value) {
        return switch (value.toLowerCase()) {
            case "public" -> EndpointKind.PUBLIC;
            case "user" -> EndpointKind.USER;
            default -> throw new IllegalArgumentException("Unknown endpoint: " + value);
        };
    }

    private static String stringEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static int parseIntEnv(Function<String, String> env, String key, int defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static double parseDoubleEnv(Function<String, String> env, String key, double defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Creates a new builder for StreamConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for StreamConfig.
     */
    public static class Builder {
        private URI publicUrl = DEFAULT_PUBLIC_URL;
        private URI userUrl = DEFAULT_USER_URL;
        private final Set<EndpointKind> endpoints = EnumSet.noneOf(EndpointKind.class);
        private boolean autoReconnect = true;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private BackoffMode backoffMode = BackoffMode.RESET_EACH_CYCLE;
        private double rateLimitTokens = DEFAULT_RATE_LIMIT_TOKENS;
        private double rateLimitRefill = DEFAULT_RATE_LIMIT_REFILL;
        private final List<String> products = new ArrayList<>();
        private int metricsPort = DEFAULT_METRICS_PORT;

        public Builder publicUrl(URI publicUrl) {
            this.publicUrl = publicUrl;
            return this;
        }

        public Builder userUrl(URI userUrl) {
            this.userUrl = userUrl;
            return this;
        }

        public Builder enable(EndpointKind... kinds) {
            this.endpoints.addAll(Arrays.asList(kinds));
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffMode(BackoffMode backoffMode) {
            this.backoffMode = backoffMode;
            return this;
        }

        public Builder rateLimit(double maxTokens, double refillRate) {
            this.rateLimitTokens = maxTokens;
            this.rateLimitRefill = refillRate;
            return this;
        }

        public Builder products(List<String> products) {
            this.products.addAll(products);
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public StreamConfig build() {
            return new StreamConfig(
                publicUrl,
                userUrl,
                endpoints,
                autoReconnect,
                maxRetries,
                backoffMode,
                rateLimitTokens,
                rateLimitRefill,
                products,
                metricsPort
            );
        }
    }
}
