package io.trading.advstream.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.ControlType;
import io.trading.advstream.protocol.model.EndpointKind;

/**
 * Prometheus metrics collector for the streaming client.
 *
 * Tracks:
 * - Message counts per endpoint and channel
 * - Protocol and connection errors per endpoint
 * - Reconnect attempts and control messages sent
 * - Connection status and subscribed product ids per endpoint
 * - Completed candles per product
 */
public class StreamMetrics {

    // Counters
    private final Counter messagesReceived;
    private final Counter protocolErrors;
    private final Counter connectionErrors;
    private final Counter reconnectAttempts;
    private final Counter controlMessagesSent;
    private final Counter candlesCompleted;

    // Gauges
    private final Gauge connectionStatus;
    private final Gauge activeSubscriptions;

    private final CollectorRegistry registry;

    /**
     * Creates metrics registered on the given registry.
     * Tests pass a fresh registry so that instances do not collide.
     */
    public StreamMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.messagesReceived = Counter.build()
            .name("stream_messages_received_total")
            .help("Total number of messages received per endpoint and channel")
            .labelNames("endpoint", "channel")
            .register(registry);

        this.protocolErrors = Counter.build()
            .name("stream_protocol_errors_total")
            .help("Total number of frames that could not be parsed or reported a server error")
            .labelNames("endpoint")
            .register(registry);

        this.connectionErrors = Counter.build()
            .name("stream_connection_errors_total")
            .help("Total number of connection failures and drops")
            .labelNames("endpoint")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("stream_reconnect_attempts_total")
            .help("Total number of reconnection attempts")
            .labelNames("endpoint")
            .register(registry);

        this.controlMessagesSent = Counter.build()
            .name("stream_control_messages_sent_total")
            .help("Total number of subscribe and unsubscribe requests sent")
            .labelNames("endpoint", "type")
            .register(registry);

        this.candlesCompleted = Counter.build()
            .name("stream_candles_completed_total")
            .help("Total number of completed candles emitted")
            .labelNames("product")
            .register(registry);

        // Connection status gauge (1 = connected, 0 = disconnected)
        this.connectionStatus = Gauge.build()
            .name("stream_connection_status")
            .help("Connection status per endpoint (1 = connected, 0 = disconnected)")
            .labelNames("endpoint")
            .register(registry);

        this.activeSubscriptions = Gauge.build()
            .name("stream_active_subscriptions")
            .help("Number of subscribed product ids per endpoint")
            .labelNames("endpoint")
            .register(registry);
    }

    /**
     * Creates metrics on the default registry, together with the JVM collectors.
     */
    public static StreamMetrics withDefaultRegistry() {
        // Initialize default JVM metrics (GC, memory, threads, etc.)
        DefaultExports.initialize();
        return new StreamMetrics(CollectorRegistry.defaultRegistry);
    }

    public void recordMessageReceived(EndpointKind endpoint, Channel channel) {
        messagesReceived.labels(endpoint.name(), channel.wireName()).inc();
    }

    public void recordProtocolError(EndpointKind endpoint) {
        protocolErrors.labels(endpoint.name()).inc();
    }

    public void recordConnectionError(EndpointKind endpoint) {
        connectionErrors.labels(endpoint.name()).inc();
    }

    public void recordReconnectAttempt(EndpointKind endpoint) {
        reconnectAttempts.labels(endpoint.name()).inc();
    }

    public void recordControlMessageSent(EndpointKind endpoint, ControlType type) {
        controlMessagesSent.labels(endpoint.name(), type.name()).inc();
    }

    public void recordCandleCompleted(String productId) {
        candlesCompleted.labels(productId).inc();
    }

    /**
     * Sets the connection status for an endpoint.
     *
     * @param endpoint  The endpoint
     * @param connected true if connected, false otherwise
     */
    public void setConnectionStatus(EndpointKind endpoint, boolean connected) {
        connectionStatus.labels(endpoint.name()).set(connected ? 1 : 0);
    }

    public void setActiveSubscriptions(EndpointKind endpoint, int count) {
        activeSubscriptions.labels(endpoint.name()).set(count);
    }

    public double getMessagesReceived(EndpointKind endpoint, Channel channel) {
        return messagesReceived.labels(endpoint.name(), channel.wireName()).get();
    }

    public double getProtocolErrors(EndpointKind endpoint) {
        return protocolErrors.labels(endpoint.name()).get();
    }

    public double getConnectionErrors(EndpointKind endpoint) {
        return connectionErrors.labels(endpoint.name()).get();
    }

    public double getReconnectAttempts(EndpointKind endpoint) {
        return reconnectAttempts.labels(endpoint.name()).get();
    }

    public double getControlMessagesSent(EndpointKind endpoint, ControlType type) {
        return controlMessagesSent.labels(endpoint.name(), type.name()).get();
    }

    public double getCandlesCompleted(String productId) {
        return candlesCompleted.labels(productId).get();
    }

    public double getConnectionStatus(EndpointKind endpoint) {
        return connectionStatus.labels(endpoint.name()).get();
    }

    public double getActiveSubscriptions(EndpointKind endpoint) {
        return activeSubscriptions.labels(endpoint.name()).get();
    }

    /**
     * Returns the CollectorRegistry for HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
