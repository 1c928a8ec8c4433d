package io.trading.advstream.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.advstream.client.ConnectionState;
import io.trading.advstream.client.StreamingClient;
import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.EndpointKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP server for exposing Prometheus metrics, health and the active subscriptions.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final StreamingClient client;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private HttpServer server;

    /**
     * @param port   Port to listen on, 0 for an ephemeral port
     * @param client Client whose state is reported
     */
    public MetricsServer(int port, StreamingClient client) {
        this.port = port;
        this.client = client;
        this.registry = client.getMetrics().getRegistry();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.createContext("/api/subscriptions", handleSubscriptions());

        server.setExecutor(null);
        server.start();

        LOGGER.info("HTTP server started on port {}", getPort());
        LOGGER.info("  Prometheus:    http://localhost:{}/metrics", getPort());
        LOGGER.info("  Health:        http://localhost:{}/health", getPort());
        LOGGER.info("  Subscriptions: http://localhost:{}/api/subscriptions", getPort());
    }

    /**
     * Port the server is bound to.
     */
    public int getPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                sendResponse(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                Map<String, String> endpoints = new LinkedHashMap<>();
                boolean healthy = true;
                String message = "All endpoints connected";

                for (Map.Entry<EndpointKind, ConnectionState> entry : client.connectionStates().entrySet()) {
                    endpoints.put(entry.getKey().getDisplayName(), entry.getValue().name());
                    if (entry.getValue() != ConnectionState.CONNECTED) {
                        healthy = false;
                        message = entry.getKey().getDisplayName() + " " + entry.getValue().name().toLowerCase();
                    }
                }

                HealthResponse health = new HealthResponse(healthy, message, endpoints);
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(health);
                sendResponse(exchange, healthy ? 200 : 503, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                sendResponse(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleSubscriptions() {
        return exchange -> {
            try {
                Map<String, Map<String, List<String>>> subscriptions = new LinkedHashMap<>();
                for (EndpointKind kind : client.enabledEndpoints()) {
                    Map<String, List<String>> channels = new LinkedHashMap<>();
                    for (Map.Entry<Channel, List<String>> entry : client.subscriptions(kind).entrySet()) {
                        channels.put(entry.getKey().wireName(), entry.getValue());
                    }
                    subscriptions.put(kind.getDisplayName(), channels);
                }

                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(subscriptions);
                sendResponse(exchange, 200, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling subscriptions request", e);
                sendResponse(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String contentType, String response)
        throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    private record HealthResponse(boolean healthy, String message, Map<String, String> endpoints) {}
}
