package io.trading.advstream.metrics;

import io.prometheus.client.CollectorRegistry;
import io.trading.advstream.client.StreamingClient;
import io.trading.advstream.config.StreamConfig;
import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.EndpointKind;
import io.trading.advstream.transport.FrameListener;
import io.trading.advstream.transport.TransportSession;
import io.trading.advstream.transport.WebSocketTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServerTest {

    private final HttpClient http = HttpClient.newHttpClient();
    private StreamingClient client;
    private MetricsServer server;

    /**
     * Transport whose sessions accept every write.
     */
    private static class AcceptingTransport implements WebSocketTransport {
        @Override
        public TransportSession open(URI uri, FrameListener listener) {
            return new TransportSession() {
                private boolean open = true;

                @Override
                public void send(String text) {
                }

                @Override
                public boolean isOpen() {
                    return open;
                }

                @Override
                public void close() {
                    open = false;
                }
            };
        }

        @Override
        public void close() {
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        client = StreamingClient.builder()
            .config(StreamConfig.builder().enable(EndpointKind.PUBLIC).build())
            .transport(new AcceptingTransport())
            .metrics(new StreamMetrics(new CollectorRegistry()))
            .build();
        server = new MetricsServer(0, client);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        client.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path)).build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testHealthReflectsConnectionState() throws Exception {
        HttpResponse<String> down = get("/health");
        assertEquals(503, down.statusCode());
        assertTrue(down.body().contains("\"healthy\" : false"));

        client.connect();

        HttpResponse<String> up = get("/health");
        assertEquals(200, up.statusCode());
        assertTrue(up.body().contains("\"Public\" : \"CONNECTED\""));
    }

    @Test
    void testSubscriptionsAndMetrics() throws Exception {
        client.connect();
        client.subscribe(Channel.CANDLES, List.of("BTC-USD"));

        HttpResponse<String> subscriptions = get("/api/subscriptions");
        assertEquals(200, subscriptions.statusCode());
        assertTrue(subscriptions.body().contains("\"candles\""));
        assertTrue(subscriptions.body().contains("\"BTC-USD\""));

        HttpResponse<String> metrics = get("/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("stream_control_messages_sent_total{endpoint=\"PUBLIC\",type=\"SUBSCRIBE\",} 1.0"));
        assertTrue(metrics.body().contains("stream_connection_status{endpoint=\"PUBLIC\",} 1.0"));
    }
}
