package io.trading.advstream;

import io.trading.advstream.client.StreamingClient;
import io.trading.advstream.config.StreamConfig;
import io.trading.advstream.metrics.MetricsServer;
import io.trading.advstream.metrics.StreamMetrics;
import io.trading.advstream.netty.NettyTransport;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Main entry point: streams completed candles of the configured products and logs them.
 */
public class CandleStreamApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(CandleStreamApp.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Candle Stream Starting...");
        LOGGER.info("========================================");

        NettyTransport transport = null;
        StreamingClient client = null;
        MetricsServer metricsServer = null;
        int exitCode = 0;

        try {
            StreamConfig config = StreamConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Endpoints: {}", config.endpoints());
            LOGGER.info("  Products: {}", config.products());
            LOGGER.info("  Auto reconnect: {} (max retries {}, {})",
                config.autoReconnect(), config.maxRetries(), config.backoffMode());

            transport = new NettyTransport();
            client = StreamingClient.builder()
                .config(config)
                .transport(transport)
                .metrics(StreamMetrics.withDefaultRegistry())
                .build();

            metricsServer = new MetricsServer(config.metricsPort(), client);
            metricsServer.start();

            ShutdownSignalBarrier shutdownBarrier = new ShutdownSignalBarrier();

            CompletableFuture<Void> watcher = client.watchCandles(config.products(),
                (now, productId, candle) -> LOGGER.info(
                    "[{}] {} candle {}: open={} high={} low={} close={} volume={}",
                    now, productId, candle.start(), candle.open(), candle.high(),
                    candle.low(), candle.close(), candle.volume()));

            // A failed watcher ends the process like a shutdown signal
            watcher.whenComplete((ignored, error) -> {
                if (error != null) {
                    LOGGER.error("Candle watcher failed", error);
                }
                shutdownBarrier.signal();
            });

            LOGGER.info("Candle stream running. Press Ctrl+C to shutdown.");
            shutdownBarrier.await();

            if (watcher.isCompletedExceptionally()) {
                exitCode = 1;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted during startup", e);
            exitCode = 1;
        } catch (Exception e) {
            LOGGER.error("Fatal error in Candle Stream", e);
            exitCode = 1;
        } finally {
            LOGGER.info("Shutting down...");
            CloseHelper.closeAll(metricsServer, client, transport);
        }

        LOGGER.info("Candle Stream exited");
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
