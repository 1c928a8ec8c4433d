package io.trading.advstream.client;

import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.EndpointKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    @Test
    void testAddIsUnionWithoutDuplicates() {
        registry.add(EndpointKind.PUBLIC, Channel.CANDLES, List.of("BTC-USD", "ETH-USD"));
        registry.add(EndpointKind.PUBLIC, Channel.CANDLES, List.of("ETH-USD", "SOL-USD"));
        registry.add(EndpointKind.PUBLIC, Channel.CANDLES, List.of("BTC-USD"));

        assertEquals(List.of("BTC-USD", "ETH-USD", "SOL-USD"),
            registry.snapshot(EndpointKind.PUBLIC).get(Channel.CANDLES));
        assertEquals(3, registry.size(EndpointKind.PUBLIC));
    }

    @Test
    void testAddWithEmptyListCreatesEntry() {
        registry.add(EndpointKind.PUBLIC, Channel.HEARTBEATS, List.of());

        assertEquals(Map.of(Channel.HEARTBEATS, List.of()), registry.snapshot(EndpointKind.PUBLIC));
    }

    @Test
    void testRemoveDeletesOnlyNamedIdsAndKeepsEntry() {
        registry.add(EndpointKind.PUBLIC, Channel.TICKER, List.of("BTC-USD", "ETH-USD"));

        registry.remove(EndpointKind.PUBLIC, Channel.TICKER, List.of("ETH-USD", "DOGE-USD"));
        assertEquals(Map.of(Channel.TICKER, List.of("BTC-USD")), registry.snapshot(EndpointKind.PUBLIC));

        registry.remove(EndpointKind.PUBLIC, Channel.TICKER, List.of("BTC-USD"));
        assertEquals(Map.of(Channel.TICKER, List.of()), registry.snapshot(EndpointKind.PUBLIC));
    }

    @Test
    void testRemoveFromMissingEntryIsNoOp() {
        registry.remove(EndpointKind.USER, Channel.USER, List.of("BTC-USD"));

        assertTrue(registry.snapshot(EndpointKind.USER).isEmpty());
    }

    @Test
    void testSnapshotIsImmutableCopy() {
        registry.add(EndpointKind.PUBLIC, Channel.CANDLES, List.of("BTC-USD"));
        Map<Channel, List<String>> snapshot = registry.snapshot(EndpointKind.PUBLIC);

        registry.add(EndpointKind.PUBLIC, Channel.CANDLES, List.of("ETH-USD"));

        assertEquals(List.of("BTC-USD"), snapshot.get(Channel.CANDLES));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put(Channel.STATUS, List.of()));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.get(Channel.CANDLES).add("X"));
    }

    @Test
    void testEndpointsAreSeparate() {
        registry.add(EndpointKind.PUBLIC, Channel.CANDLES, List.of("BTC-USD"));
        registry.add(EndpointKind.USER, Channel.USER, List.of("ETH-USD"));

        assertEquals(Map.of(Channel.CANDLES, List.of("BTC-USD")), registry.snapshot(EndpointKind.PUBLIC));
        assertEquals(Map.of(Channel.USER, List.of("ETH-USD")), registry.snapshot(EndpointKind.USER));
    }

    @Test
    void testConcurrentAddsKeepEveryProduct() throws Exception {
        int threads = 8;
        int perThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int offset = t * perThread;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        registry.add(EndpointKind.PUBLIC, Channel.CANDLES, List.of("P-" + (offset + i)));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, registry.size(EndpointKind.PUBLIC));
    }
}
