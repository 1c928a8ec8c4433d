package io.trading.advstream.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketTest {

    private final ManualTimeSource time = new ManualTimeSource();

    @Test
    void testStartsFull() {
        TokenBucket bucket = new TokenBucket("test", 5, 1, time);

        assertEquals(5.0, bucket.availableTokens(), 1e-9);
        for (int i = 0; i < 5; i++) {
            assertTrue(bucket.tryConsume());
        }
        assertFalse(bucket.tryConsume());
    }

    @Test
    void testRefillsProportionallyToElapsedTime() {
        TokenBucket bucket = new TokenBucket("test", 4, 2, time);
        for (int i = 0; i < 4; i++) {
            assertTrue(bucket.tryConsume());
        }

        time.advance(Duration.ofMillis(500));
        assertEquals(1.0, bucket.availableTokens(), 1e-9);
        assertTrue(bucket.tryConsume());
        assertFalse(bucket.tryConsume());
    }

    @Test
    void testNeverExceedsCapacity() {
        TokenBucket bucket = new TokenBucket("test", 3, 100, time);
        bucket.tryConsume();

        time.advance(Duration.ofHours(1));

        assertEquals(3.0, bucket.availableTokens(), 1e-9);
    }

    @Test
    void testConsumeWaitsForExactlyTheMissingFraction() throws InterruptedException {
        TokenBucket bucket = new TokenBucket("test", 1, 2, time);

        bucket.consume();
        assertTrue(time.sleeps().isEmpty());

        bucket.consume();
        assertEquals(List.of(Duration.ofMillis(500)), time.sleeps());
        assertEquals(0.0, bucket.availableTokens(), 1e-9);
    }

    @Test
    void testLongRunRateIsBoundedByRefillRate() throws InterruptedException {
        TokenBucket bucket = new TokenBucket("test", 10, 10, time);
        long start = time.nanoTime();

        for (int i = 0; i < 110; i++) {
            bucket.consume();
        }

        // 10 from the initial fill, 100 more at 10 per second
        long elapsed = time.nanoTime() - start;
        assertTrue(elapsed >= Duration.ofSeconds(10).toNanos() - 1_000, "elapsed " + elapsed);
        assertTrue(elapsed < Duration.ofMillis(10_010).toNanos(), "elapsed " + elapsed);
    }

    @Test
    void testConsumeIsInterruptible() {
        TokenBucket bucket = new TokenBucket("test", 1, 0.001, TimeSource.SYSTEM);
        assertTrue(bucket.tryConsume());

        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, bucket::consume);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testRejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket("test", 0.5, 1, time));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket("test", 1, 0, time));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket("test", 1, 1, null));
    }
}
