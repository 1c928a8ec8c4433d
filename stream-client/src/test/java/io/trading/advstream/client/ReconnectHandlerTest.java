package io.trading.advstream.client;

import io.trading.advstream.protocol.model.EndpointKind;
import io.trading.advstream.ratelimit.ManualTimeSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectHandlerTest {

    private final ManualTimeSource time = new ManualTimeSource();

    @Test
    void testDelayScheduleIsExponentialAndCapped() {
        assertEquals(Duration.ofSeconds(2), ReconnectHandler.delayFor(1));
        assertEquals(Duration.ofSeconds(4), ReconnectHandler.delayFor(2));
        assertEquals(Duration.ofSeconds(8), ReconnectHandler.delayFor(3));
        assertEquals(Duration.ofSeconds(16), ReconnectHandler.delayFor(4));
        assertEquals(Duration.ofSeconds(32), ReconnectHandler.delayFor(5));
        assertEquals(Duration.ofSeconds(60), ReconnectHandler.delayFor(6));
        assertEquals(Duration.ofSeconds(60), ReconnectHandler.delayFor(1000));
        assertThrows(IllegalArgumentException.class, () -> ReconnectHandler.delayFor(0));
    }

    @Test
    void testSucceedsAfterFailures() throws InterruptedException {
        ReconnectHandler handler = new ReconnectHandler(EndpointKind.PUBLIC, 5, BackoffMode.RESET_EACH_CYCLE, time);
        AtomicInteger calls = new AtomicInteger();

        String result = handler.reconnect(attempt -> {
            if (calls.incrementAndGet() < 3) {
                throw new ConnectionException(EndpointKind.PUBLIC, "refused");
            }
            return "connected on " + attempt;
        });

        assertEquals("connected on 3", result);
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)), time.sleeps());
    }

    @Test
    void testExhaustionThrowsConnectionException() {
        ReconnectHandler handler = new ReconnectHandler(EndpointKind.USER, 3, BackoffMode.RESET_EACH_CYCLE, time);
        AtomicInteger calls = new AtomicInteger();

        ConnectionException e = assertThrows(ConnectionException.class, () -> handler.reconnect(attempt -> {
            calls.incrementAndGet();
            throw new ConnectionException(EndpointKind.USER, "refused");
        }));

        assertEquals(3, calls.get());
        assertEquals(EndpointKind.USER, e.getEndpoint());
        assertInstanceOf(ConnectionException.class, e.getCause());
        assertEquals(Duration.ofSeconds(14), time.totalSlept());
    }

    @Test
    void testZeroRetriesIsImmediatelyFatal() {
        ReconnectHandler handler = new ReconnectHandler(EndpointKind.PUBLIC, 0, BackoffMode.RESET_EACH_CYCLE, time);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ConnectionException.class, () -> handler.reconnect(attempt -> calls.incrementAndGet()));
        assertEquals(0, calls.get());
        assertTrue(time.sleeps().isEmpty());
    }

    @Test
    void testOtherErrorsAreNotRetried() {
        ReconnectHandler handler = new ReconnectHandler(EndpointKind.USER, 5, BackoffMode.RESET_EACH_CYCLE, time);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(AuthenticationException.class, () -> handler.reconnect(attempt -> {
            calls.incrementAndGet();
            throw new AuthenticationException("bad key");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void testResetEachCycleStartsOver() throws InterruptedException {
        ReconnectHandler handler = new ReconnectHandler(EndpointKind.PUBLIC, 5, BackoffMode.RESET_EACH_CYCLE, time);

        handler.reconnect(attempt -> attempt);
        handler.reconnect(attempt -> attempt);

        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(2)), time.sleeps());
    }

    @Test
    void testCarryOverKeepsBackingOffUntilReset() throws InterruptedException {
        ReconnectHandler handler = new ReconnectHandler(EndpointKind.PUBLIC, 5, BackoffMode.CARRY_OVER, time);

        handler.reconnect(attempt -> attempt);
        handler.reconnect(attempt -> attempt);
        assertEquals(2, handler.getRetryCount());

        handler.reset();
        handler.reconnect(attempt -> attempt);

        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(2)), time.sleeps());
    }
}
