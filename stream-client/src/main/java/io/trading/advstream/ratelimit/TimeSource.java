package io.trading.advstream.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Monotonic clock and sleeper used by rate limiting and reconnect backoff.
 */
public interface TimeSource {

    /**
     * System clock backed by {@link System#nanoTime()} and {@link Thread#sleep(long, int)}.
     */
    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleepNanos(long nanos) throws InterruptedException {
            if (nanos > 0) {
                TimeUnit.NANOSECONDS.sleep(nanos);
            }
        }
    };

    /**
     * Current monotonic time in nanoseconds. Only differences are meaningful.
     */
    long nanoTime();

    /**
     * Blocks the calling thread for roughly the given time.
     */
    void sleepNanos(long nanos) throws InterruptedException;

    default void sleep(Duration duration) throws InterruptedException {
        sleepNanos(duration.toNanos());
    }
}
