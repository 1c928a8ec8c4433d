package io.trading.advstream.ratelimit;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic time source: sleeping advances the clock instantly and is recorded.
 */
public class ManualTimeSource implements TimeSource {

    private long nanos = 1_000_000_000L;
    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public synchronized long nanoTime() {
        return nanos;
    }

    @Override
    public synchronized void sleepNanos(long duration) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException();
        }
        sleeps.add(Duration.ofNanos(duration));
        nanos += duration;
    }

    public synchronized void advance(Duration duration) {
        nanos += duration.toNanos();
    }

    public synchronized List<Duration> sleeps() {
        return new ArrayList<>(sleeps);
    }

    public synchronized Duration totalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
