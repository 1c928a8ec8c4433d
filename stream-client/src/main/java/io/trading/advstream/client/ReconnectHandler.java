package io.trading.advstream.client;

import io.trading.advstream.protocol.model.EndpointKind;
import io.trading.advstream.ratelimit.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Handles reconnection of one endpoint with exponential backoff.
 *
 * A reconnect cycle is a bounded loop of at most {@code maxRetries} attempts. Before attempt
 * {@code n} the handler sleeps {@link #delayFor(int) delayFor(n)}, i.e. 2 s, 4 s, 8 s, ...
 * capped at 60 s. An attempt fails by throwing {@link ConnectionException}; any other
 * exception ends the cycle immediately.
 */
public class ReconnectHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectHandler.class);

    static final Duration INITIAL_DELAY = Duration.ofSeconds(2);
    static final Duration MAX_DELAY = Duration.ofSeconds(60);
    private static final int BACKOFF_MULTIPLIER = 2;

    private final EndpointKind endpoint;
    private final int maxRetries;
    private final BackoffMode backoffMode;
    private final TimeSource timeSource;

    private int retryCount = 0;

    /**
     * Creates a new reconnect handler.
     *
     * @param endpoint    Endpoint being reconnected, for logging and errors
     * @param maxRetries  Maximum number of attempts per cycle (0 disables reconnection)
     * @param backoffMode Whether attempts carry over between cycles
     * @param timeSource  Sleeper used between attempts
     */
    public ReconnectHandler(EndpointKind endpoint, int maxRetries, BackoffMode backoffMode, TimeSource timeSource) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        this.endpoint = endpoint;
        this.maxRetries = maxRetries;
        this.backoffMode = backoffMode;
        this.timeSource = timeSource;
    }

    /**
     * Delay slept before the given attempt (1-based).
     */
    public static Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
        long delayMs = INITIAL_DELAY.toMillis();
        for (int i = 1; i < attempt && delayMs < MAX_DELAY.toMillis(); i++) {
            delayMs *= BACKOFF_MULTIPLIER;
        }
        return Duration.ofMillis(Math.min(delayMs, MAX_DELAY.toMillis()));
    }

    /**
     * Runs one reconnect cycle.
     *
     * @param action Opens the connection and restores its state
     * @return the result of the first successful attempt
     * @throws ConnectionException if every attempt failed or reconnection is disabled
     * @throws InterruptedException if interrupted while waiting
     */
    public synchronized <T> T reconnect(ConnectAction<T> action) throws InterruptedException {
        if (maxRetries == 0) {
            throw new ConnectionException(endpoint, "Reconnect disabled (maxRetries = 0)");
        }
        if (backoffMode == BackoffMode.RESET_EACH_CYCLE) {
            retryCount = 0;
        }

        ConnectionException lastError = null;
        for (int cycleAttempt = 1; cycleAttempt <= maxRetries; cycleAttempt++) {
            retryCount++;
            Duration delay = delayFor(retryCount);
            LOGGER.info("{}: Scheduling reconnect attempt {}/{} in {} ms",
                endpoint, cycleAttempt, maxRetries, delay.toMillis());
            timeSource.sleep(delay);

            try {
                LOGGER.info("{}: Attempting reconnection #{}", endpoint, retryCount);
                T result = action.connect(cycleAttempt);
                LOGGER.info("{}: Reconnected after {} attempt(s)", endpoint, cycleAttempt);
                return result;
            } catch (ConnectionException e) {
                LOGGER.warn("{}: Reconnect attempt {} failed: {}", endpoint, cycleAttempt, e.getMessage());
                lastError = e;
            }
        }

        LOGGER.error("{}: Max reconnect retries ({}) reached, giving up", endpoint, maxRetries);
        throw new ConnectionException(endpoint, "Reconnect failed after " + maxRetries + " attempts", lastError);
    }

    /**
     * Resets the carried attempt counter.
     */
    public synchronized void reset() {
        retryCount = 0;
        LOGGER.debug("{}: Reconnect state reset", endpoint);
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public BackoffMode getBackoffMode() {
        return backoffMode;
    }

    /**
     * One reconnect attempt.
     */
    @FunctionalInterface
    public interface ConnectAction<T> {
        /**
         * @param attempt 1-based attempt number within the current cycle
         * @throws ConnectionException if the attempt failed and may be retried
         */
        T connect(int attempt) throws InterruptedException;
    }
}
