package io.trading.advstream.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket rate limiter for outbound control messages.
 *
 * The bucket starts full. Tokens refill continuously at {@code refillRate} per second and
 * never exceed {@code maxTokens}. Refill and deduction happen in one critical section;
 * waiting for a token happens outside of it so other callers can still refill.
 *
 * One instance is owned per traffic class (here: per endpoint). Instances are never shared
 * implicitly.
 */
public class TokenBucket {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenBucket.class);

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final String name;
    private final double maxTokens;
    private final double refillRate;
    private final TimeSource timeSource;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillNanos;

    /**
     * Creates a new token bucket.
     *
     * @param name       Friendly name for logging
     * @param maxTokens  Capacity of the bucket, also the initial fill
     * @param refillRate Tokens added per second
     * @param timeSource Clock and sleeper
     */
    public TokenBucket(String name, double maxTokens, double refillRate, TimeSource timeSource) {
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be at least 1");
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("refillRate must be positive");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.name = name;
        this.maxTokens = maxTokens;
        this.refillRate = refillRate;
        this.timeSource = timeSource;
        this.tokens = maxTokens;
        this.lastRefillNanos = timeSource.nanoTime();
    }

    /**
     * Blocks until a token is available, then takes it.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void consume() throws InterruptedException {
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                refill();
                if (tokens >= 1) {
                    tokens -= 1;
                    return;
                }
                waitNanos = (long) Math.ceil((1 - tokens) / refillRate * NANOS_PER_SECOND);
            } finally {
                lock.unlock();
            }
            LOGGER.debug("{}: Rate limit reached, waiting {} ns for a token", name, waitNanos);
            // The sleep may be shorter or longer than asked; the next pass refills again
            timeSource.sleepNanos(Math.max(1, waitNanos));
        }
    }

    /**
     * Takes a token if one is available right now.
     *
     * @return true if a token was taken
     */
    public boolean tryConsume() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1) {
                tokens -= 1;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the tokens currently available after refilling.
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public double getMaxTokens() {
        return maxTokens;
    }

    public double getRefillRate() {
        return refillRate;
    }

    private void refill() {
        long now = timeSource.nanoTime();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(maxTokens, tokens + elapsed / NANOS_PER_SECOND * refillRate);
            lastRefillNanos = now;
        }
    }
}
