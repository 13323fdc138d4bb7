package com.quoteterm.ratelimit;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token bucket with continuous refill and a burst cap.
 *
 * <p>Refill is computed from the elapsed time at every acquisition attempt, so an idle bucket
 * costs nothing: there is no timer thread. The bucket starts full.
 *
 * <p>Waiters queue on a fair lock and the head waiter sleeps while holding it, so permits are
 * granted in arrival order and every waiter eventually gets one. Nobody else could obtain a
 * token during that sleep anyway, so holding the lock does not reduce throughput.
 *
 * <p>Invariant: {@code 0 <= tokens <= burst}.
 */
public class TokenBucket {

    private static final Logger log = LoggerFactory.getLogger(TokenBucket.class);

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final double tokensPerSecond;
    private final int burst;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock(true);

    /** Guarded by {@link #lock}. */
    private double tokens;

    /** Guarded by {@link #lock}. */
    private long lastRefillNanos;

    /** Whole tokens as of the last change under the lock; read without locking. */
    private volatile int observedTokens;

    public TokenBucket(double tokensPerSecond, int burst) {
        this(tokensPerSecond, burst, System::nanoTime, Sleeper.SYSTEM);
    }

    public TokenBucket(double tokensPerSecond, int burst, LongSupplier nanoClock, Sleeper sleeper) {
        if (tokensPerSecond <= 0) {
            throw new IllegalArgumentException("tokensPerSecond must be positive: " + tokensPerSecond);
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be at least 1: " + burst);
        }
        this.tokensPerSecond = tokensPerSecond;
        this.burst = burst;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.tokens = burst;
        this.observedTokens = burst;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Takes one token, waiting for the refill if the bucket is empty.
     *
     * @return how long the caller waited
     * @throws InterruptedException if interrupted while queued or waiting for a refill
     */
    public Duration acquire() throws InterruptedException {
        long start = nanoClock.getAsLong();
        lock.lockInterruptibly();
        try {
            while (true) {
                refill();
                if (tokens >= 1d) {
                    take();
                    long waited = nanoClock.getAsLong() - start;
                    if (waited > 0) {
                        log.debug("Rate permit granted after {}ms, {} tokens left", waited / 1_000_000, (int) tokens);
                    }
                    return Duration.ofNanos(Math.max(0, waited));
                }
                long deficitNanos = (long) Math.ceil((1d - tokens) / tokensPerSecond * NANOS_PER_SECOND);
                sleeper.sleep(Duration.ofNanos(Math.max(1, deficitNanos)));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes one token if one is available right now. Returns false without waiting when the
     * bucket is empty or another caller is currently queued.
     */
    public boolean tryAcquire() {
        if (!lock.tryLock()) {
            return false;
        }
        try {
            refill();
            if (tokens >= 1d) {
                take();
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whole tokens currently available. Never blocks: while a waiter holds the lock the value
     * last observed under it is returned.
     */
    public int availableTokens() {
        if (!lock.tryLock()) {
            return observedTokens;
        }
        try {
            refill();
            return observedTokens;
        } finally {
            lock.unlock();
        }
    }

    public double getTokensPerSecond() {
        return tokensPerSecond;
    }

    public int getBurst() {
        return burst;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(burst, tokens + elapsed / NANOS_PER_SECOND * tokensPerSecond);
        lastRefillNanos = now;
        observedTokens = (int) Math.floor(tokens);
    }

    private void take() {
        tokens -= 1d;
        observedTokens = (int) Math.floor(tokens);
    }
}
