package com.codescout.core.ratelimit;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Token bucket for one external-call category.
 * <p>
 * Tokens are refilled lazily from elapsed monotonic time on every access; there
 * is no background timer. Blocking callers queue in arrival order and only the
 * head of the queue may take a token, so a steady stream of {@link #tryAcquire()}
 * calls cannot starve a waiter.
 */
public class RateBucket {

    /** Absorbs floating-point drift when refill lands exactly on a whole token. */
    private static final double EPSILON = 1e-9;

    private final String category;
    private final double capacity;
    private final double refillPerSecond;
    private final LongSupplier nanoClock;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition changed = lock.newCondition();
    private final Deque<Object> waiters = new ArrayDeque<>();

    private double tokens;
    private long lastRefillNanos;

    public RateBucket(String category, int capacity, double refillPerSecond) {
        this(category, capacity, refillPerSecond, System::nanoTime);
    }

    RateBucket(String category, int capacity, double refillPerSecond, LongSupplier nanoClock) {
        if (capacity <= 0 || refillPerSecond <= 0) {
            throw new IllegalArgumentException("capacity and refill rate must be positive");
        }
        this.category = category;
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public String category() {
        return category;
    }

    public int capacity() {
        return (int) capacity;
    }

    public double refillPerSecond() {
        return refillPerSecond;
    }

    /**
     * Takes a token if one is available and nobody is queued ahead.
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill(nanoClock.getAsLong());
            if (waiters.isEmpty() && tokens + EPSILON >= 1.0) {
                take();
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes a token, waiting in FIFO order up to {@code maxWait}. Fails
     * immediately once the time until the next token exceeds the remaining budget.
     *
     * @return how long the caller waited
     * @throws RateLimitExceededException if no token can be had within {@code maxWait}
     * @throws InterruptedException       if interrupted while queued
     */
    public Duration acquire(Duration maxWait) throws InterruptedException {
        long start = nanoClock.getAsLong();
        long deadline = start + maxWait.toNanos();
        Object ticket = new Object();
        lock.lockInterruptibly();
        try {
            waiters.addLast(ticket);
            try {
                while (true) {
                    long now = nanoClock.getAsLong();
                    refill(now);
                    boolean head = waiters.peekFirst() == ticket;
                    if (head && tokens + EPSILON >= 1.0) {
                        take();
                        return Duration.ofNanos(Math.max(0, now - start));
                    }
                    long remaining = deadline - now;
                    long needed = head ? nanosUntilToken() : remaining;
                    if (remaining <= 0 || (head && needed > remaining)) {
                        throw new RateLimitExceededException(category, maxWait);
                    }
                    changed.awaitNanos(Math.max(1, Math.min(needed, remaining)));
                }
            } finally {
                waiters.remove(ticket);
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public double availableTokens() {
        lock.lock();
        try {
            refill(nanoClock.getAsLong());
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public int queuedWaiters() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    private void take() {
        tokens = Math.max(0.0, tokens - 1.0);
    }

    private void refill(long now) {
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * refillPerSecond / TimeUnit.SECONDS.toNanos(1));
            lastRefillNanos = now;
        }
    }

    private long nanosUntilToken() {
        double missing = 1.0 - tokens;
        if (missing <= EPSILON) {
            return 0;
        }
        return (long) Math.ceil(missing / refillPerSecond * TimeUnit.SECONDS.toNanos(1));
    }
}
