package com.barvault.dataservice.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Sliding-window rate limiter: at most N requests in any window-length interval.
 * Callers waiting for a slot sleep outside the lock.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final int maxRequests;
    private final Duration window;
    private final long windowNs;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;
    private final Deque<Long> grants = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxRequests, Duration window, LongSupplier nanoTime, Sleeper sleeper) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1, got " + maxRequests);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.windowNs = window.toNanos();
        this.nanoTime = nanoTime;
        this.sleeper = sleeper;
    }

    static int effectiveLimit(int providerLimit, double safetyFraction) {
        if (safetyFraction <= 0 || safetyFraction > 1) {
            throw new IllegalArgumentException("safetyFraction must be in (0, 1], got " + safetyFraction);
        }
        return Math.max(1, (int) Math.floor(providerLimit * safetyFraction));
    }

    @Override
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNs = tryGrant();
            if (waitNs == 0) {
                return;
            }
            log.trace("Rate limit reached, waiting {} ms", toMillisCeil(waitNs));
            sleeper.sleep(toMillisCeil(waitNs));
        }
    }

    @Override
    public boolean tryAcquire(long timeoutMs) throws InterruptedException {
        long deadline = nanoTime.getAsLong() + timeoutMs * 1_000_000L;
        while (true) {
            long waitNs = tryGrant();
            if (waitNs == 0) {
                return true;
            }
            long remaining = deadline - nanoTime.getAsLong();
            if (waitNs > remaining) {
                return false;
            }
            sleeper.sleep(toMillisCeil(waitNs));
        }
    }

    @Override
    public int getRequestsPerWindow() {
        return maxRequests;
    }

    @Override
    public Duration getWindow() {
        return window;
    }

    /**
     * Requests granted within the current window.
     */
    public synchronized int inFlightCount() {
        evict(nanoTime.getAsLong());
        return grants.size();
    }

    /**
     * Record a grant if a slot is free.
     *
     * @return 0 if granted, otherwise nanoseconds until the oldest grant leaves the window
     */
    private synchronized long tryGrant() {
        long now = nanoTime.getAsLong();
        evict(now);
        if (grants.size() < maxRequests) {
            grants.addLast(now);
            return 0;
        }
        return Math.max(1, grants.peekFirst() + windowNs - now);
    }

    private void evict(long now) {
        while (!grants.isEmpty() && grants.peekFirst() <= now - windowNs) {
            grants.removeFirst();
        }
    }

    private static long toMillisCeil(long nanos) {
        return Math.max(1, (nanos + 999_999) / 1_000_000);
    }
}
