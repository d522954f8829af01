package com.barvault.dataservice.ratelimit;

import java.time.Duration;

/**
 * Bounds outbound requests to the remote provider.
 * One instance is shared by every fetch in the process.
 */
public interface RateLimiter {

    /**
     * Acquire permission to make a request.
     * Blocks until a slot is free.
     */
    void acquire() throws InterruptedException;

    /**
     * Acquire permission with timeout.
     *
     * @param timeoutMs Maximum time to wait in milliseconds
     * @return true if permission was acquired, false if timeout
     */
    boolean tryAcquire(long timeoutMs) throws InterruptedException;

    /**
     * Requests allowed per window after the safety margin is applied.
     */
    int getRequestsPerWindow();

    Duration getWindow();

    /**
     * Sliding window limited to {@code floor(providerLimit * safetyFraction)} requests per window.
     */
    static RateLimiter slidingWindow(int providerLimit, double safetyFraction, Duration window) {
        return new SlidingWindowRateLimiter(SlidingWindowRateLimiter.effectiveLimit(providerLimit, safetyFraction),
            window, System::nanoTime, Sleeper.SYSTEM);
    }
}
