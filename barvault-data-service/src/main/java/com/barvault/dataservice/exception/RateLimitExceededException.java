package com.barvault.dataservice.exception;

/**
 * The provider rejected a request because its quota was exceeded.
 */
public class RateLimitExceededException extends CatalogException {

    private final long retryAfterMs;

    public RateLimitExceededException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = retryAfterMs;
    }

    /** Minimum wait before the next attempt, 0 if the provider gave no hint. */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
