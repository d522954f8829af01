package com.barvault.dataservice.ratelimit;

import com.barvault.dataservice.exception.CatalogException;
import com.barvault.dataservice.exception.ProviderUnavailableException;
import com.barvault.dataservice.exception.RateLimitExceededException;
import com.barvault.dataservice.exception.RemoteDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Bounded exponential backoff. Only retryable errors consume a retry; anything else
 * surfaces on the first occurrence.
 *
 * With the defaults (3 retries, 2 s base, x2) an operation gets up to 4 attempts,
 * waiting 2 s, 4 s and 8 s between them.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(2);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    /**
     * One attempt of the wrapped operation. {@code attempt} starts at 1.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T call(int attempt) throws Exception;
    }

    /**
     * Notified before each backoff wait.
     */
    @FunctionalInterface
    public interface RetryListener {
        RetryListener NONE = (retryNumber, delay, error) -> { };

        void onRetry(int retryNumber, Duration delay, Exception error);
    }

    private final int maxRetries;
    private final Duration baseDelay;
    private final double multiplier;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, Duration baseDelay, double multiplier) {
        this(maxRetries, baseDelay, multiplier, Sleeper.SYSTEM);
    }

    public RetryPolicy(int maxRetries, Duration baseDelay, double multiplier, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.sleeper = sleeper;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MULTIPLIER);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Backoff before retry number {@code retryNumber} (1-based).
     */
    public Duration delayForRetry(int retryNumber) {
        double factor = Math.pow(multiplier, retryNumber - 1);
        return Duration.ofMillis(Math.round(baseDelay.toMillis() * factor));
    }

    public boolean isRetryable(Throwable error) {
        if (error instanceof RateLimitExceededException) {
            return true;
        }
        if (error instanceof RemoteDataException remote) {
            return remote.isRetryable();
        }
        return error instanceof TimeoutException || error instanceof IOException;
    }

    public <T> T execute(Attempt<T> operation) throws CatalogException {
        return execute(operation, RetryListener.NONE);
    }

    /**
     * Run the operation until it succeeds, fails fatally, or retries run out.
     *
     * @throws ProviderUnavailableException when retryable failures exhaust the policy
     * @throws CatalogException             the fatal error itself, or a fatal
     *                                      {@link RemoteDataException} wrapping a non-catalog error
     */
    public <T> T execute(Attempt<T> operation, RetryListener listener) throws CatalogException {
        Exception lastError = null;
        for (int attempt = 1; attempt <= getMaxAttempts(); attempt++) {
            try {
                return operation.call(attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderUnavailableException("Interrupted during attempt " + attempt, attempt, e);
            } catch (Exception e) {
                if (!isRetryable(e)) {
                    log.warn("Attempt {} failed with non-retryable error: {}", attempt, e.getMessage());
                    if (e instanceof CatalogException catalogError) {
                        throw catalogError;
                    }
                    throw new RemoteDataException(e.getMessage(), false, e);
                }
                lastError = e;
                if (attempt == getMaxAttempts()) {
                    break;
                }

                Duration delay = delayForRetry(attempt);
                if (e instanceof RateLimitExceededException rateLimited
                        && rateLimited.getRetryAfterMs() > delay.toMillis()) {
                    delay = Duration.ofMillis(rateLimited.getRetryAfterMs());
                }
                log.warn("Attempt {}/{} failed: {}. Retrying in {} ms",
                    attempt, getMaxAttempts(), e.getMessage(), delay.toMillis());
                listener.onRetry(attempt, delay, e);
                try {
                    sleeper.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ProviderUnavailableException("Interrupted while waiting to retry", attempt, ie);
                }
            }
        }

        String detail = lastError == null ? "unknown error" : lastError.getMessage();
        throw new ProviderUnavailableException(
            "Remote fetch failed after " + getMaxAttempts() + " attempts. Last error: " + detail,
            getMaxAttempts(), lastError);
    }
}
