package com.barvault.dataservice.exception;

/**
 * The remote provider could not be reached, or kept failing until retries ran out.
 */
public class ProviderUnavailableException extends CatalogException {

    private final int attempts;

    public ProviderUnavailableException(String message, int attempts, Throwable lastError) {
        super(message, lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
