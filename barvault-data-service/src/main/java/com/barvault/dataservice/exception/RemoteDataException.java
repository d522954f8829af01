package com.barvault.dataservice.exception;

/**
 * Error reported by the remote data provider. Retryable errors are transient
 * (server errors, dropped connections); the rest are fatal (unknown symbol, bad request).
 */
public class RemoteDataException extends CatalogException {

    private final boolean retryable;

    public RemoteDataException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public RemoteDataException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static RemoteDataException transientError(String message) {
        return new RemoteDataException(message, true);
    }

    public static RemoteDataException fatal(String message) {
        return new RemoteDataException(message, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
