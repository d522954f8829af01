package com.barvault.dataservice.exception;

/**
 * Base exception for bar store, cache and fetch operations.
 */
public class CatalogException extends Exception {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
