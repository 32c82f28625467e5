package com.firewatch.pipeline.service;

/**
 * Retryable storage failure (lost connection, lock timeout, serialization failure).
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
