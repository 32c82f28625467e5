package com.firewatch.pipeline.service;

/**
 * Network error, timeout, 5xx or rate-limit response from the geocoder.
 */
public class TransientEnrichmentException extends RuntimeException {

    public TransientEnrichmentException(String message) {
        super(message);
    }

    public TransientEnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
