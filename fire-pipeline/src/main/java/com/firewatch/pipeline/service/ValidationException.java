package com.firewatch.pipeline.service;

/**
 * A raw detection that cannot become a {@code FireRecord}. Terminal, never retried.
 */
public class ValidationException extends RuntimeException {

    private final String reason;

    public ValidationException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
