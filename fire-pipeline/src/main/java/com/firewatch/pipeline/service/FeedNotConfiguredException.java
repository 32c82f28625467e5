package com.firewatch.pipeline.service;

/**
 * Raised before any request is made when the FIRMS map key is missing or still the placeholder.
 */
public class FeedNotConfiguredException extends IllegalStateException {

    public FeedNotConfiguredException(String message) {
        super(message);
    }
}
