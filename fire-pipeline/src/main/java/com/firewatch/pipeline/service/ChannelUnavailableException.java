package com.firewatch.pipeline.service;

/**
 * A transport channel (batch ingress, dead-letter, mutation stream, alerts) refused a publish.
 * When this escapes the process stage the whole batch is redelivered.
 */
public class ChannelUnavailableException extends RuntimeException {

    public ChannelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
