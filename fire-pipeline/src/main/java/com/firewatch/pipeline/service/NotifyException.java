package com.firewatch.pipeline.service;

public class NotifyException extends RuntimeException {

    public NotifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
