package com.firewatch.pipeline.config;

import java.time.Duration;

public record ProcessSettings(int concurrency, int storeMaxAttempts, Duration storeInitialBackoff) {

    public ProcessSettings {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, was " + concurrency);
        }
        if (storeMaxAttempts < 1) {
            throw new IllegalArgumentException("storeMaxAttempts must be >= 1, was " + storeMaxAttempts);
        }
    }
}
