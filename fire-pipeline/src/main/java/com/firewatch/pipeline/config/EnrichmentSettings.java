package com.firewatch.pipeline.config;

import java.time.Duration;

/**
 * @param apiKey BigDataCloud key, null for the unauthenticated (lower quota) tier
 */
public record EnrichmentSettings(
        String baseUrl,
        String apiKey,
        String localityLanguage,
        Duration timeout,
        int maxAttempts,
        Duration initialBackoff,
        double backoffMultiplier
) {
    public EnrichmentSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
    }
}
