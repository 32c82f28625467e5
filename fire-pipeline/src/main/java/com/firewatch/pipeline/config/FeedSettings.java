package com.firewatch.pipeline.config;

import java.time.Duration;

/**
 * Everything the fetch stage needs, resolved once at wiring time.
 *
 * @param mapKey FIRMS map key, null when not configured
 */
public record FeedSettings(
        String baseUrl,
        String mapKey,
        String source,
        String area,
        int batchSize,
        Duration timeout
) {
    static final String PLACEHOLDER_MAP_KEY = "YOUR_MAP_KEY_HERE";

    public FeedSettings {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
    }

    public boolean isConfigured() {
        return mapKey != null && !mapKey.isBlank() && !PLACEHOLDER_MAP_KEY.equals(mapKey);
    }
}
