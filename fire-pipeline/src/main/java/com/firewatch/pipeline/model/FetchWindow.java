package com.firewatch.pipeline.model;

import java.time.Duration;

/**
 * Trailing time window covered by one fetch.
 * The FIRMS area API only accepts whole days, 1 to 10.
 */
public record FetchWindow(Duration trailing) {

    public static final int MAX_DAY_RANGE = 10;

    public static FetchWindow ofHours(long hours) {
        return new FetchWindow(Duration.ofHours(hours));
    }

    public int dayRange() {
        long hours = Math.max(1, trailing.toHours());
        long days = (hours + 23) / 24;
        return (int) Math.min(MAX_DAY_RANGE, Math.max(1, days));
    }
}
