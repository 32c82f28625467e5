package com.firewatch.pipeline.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Detection confidence class.
 *
 * VIIRS reports l/n/h, MODIS reports a 0-100 percentage which FIRMS buckets
 * as &lt;30 low, &lt;80 nominal, otherwise high.
 */
public enum Confidence {
    LOW("low"),
    NOMINAL("nominal"),
    HIGH("high");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Confidence> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String value = raw.trim().toLowerCase(Locale.ROOT);

        return switch (value) {
            case "low", "l" -> Optional.of(LOW);
            case "nominal", "n" -> Optional.of(NOMINAL);
            case "high", "h" -> Optional.of(HIGH);
            default -> fromPercentage(value);
        };
    }

    private static Optional<Confidence> fromPercentage(String value) {
        if (!value.matches("\\d{1,3}")) return Optional.empty();
        int pct = Integer.parseInt(value);
        if (pct > 100) return Optional.empty();
        if (pct < 30) return Optional.of(LOW);
        if (pct < 80) return Optional.of(NOMINAL);
        return Optional.of(HIGH);
    }
}
