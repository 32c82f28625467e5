package com.firewatch.pipeline.model;

import java.util.Locale;
import java.util.Optional;

public enum DayNight {
    D, N;

    public static Optional<DayNight> parse(String raw) {
        if (raw == null) return Optional.empty();
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "D" -> Optional.of(D);
            case "N" -> Optional.of(N);
            default -> Optional.empty();
        };
    }
}
