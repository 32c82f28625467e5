package com.firewatch.pipeline.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * A {@link RawFireEvent} that passed validation, with every field in its typed form.
 * Acquisition date and time are UTC.
 */
public record ValidatedFireEvent(
        RawFireEvent raw,
        double latitude,
        double longitude,
        Double brightness,
        Confidence confidence,
        double frp,
        LocalDate acquisitionDate,
        LocalTime acquisitionTime,
        String satellite,
        String instrument,
        DayNight dayNight
) {
    private static final DateTimeFormatter HHMM = DateTimeFormatter.ofPattern("HHmm");

    public String acquisitionTimeHhmm() {
        return acquisitionTime.format(HHMM);
    }

    public long epochSeconds() {
        return acquisitionDate.atTime(acquisitionTime).toEpochSecond(ZoneOffset.UTC);
    }
}
