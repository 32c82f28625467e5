package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.Confidence;
import com.firewatch.pipeline.model.DayNight;
import com.firewatch.pipeline.model.RawFireEvent;
import com.firewatch.pipeline.model.ValidatedFireEvent;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/**
 * Normalises raw FIRMS detections and rejects malformed ones.
 *
 * Rejections carry a short reason string that ends up on the dead-letter record,
 * e.g. "latitude out of range". No side effects.
 */
@Component
public class FireEventValidator {

    public ValidatedFireEvent validate(RawFireEvent raw) {
        if (raw == null) {
            throw new ValidationException("empty record");
        }

        double latitude = requireCoordinate(raw.getLatitude(), "latitude", 90);
        double longitude = requireCoordinate(raw.getLongitude(), "longitude", 180);

        LocalDate acqDate = parseDate(raw.getAcqDate());
        LocalTime acqTime = parseTime(raw.getAcqTime());

        Confidence confidence = Confidence.parse(raw.getConfidence())
                .orElseThrow(() -> new ValidationException("unrecognized confidence"));

        double frp = parseFrp(raw.getFrp());

        // brightness is informational, an unreadable value is dropped
        Double brightness = parseNumber(raw.getBrightness());

        return new ValidatedFireEvent(
                raw,
                latitude,
                longitude,
                brightness,
                confidence,
                frp,
                acqDate,
                acqTime,
                emptyToNull(raw.getSatellite()),
                emptyToNull(raw.getInstrument()),
                DayNight.parse(raw.getDaynight()).orElse(null)
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private double requireCoordinate(String text, String name, double bound) {
        if (text == null || text.isBlank()) {
            throw new ValidationException(name + " missing");
        }
        Double value = parseNumber(text);
        if (value == null) {
            throw new ValidationException(name + " unparseable");
        }
        if (value < -bound || value > bound) {
            throw new ValidationException(name + " out of range");
        }
        return value;
    }

    private double parseFrp(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        Double value = parseNumber(text);
        if (value == null) {
            throw new ValidationException("fire radiative power unparseable");
        }
        if (value < 0) {
            throw new ValidationException("fire radiative power negative");
        }
        return value;
    }

    /** Finite number or null. */
    private Double parseNumber(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(text.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("acquisition date missing");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("unparseable acquisition date");
        }
    }

    /**
     * FIRMS sends HHMM; JSON consumers sometimes turn "0430" into 430.
     */
    private LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("acquisition time missing");
        }
        String digits = value.trim();
        if (!digits.matches("\\d{1,4}")) {
            throw new ValidationException("unparseable acquisition time");
        }
        String padded = "0".repeat(4 - digits.length()) + digits;
        try {
            return LocalTime.of(
                    Integer.parseInt(padded.substring(0, 2)),
                    Integer.parseInt(padded.substring(2)));
        } catch (DateTimeException e) {
            throw new ValidationException("unparseable acquisition time");
        }
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }
}
