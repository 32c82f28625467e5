package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.ValidatedFireEvent;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Derives the dedup key for a detection.
 *
 * Format: {lat}_{lon}_{yyyy-MM-dd}_{HHmm}, coordinates rounded half-up to
 * {@value #COORDINATE_SCALE} decimal places (about 11 m at the equator). Raising the
 * scale splits jittered redeliveries into separate fires; lowering it merges
 * neighbouring pixels seen on the same pass.
 */
@Component
public class FireFingerprint {

    public static final int COORDINATE_SCALE = 4;

    public String fingerprint(ValidatedFireEvent event) {
        return fingerprint(event.latitude(), event.longitude(),
                event.acquisitionDate(), event.acquisitionTimeHhmm());
    }

    public String fingerprint(double latitude, double longitude, LocalDate acqDate, String acqTimeHhmm) {
        return round(latitude) + "_" + round(longitude) + "_" + acqDate + "_" + acqTimeHhmm;
    }

    // BigDecimal has no negative zero, so -0.00001 and 0.00001 both render as 0.0000
    private String round(double coordinate) {
        return BigDecimal.valueOf(coordinate)
                .setScale(COORDINATE_SCALE, RoundingMode.HALF_UP)
                .toPlainString();
    }
}
