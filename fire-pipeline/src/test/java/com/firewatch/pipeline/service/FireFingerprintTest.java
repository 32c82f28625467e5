package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.ValidatedFireEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.firewatch.pipeline.FireFixtures.rawFire;
import static org.assertj.core.api.Assertions.assertThat;

class FireFingerprintTest {

    private final FireEventValidator validator = new FireEventValidator();
    private final FireFingerprint fingerprint = new FireFingerprint();

    @Test
    @DisplayName("Should build lat_lon_date_time from a validated detection")
    void shouldBuildFingerprint() {
        ValidatedFireEvent event = validator.validate(rawFire().build());

        assertThat(fingerprint.fingerprint(event)).isEqualTo("37.7749_-122.4194_2024-01-15_1430");
    }

    @Test
    @DisplayName("Should be identical for coordinate jitter below the rounding scale")
    void shouldCollapseJitter() {
        ValidatedFireEvent a = validator.validate(rawFire(37.77491, -122.41939));
        ValidatedFireEvent b = validator.validate(rawFire(37.77489, -122.41941));

        assertThat(fingerprint.fingerprint(a)).isEqualTo(fingerprint.fingerprint(b));
    }

    @Test
    @DisplayName("Should ignore everything but position and acquisition time")
    void shouldIgnoreNonKeyFields() {
        ValidatedFireEvent original = validator.validate(rawFire().build());
        ValidatedFireEvent redetected = validator.validate(rawFire()
                .frp("48.9")
                .brightness("367.1")
                .confidence("high")
                .satellite("J1")
                .instrument("MODIS")
                .daynight("N")
                .build());

        assertThat(fingerprint.fingerprint(redetected)).isEqualTo(fingerprint.fingerprint(original));
    }

    @Test
    @DisplayName("Should differ when the acquisition time differs")
    void shouldSeparatePasses() {
        ValidatedFireEvent first = validator.validate(rawFire().acqTime("1430").build());
        ValidatedFireEvent second = validator.validate(rawFire().acqTime("1431").build());

        assertThat(fingerprint.fingerprint(first)).isNotEqualTo(fingerprint.fingerprint(second));
    }

    @Test
    @DisplayName("Should round half-up and always print four decimals")
    void shouldRoundHalfUp() {
        LocalDate date = LocalDate.of(2024, 1, 15);

        assertThat(fingerprint.fingerprint(10.00005, 20, date, "0045")).isEqualTo("10.0001_20.0000_2024-01-15_0045");
        assertThat(fingerprint.fingerprint(-0.00001, 0.00001, date, "0000")).isEqualTo("0.0000_0.0000_2024-01-15_0000");
    }

    @Test
    @DisplayName("Should be deterministic across repeated calls")
    void shouldBeDeterministic() {
        ValidatedFireEvent event = validator.validate(rawFire().build());

        assertThat(fingerprint.fingerprint(event)).isEqualTo(fingerprint.fingerprint(event));
    }
}
