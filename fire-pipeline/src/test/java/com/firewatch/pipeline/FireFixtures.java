package com.firewatch.pipeline;

import com.firewatch.pipeline.model.Confidence;
import com.firewatch.pipeline.model.DayNight;
import com.firewatch.pipeline.model.FireRecord;
import com.firewatch.pipeline.model.RawFireEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Sample detections shared across tests.
 */
public final class FireFixtures {

    public static final Instant NOW = Instant.parse("2024-01-15T15:00:00Z");

    private FireFixtures() {
    }

    /** A well-formed VIIRS detection over San Francisco, 2024-01-15 14:30 UTC. */
    public static RawFireEvent.RawFireEventBuilder rawFire() {
        return RawFireEvent.builder()
                .latitude("37.7749")
                .longitude("-122.4194")
                .brightness("330.2")
                .confidence("nominal")
                .frp("12.5")
                .acqDate("2024-01-15")
                .acqTime("1430")
                .satellite("N")
                .instrument("VIIRS")
                .daynight("D");
    }

    public static RawFireEvent rawFire(double latitude, double longitude) {
        return rawFire().latitude(String.valueOf(latitude)).longitude(String.valueOf(longitude)).build();
    }

    /** A stored-looking record with the given fingerprint and country. */
    public static FireRecord.FireRecordBuilder record(String fireId, String country) {
        return FireRecord.builder()
                .fireId(fireId)
                .latitude(37.7749)
                .longitude(-122.4194)
                .brightness(330.2)
                .confidence(Confidence.NOMINAL)
                .frp(12.5)
                .acqDate(LocalDate.of(2024, 1, 15))
                .acqTime("1430")
                .satellite("N")
                .instrument("VIIRS")
                .dayNight(DayNight.D)
                .timestamp(Instant.parse("2024-01-15T14:30:00Z").getEpochSecond())
                .locationCountry(country);
    }

    /**
     * Clock whose instant tests can move forward.
     */
    public static final class MutableClock extends Clock {

        private volatile Instant instant;

        public MutableClock(Instant start) {
            this.instant = start;
        }

        public void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
