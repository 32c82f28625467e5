package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.FireRecord;
import com.firewatch.pipeline.model.RegionPage;
import com.firewatch.pipeline.output.FireStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Read path for external consumers. The pipeline itself never calls this.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FireQueryService {

    static final Duration DEFAULT_LOOKBACK = Duration.ofDays(7);

    private final FireStore fireStore;
    private final Clock clock;

    /**
     * Fires in a country acquired in [from, to), oldest first.
     *
     * @param country Country name as stored, e.g. "United States of America", or "unknown"
     * @param from    Inclusive lower bound, defaults to seven days before {@code to}
     * @param to      Exclusive upper bound, defaults to now
     */
    public RegionPage queryByRegion(String country, Instant from, Instant to, int page, int size) {
        if (country == null || country.isBlank()) {
            throw new IllegalArgumentException("country is required");
        }
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_LOOKBACK);
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("from must not be after to");
        }

        log.debug("Region query {} [{}, {}) page {} size {}", country, start, end, page, size);
        return fireStore.queryByRegion(country.trim(), start.getEpochSecond(), end.getEpochSecond(), page, size);
    }

    public Optional<FireRecord> findById(String fireId) {
        return fireStore.findById(fireId);
    }
}
