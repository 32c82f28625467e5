package com.firewatch.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Persisted fire detection, one row per fingerprint.
 *
 * Schema design notes:
 *  - fire_id is the dedup key; re-ingesting the same detection updates this row
 *  - location_* columns are nullable, enrichment may be missing and backfilled later
 *  - location_country + timestamp back the region query index
 *  - created_at is written once, on first insert, by the store
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FireRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    /** Fingerprint: rounded lat/lon + acquisition date + time */
    private String fireId;

    // ── Detection ───────────────────────────────────────────────────────────
    private double latitude;

    private double longitude;

    /** Brightness temperature in Kelvin, null when the feed omitted it */
    private Double brightness;

    private Confidence confidence;

    /** Fire radiative power in MW */
    private double frp;

    private LocalDate acqDate;

    /** HHMM, always 4 digits */
    private String acqTime;

    private String satellite;

    private String instrument;

    private DayNight dayNight;

    /** Unix epoch seconds of acquisition (UTC) */
    private long timestamp;

    // ── Enrichment ──────────────────────────────────────────────────────────
    private String locationCity;

    private String locationLocality;

    private String locationState;

    private String locationCountry;

    // ── Metadata ────────────────────────────────────────────────────────────
    /** Ingestion wall-clock time of the first insert */
    private Instant createdAt;

    public boolean hasLocation() {
        return locationCity != null || locationLocality != null
                || locationState != null || locationCountry != null;
    }

    public FireRecord withLocation(LocationInfo location) {
        if (location == null) return this;
        return toBuilder()
                .locationCity(location.city())
                .locationLocality(location.locality())
                .locationState(location.state())
                .locationCountry(location.country())
                .build();
    }
}
