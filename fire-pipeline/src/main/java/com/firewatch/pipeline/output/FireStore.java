package com.firewatch.pipeline.output;

import com.firewatch.pipeline.audit.PipelineLog;
import com.firewatch.pipeline.model.AlertGroup;
import com.firewatch.pipeline.model.Confidence;
import com.firewatch.pipeline.model.DayNight;
import com.firewatch.pipeline.model.FireMutationEvent;
import com.firewatch.pipeline.model.FireRecord;
import com.firewatch.pipeline.model.PipelineRun;
import com.firewatch.pipeline.model.RegionPage;
import com.firewatch.pipeline.model.UpsertResult;
import com.firewatch.pipeline.service.TransientStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable fire table keyed by fingerprint.
 *
 * Upserts are conditional writes: the INSERT either creates the row or trips the primary
 * key, in which case only the enrichment columns are merged. The database arbitrates
 * concurrent writers, so of any number of racing upserts for one fire_id exactly one
 * reports {@code inserted = true}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FireStore {

    static final int MAX_PAGE_SIZE = 500;

    private static final String COLUMNS = """
            fire_id, latitude, longitude, brightness, confidence, frp, acq_date, acq_time,
            satellite, instrument, day_night, event_timestamp,
            location_city, location_locality, location_state, location_country, created_at
            """;

    private static final String INSERT_SQL = "INSERT INTO fires (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String MERGE_ENRICHMENT_SQL = """
            UPDATE fires SET
                location_city     = COALESCE(?, location_city),
                location_locality = COALESCE(?, location_locality),
                location_state    = COALESCE(?, location_state),
                location_country  = COALESCE(?, location_country)
            WHERE fire_id = ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final MutationEventSink mutationEventSink;
    private final Clock clock;

    private final RowMapper<FireRecord> fireRowMapper = this::mapFire;

    public void ensureSchema() {
        log.info("Ensuring fire store schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS fires
            (
                fire_id             VARCHAR(64)       NOT NULL PRIMARY KEY,
                latitude            DOUBLE PRECISION  NOT NULL,
                longitude           DOUBLE PRECISION  NOT NULL,
                brightness          DOUBLE PRECISION,
                confidence          VARCHAR(16)       NOT NULL,
                frp                 DOUBLE PRECISION  NOT NULL,
                acq_date            DATE              NOT NULL,
                acq_time            VARCHAR(4)        NOT NULL,
                satellite           VARCHAR(32),
                instrument          VARCHAR(32),
                day_night           VARCHAR(1),
                event_timestamp     BIGINT            NOT NULL,
                location_city       VARCHAR(255),
                location_locality   VARCHAR(255),
                location_state      VARCHAR(255),
                location_country    VARCHAR(255),
                created_at          TIMESTAMP         NOT NULL,
                enrichment_attempted_at TIMESTAMP
            )
        """);

        jdbcTemplate.execute("ALTER TABLE fires ADD COLUMN IF NOT EXISTS enrichment_attempted_at TIMESTAMP");

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_fires_country_ts
                ON fires (location_country, event_timestamp)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_runs
            (
                run_id                  VARCHAR(128)  NOT NULL,
                stage                   VARCHAR(16)   NOT NULL,
                started_at              TIMESTAMP     NOT NULL,
                completed_at            TIMESTAMP,
                status                  VARCHAR(16)   NOT NULL,
                records_found           INT           NOT NULL,
                records_persisted       INT           NOT NULL,
                records_inserted        INT           NOT NULL,
                records_dead_lettered   INT           NOT NULL,
                error_message           VARCHAR(1024)
            )
        """);

        log.info("Fire store schema ready.");
    }

    /**
     * Insert the record, or merge its enrichment into the existing row.
     *
     * Existing rows keep their created_at and detection columns; each location column is
     * overwritten only when the incoming value is non-null. Emits exactly one
     * {@link FireMutationEvent} per call.
     *
     * @throws TransientStoreException on retryable database failures
     * @throws org.springframework.dao.DataAccessException on anything permanent
     */
    public UpsertResult upsert(FireRecord record) {
        Objects.requireNonNull(record.getFireId(), "fireId must not be null");

        UpsertResult result;
        try {
            result = insertOrMerge(record);
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException e) {
            throw new TransientStoreException("Transient store failure for " + record.getFireId(), e);
        }

        emit(result);
        return result;
    }

    public Optional<FireRecord> findById(String fireId) {
        List<FireRecord> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM fires WHERE fire_id = ?", fireRowMapper, fireId);
        return rows.stream().findFirst();
    }

    /**
     * Fires in one country with acquisition time in [fromEpoch, toEpoch).
     * The {@value AlertGroup#UNKNOWN_REGION} region selects fires without a country.
     */
    public RegionPage queryByRegion(String country, long fromEpoch, long toEpoch, int page, int size) {
        if (page < 0) throw new IllegalArgumentException("page must be >= 0");
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (fromEpoch > toEpoch) throw new IllegalArgumentException("from must not be after to");

        boolean unknown = country == null || AlertGroup.UNKNOWN_REGION.equalsIgnoreCase(country);
        String countryFilter = unknown ? "location_country IS NULL" : "location_country = ?";

        String sql = "SELECT " + COLUMNS + " FROM fires WHERE " + countryFilter + """
                 AND event_timestamp >= ? AND event_timestamp < ?
                ORDER BY event_timestamp ASC, fire_id ASC
                OFFSET ? ROWS FETCH NEXT ? ROWS ONLY
                """;

        List<Object> args = new ArrayList<>();
        if (!unknown) args.add(country);
        args.add(fromEpoch);
        args.add(toEpoch);
        args.add((long) page * size);
        args.add(size + 1);

        List<FireRecord> rows = jdbcTemplate.query(sql, fireRowMapper, args.toArray());
        boolean hasMore = rows.size() > size;
        List<FireRecord> items = hasMore ? rows.subList(0, size) : rows;
        return new RegionPage(List.copyOf(items), page, size, hasMore);
    }

    /**
     * Records without a country for the enrichment backfill. Never-attempted records come
     * first, then the ones whose last attempt is oldest, so unresolvable coordinates rotate
     * to the back instead of filling every run.
     */
    public List<FireRecord> findMissingEnrichment(int limit) {
        return jdbcTemplate.query("SELECT " + COLUMNS + """
                 FROM fires
                WHERE location_country IS NULL
                ORDER BY enrichment_attempted_at ASC NULLS FIRST, created_at ASC, fire_id ASC
                FETCH FIRST ? ROWS ONLY
                """, fireRowMapper, limit);
    }

    public void markEnrichmentAttempted(String fireId) {
        jdbcTemplate.update("UPDATE fires SET enrichment_attempted_at = ? WHERE fire_id = ?",
                Timestamp.from(clock.instant()), fireId);
    }

    public void writeRun(PipelineRun run) {
        try {
            jdbcTemplate.update("""
                INSERT INTO pipeline_runs
                (run_id, stage, started_at, completed_at, status, records_found,
                 records_persisted, records_inserted, records_dead_lettered, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    run.getRunId(),
                    run.getStage(),
                    toTimestamp(run.getStartedAt()),
                    toTimestamp(run.getCompletedAt()),
                    run.getStatus(),
                    run.getRecordsFound(),
                    run.getRecordsPersisted(),
                    run.getRecordsInserted(),
                    run.getRecordsDeadLettered(),
                    truncate(run.getErrorMessage(), 1024));
        } catch (Exception e) {
            log.warn("Failed to write pipeline run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private UpsertResult insertOrMerge(FireRecord record) {
        Instant now = clock.instant();
        try {
            jdbcTemplate.update(INSERT_SQL,
                    record.getFireId(),
                    record.getLatitude(),
                    record.getLongitude(),
                    record.getBrightness(),
                    record.getConfidence().label(),
                    record.getFrp(),
                    Date.valueOf(record.getAcqDate()),
                    record.getAcqTime(),
                    record.getSatellite(),
                    record.getInstrument(),
                    record.getDayNight() != null ? record.getDayNight().name() : null,
                    record.getTimestamp(),
                    record.getLocationCity(),
                    record.getLocationLocality(),
                    record.getLocationState(),
                    record.getLocationCountry(),
                    Timestamp.from(now));

            log.debug("Inserted {}", record.getFireId());
            return new UpsertResult(record.toBuilder().createdAt(now).build(), true);

        } catch (DuplicateKeyException e) {
            jdbcTemplate.update(MERGE_ENRICHMENT_SQL,
                    record.getLocationCity(),
                    record.getLocationLocality(),
                    record.getLocationState(),
                    record.getLocationCountry(),
                    record.getFireId());

            FireRecord stored = findById(record.getFireId())
                    .orElseThrow(() -> new IllegalStateException(
                            "Row " + record.getFireId() + " vanished between insert and merge"));

            log.debug("Duplicate fire_id {}, merged enrichment", record.getFireId());
            return new UpsertResult(stored, false);
        }
    }

    private void emit(UpsertResult result) {
        try {
            mutationEventSink.emit(new FireMutationEvent(result.record(), result.inserted()));
        } catch (RuntimeException e) {
            PipelineLog.error(log, "MUTATION_EMIT_FAILED",
                    "Stored " + result.record().getFireId() + " but could not emit its mutation event", e);
        }
    }

    private FireRecord mapFire(ResultSet rs, int rowNum) throws SQLException {
        String dayNight = rs.getString("day_night");
        return FireRecord.builder()
                .fireId(rs.getString("fire_id"))
                .latitude(rs.getDouble("latitude"))
                .longitude(rs.getDouble("longitude"))
                .brightness(nullableDouble(rs, "brightness"))
                .confidence(Confidence.parse(rs.getString("confidence")).orElse(null))
                .frp(rs.getDouble("frp"))
                .acqDate(rs.getDate("acq_date").toLocalDate())
                .acqTime(rs.getString("acq_time"))
                .satellite(rs.getString("satellite"))
                .instrument(rs.getString("instrument"))
                .dayNight(DayNight.parse(dayNight).orElse(null))
                .timestamp(rs.getLong("event_timestamp"))
                .locationCity(rs.getString("location_city"))
                .locationLocality(rs.getString("location_locality"))
                .locationState(rs.getString("location_state"))
                .locationCountry(rs.getString("location_country"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .build();
    }

    private Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private String truncate(String val, int max) {
        if (val == null || val.length() <= max) return val;
        return val.substring(0, max);
    }
}
