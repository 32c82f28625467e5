package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.FireRecord;
import com.firewatch.pipeline.model.LocationInfo;
import com.firewatch.pipeline.model.PipelineRun;
import com.firewatch.pipeline.output.FireStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Second chance for fires stored while the geocoder was unavailable.
 *
 * Re-enriches records without a country, least recently attempted first, and upserts them
 * again. Every attempt is stamped so that coordinates no geocoder can place (open ocean)
 * cycle to the back of the queue. The row already exists, so the upsert merges location
 * columns and reports {@code inserted = false}; no new alert is raised for a backfilled fire.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrichmentBackfillService {

    private final FireStore fireStore;
    private final LocationEnricher enricher;
    private final Clock clock;

    /**
     * @param limit maximum records to attempt this run
     * @return number of records that gained location data
     */
    public int backfill(int limit) {
        PipelineRun run = PipelineRun.builder()
                .runId(UUID.randomUUID().toString())
                .stage("BACKFILL")
                .startedAt(clock.instant())
                .status("RUNNING")
                .build();

        int enriched = 0;
        try {
            List<FireRecord> pending = fireStore.findMissingEnrichment(limit);
            run.setRecordsFound(pending.size());
            if (pending.isEmpty()) {
                log.debug("Nothing to backfill");
            }

            for (FireRecord record : pending) {
                Optional<LocationInfo> location = enricher.enrich(record.getLatitude(), record.getLongitude());
                fireStore.markEnrichmentAttempted(record.getFireId());
                if (location.isEmpty()) continue;

                fireStore.upsert(record.withLocation(location.get()));
                enriched++;
            }

            run.setRecordsPersisted(enriched);
            run.setStatus("SUCCESS");
            log.info("Backfill complete: {} of {} record(s) enriched", enriched, pending.size());
            return enriched;

        } catch (RuntimeException e) {
            log.error("Backfill failed after {} record(s): {}", enriched, e.getMessage(), e);
            run.setStatus("FAILED");
            run.setRecordsPersisted(enriched);
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(clock.instant());
            fireStore.writeRun(run);
        }
    }
}
