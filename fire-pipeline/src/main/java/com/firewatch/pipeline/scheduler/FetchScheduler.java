package com.firewatch.pipeline.scheduler;

import com.firewatch.pipeline.config.FirewatchProperties;
import com.firewatch.pipeline.model.FetchWindow;
import com.firewatch.pipeline.output.FireStore;
import com.firewatch.pipeline.service.EnrichmentBackfillService;
import com.firewatch.pipeline.service.FeedNotConfiguredException;
import com.firewatch.pipeline.service.FetchStage;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the fetch stage on a timer.
 *
 * Default schedule: every 15 minutes, on the quarter hour, UTC.
 * Backfill of missing locations runs hourly at half past.
 *
 * Override with FETCH_CRON / BACKFILL_CRON or the firewatch.scheduling.* properties.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FetchScheduler {

    private final FetchStage fetchStage;
    private final EnrichmentBackfillService backfillService;
    private final FireStore fireStore;
    private final FirewatchProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Optionally run one fetch if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            fireStore.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise fire store schema: {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running one fetch now");
            scheduledFetch();
        } else {
            log.info("Pipeline ready. Next scheduled fetch: {}", properties.getScheduling().getFetchCron());
        }
    }

    @Scheduled(cron = "${firewatch.scheduling.fetch-cron:0 */15 * * * *}", zone = "UTC")
    public void scheduledFetch() {
        log.info("Scheduled fetch triggered");
        try {
            fetchStage.run(FetchWindow.ofHours(properties.getFeed().getTrailingWindowHours()));
        } catch (FeedNotConfiguredException e) {
            log.error("Fetch skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled fetch failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${firewatch.scheduling.backfill-cron:0 30 * * * *}", zone = "UTC")
    public void scheduledBackfill() {
        try {
            backfillService.backfill(properties.getScheduling().getBackfillLimit());
        } catch (Exception e) {
            log.error("Scheduled backfill failed: {}", e.getMessage(), e);
        }
    }
}
