package com.firewatch.pipeline.service;

import com.firewatch.pipeline.audit.PipelineLog;
import com.firewatch.pipeline.model.FetchSummary;
import com.firewatch.pipeline.model.FetchWindow;
import com.firewatch.pipeline.model.FireBatch;
import com.firewatch.pipeline.model.PipelineRun;
import com.firewatch.pipeline.model.RawFireEvent;
import com.firewatch.pipeline.output.BatchChannel;
import com.firewatch.pipeline.output.FireStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Pulls one trailing window from FIRMS and hands it to the delivery channel in fixed-size batches.
 *
 * Holds no timer of its own; {@code FetchScheduler} or the HTTP trigger decides when to run.
 * Overlapping windows are expected, the process stage dedups by fingerprint.
 */
@Slf4j
public class FetchStage {

    private final FirmsFeedClient feedClient;
    private final BatchChannel batchChannel;
    private final FireStore fireStore;
    private final int batchSize;
    private final Clock clock;

    public FetchStage(FirmsFeedClient feedClient, BatchChannel batchChannel, FireStore fireStore,
                      int batchSize, Clock clock) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        this.feedClient = feedClient;
        this.batchChannel = batchChannel;
        this.fireStore = fireStore;
        this.batchSize = batchSize;
        this.clock = clock;
    }

    /**
     * Fetch and enqueue.
     *
     * A batch the channel refuses is logged and counted; the next run's overlapping window
     * picks those fires up again.
     *
     * @throws FeedNotConfiguredException if the FIRMS key is missing
     * @throws FeedUnavailableException   if the feed could not be read
     */
    public FetchSummary run(FetchWindow window) {
        String runId = UUID.randomUUID().toString();

        PipelineRun run = PipelineRun.builder()
                .runId(runId)
                .stage("FETCH")
                .startedAt(clock.instant())
                .status("RUNNING")
                .build();

        try {
            List<RawFireEvent> fires = feedClient.fetch(window);
            run.setRecordsFound(fires.size());

            if (fires.isEmpty()) {
                log.info("No active fires detected in the last {} day(s)", window.dayRange());
                run.setStatus("SUCCESS");
                return new FetchSummary(runId, 0, 0, 0, 0);
            }

            List<List<RawFireEvent>> batches = partition(fires, batchSize);
            int queued = 0;
            int batchesQueued = 0;
            int batchesFailed = 0;

            for (int i = 0; i < batches.size(); i++) {
                List<RawFireEvent> chunk = batches.get(i);
                FireBatch batch = new FireBatch(
                        String.format("%s-%04d", runId, i), clock.instant(), List.copyOf(chunk));
                try {
                    batchChannel.publish(batch);
                    queued += chunk.size();
                    batchesQueued++;
                } catch (ChannelUnavailableException e) {
                    batchesFailed++;
                    PipelineLog.error(log, "BATCH_ENQUEUE_FAILED",
                            "Could not queue batch " + batch.batchId() + " (" + chunk.size() + " fires)", e);
                }
            }

            run.setRecordsPersisted(queued);
            run.setStatus(batchesFailed == 0 ? "SUCCESS" : "PARTIAL");

            PipelineLog.event(log, "FETCH_COMPLETED", "Queued {} of {} fires in {} batch(es), {} failed",
                    queued, fires.size(), batchesQueued, batchesFailed);
            return new FetchSummary(runId, fires.size(), queued, batchesQueued, batchesFailed);

        } catch (RuntimeException e) {
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(clock.instant());
            fireStore.writeRun(run);
        }
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(items.subList(i, Math.min(i + size, items.size())));
        }
        return chunks;
    }
}
