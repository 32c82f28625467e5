package com.firewatch.pipeline.service;

import com.firewatch.pipeline.audit.PipelineLog;
import com.firewatch.pipeline.config.ProcessSettings;
import com.firewatch.pipeline.model.BatchOutcome;
import com.firewatch.pipeline.model.DeadLetter;
import com.firewatch.pipeline.model.FireBatch;
import com.firewatch.pipeline.model.FireRecord;
import com.firewatch.pipeline.model.LocationInfo;
import com.firewatch.pipeline.model.PipelineRun;
import com.firewatch.pipeline.model.RawFireEvent;
import com.firewatch.pipeline.model.UpsertResult;
import com.firewatch.pipeline.model.ValidatedFireEvent;
import com.firewatch.pipeline.output.DeadLetterChannel;
import com.firewatch.pipeline.output.FireStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns one delivered batch into stored fires.
 *
 * Each detection runs validate → fingerprint → enrich → upsert on its own, on a pool bounded by
 * {@link ProcessSettings#concurrency()} and torn down when the batch is done. A detection ends
 * either stored or dead-lettered; one bad detection never holds back its siblings.
 *
 * The method returns only once every detection is terminal, which is when the listener acks.
 * If a dead-letter itself cannot be published the exception escapes and the whole batch is
 * redelivered; the idempotent store makes the replay harmless.
 */
@Slf4j
public class ProcessStage {

    enum Terminal { INSERTED, UPDATED, INVALID, UNSTORABLE }

    private final FireEventValidator validator;
    private final FireFingerprint fingerprint;
    private final FireRecordMapper mapper;
    private final LocationEnricher enricher;
    private final FireStore fireStore;
    private final DeadLetterChannel deadLetterChannel;
    private final ProcessSettings settings;
    private final Clock clock;
    private final Retry storeRetry;

    public ProcessStage(FireEventValidator validator,
                        FireFingerprint fingerprint,
                        FireRecordMapper mapper,
                        LocationEnricher enricher,
                        FireStore fireStore,
                        DeadLetterChannel deadLetterChannel,
                        ProcessSettings settings,
                        Clock clock) {
        this.validator = validator;
        this.fingerprint = fingerprint;
        this.mapper = mapper;
        this.enricher = enricher;
        this.fireStore = fireStore;
        this.deadLetterChannel = deadLetterChannel;
        this.settings = settings;
        this.clock = clock;
        this.storeRetry = Retry.of("store", RetryConfig.custom()
                .maxAttempts(settings.storeMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.storeInitialBackoff(), 2.0))
                .retryExceptions(TransientStoreException.class)
                .build());
    }

    public BatchOutcome process(FireBatch batch) {
        String batchId = batch.batchId() != null ? batch.batchId() : "unknown";
        List<RawFireEvent> fires = batch.fires() != null ? batch.fires() : List.of();

        MDC.put(PipelineLog.BATCH_ID, batchId);
        PipelineLog.event(log, "BATCH_RECEIVED", "Processing batch {} with {} fires", batchId, fires.size());

        PipelineRun run = PipelineRun.builder()
                .runId(batchId)
                .stage("PROCESS")
                .startedAt(clock.instant())
                .status("RUNNING")
                .recordsFound(fires.size())
                .build();

        try {
            List<Terminal> terminals = fires.isEmpty() ? List.of() : runAll(batchId, fires);
            BatchOutcome outcome = summarise(batchId, terminals);

            run.setRecordsPersisted(outcome.persisted());
            run.setRecordsInserted(outcome.inserted());
            run.setRecordsDeadLettered(outcome.deadLettered());
            run.setStatus(outcome.deadLettered() == 0 ? "SUCCESS" : "PARTIAL");

            PipelineLog.event(log, "BATCH_ACKED",
                    "Batch {} complete: {} inserted, {} updated, {} invalid, {} unstorable",
                    batchId, outcome.inserted(), outcome.updated(),
                    outcome.validationFailures(), outcome.persistenceFailures());
            return outcome;

        } catch (RuntimeException e) {
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(clock.instant());
            fireStore.writeRun(run);
            MDC.remove(PipelineLog.BATCH_ID);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<Terminal> runAll(String batchId, List<RawFireEvent> fires) {
        int workers = Math.min(settings.concurrency(), fires.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads(batchId));
        try {
            List<Future<Terminal>> futures = new ArrayList<>(fires.size());
            for (RawFireEvent fire : fires) {
                futures.add(pool.submit(() -> processOne(batchId, fire)));
            }

            List<Terminal> terminals = new ArrayList<>(fires.size());
            RuntimeException batchFailure = null;
            for (Future<Terminal> future : futures) {
                try {
                    terminals.add(future.get());
                } catch (ExecutionException e) {
                    if (batchFailure == null) batchFailure = asRuntime(e.getCause());
                }
            }

            // every sibling has finished by now, so the redelivery starts from a settled state
            if (batchFailure != null) throw batchFailure;
            return terminals;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing batch " + batchId, e);
        } finally {
            pool.shutdownNow();
        }
    }

    private Terminal processOne(String batchId, RawFireEvent raw) {
        MDC.put(PipelineLog.BATCH_ID, batchId);
        try {
            ValidatedFireEvent event;
            try {
                event = validator.validate(raw);
            } catch (ValidationException e) {
                deadLetter(batchId, raw, DeadLetter.FailureType.VALIDATION, e.getReason());
                return Terminal.INVALID;
            }

            String fireId = fingerprint.fingerprint(event);
            MDC.put(PipelineLog.FIRE_ID, fireId);

            FireRecord record = mapper.map(event, fireId, enrichSafely(event).orElse(null));

            // A retried attempt that finds the row committed by a timed-out earlier attempt reports
            // an update and the fire raises no alert. Alerts are at most once per fire; only the
            // attempt whose insert wins may report inserted.
            try {
                UpsertResult result = storeRetry.executeSupplier(() -> fireStore.upsert(record));
                return result.inserted() ? Terminal.INSERTED : Terminal.UPDATED;

            } catch (TransientStoreException e) {
                deadLetter(batchId, raw, DeadLetter.FailureType.PERSISTENCE,
                        "persistence failed after " + settings.storeMaxAttempts() + " attempt(s): "
                                + rootMessage(e));
                return Terminal.UNSTORABLE;

            } catch (DataAccessException e) {
                deadLetter(batchId, raw, DeadLetter.FailureType.PERSISTENCE,
                        "persistence failed: " + rootMessage(e));
                return Terminal.UNSTORABLE;
            }
        } finally {
            MDC.remove(PipelineLog.FIRE_ID);
            MDC.remove(PipelineLog.BATCH_ID);
        }
    }

    /**
     * Enrichment must never cost us the detection, whatever the enricher throws.
     */
    private Optional<LocationInfo> enrichSafely(ValidatedFireEvent event) {
        try {
            return enricher.enrich(event.latitude(), event.longitude());
        } catch (RuntimeException e) {
            PipelineLog.warn(log, "ENRICHMENT_SKIPPED", "Enrichment failed for ({}, {}), storing without location: {}",
                    event.latitude(), event.longitude(), e.getMessage());
            return Optional.empty();
        }
    }

    private void deadLetter(String batchId, RawFireEvent raw, DeadLetter.FailureType type, String reason) {
        PipelineLog.warn(log, "FIRE_DEAD_LETTERED", "Dead-lettering fire from batch {}: {} ({})",
                batchId, reason, type);
        deadLetterChannel.publish(new DeadLetter(raw, type, reason, batchId, clock.instant()));
    }

    private BatchOutcome summarise(String batchId, List<Terminal> terminals) {
        int inserted = 0, updated = 0, invalid = 0, unstorable = 0;
        for (Terminal t : terminals) {
            switch (t) {
                case INSERTED -> inserted++;
                case UPDATED -> updated++;
                case INVALID -> invalid++;
                case UNSTORABLE -> unstorable++;
            }
        }
        return new BatchOutcome(batchId, terminals.size(), inserted, updated, invalid, unstorable);
    }

    private static ThreadFactory workerThreads(String batchId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "fire-worker-" + batchId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof RuntimeException re) return re;
        if (cause instanceof Error err) throw err;
        return new IllegalStateException(cause);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
