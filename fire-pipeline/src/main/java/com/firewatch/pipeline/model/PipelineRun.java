package com.firewatch.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Tracks each stage run for observability.
 * Stored in the pipeline_runs table.
 */
@Data
@Builder
public class PipelineRun {

    private String runId;           // UUID, or the batch id for PROCESS runs
    private String stage;           // FETCH | PROCESS | BACKFILL
    private Instant startedAt;
    private Instant completedAt;
    private String status;          // RUNNING | SUCCESS | PARTIAL | FAILED
    private int recordsFound;
    private int recordsPersisted;
    private int recordsInserted;
    private int recordsDeadLettered;
    private String errorMessage;    // null on success
}
