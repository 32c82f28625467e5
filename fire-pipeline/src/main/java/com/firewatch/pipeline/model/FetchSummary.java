package com.firewatch.pipeline.model;

public record FetchSummary(String runId, int firesFound, int firesQueued, int batchesQueued, int batchesFailed) { }
