package com.firewatch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Delivery channel payload: an ordered group of raw detections.
 */
public record FireBatch(
        @JsonProperty("batch_id") String batchId,
        Instant timestamp,
        List<RawFireEvent> fires
) {
    public int size() {
        return fires == null ? 0 : fires.size();
    }
}
