package com.firewatch.pipeline.model;

import java.time.Instant;
import java.util.List;

/**
 * New fires in one region, inserted during one change-detection cycle.
 * Never persisted.
 */
public record AlertGroup(
        String region,
        List<FireRecord> records,
        Instant windowStart,
        Instant windowEnd
) {
    /** Region used for fires without an enriched country */
    public static final String UNKNOWN_REGION = "unknown";

    public AlertGroup {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
