package com.firewatch.pipeline.model;

import java.time.Instant;

/**
 * Terminal failure for a single detection, published for manual inspection.
 */
public record DeadLetter(
        RawFireEvent original,
        FailureType failureType,
        String reason,
        String batchId,
        Instant failedAt
) {
    public enum FailureType {
        VALIDATION, PERSISTENCE
    }
}
