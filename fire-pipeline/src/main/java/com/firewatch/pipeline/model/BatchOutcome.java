package com.firewatch.pipeline.model;

/**
 * Terminal state counts for one processed batch.
 * {@code inserted + updated + deadLettered == received} always holds.
 */
public record BatchOutcome(
        String batchId,
        int received,
        int inserted,
        int updated,
        int validationFailures,
        int persistenceFailures
) {
    public int persisted() {
        return inserted + updated;
    }

    public int deadLettered() {
        return validationFailures + persistenceFailures;
    }
}
