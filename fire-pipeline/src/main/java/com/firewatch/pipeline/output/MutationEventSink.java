package com.firewatch.pipeline.output;

import com.firewatch.pipeline.model.FireMutationEvent;

/**
 * Receives one event per store upsert.
 */
@FunctionalInterface
public interface MutationEventSink {

    void emit(FireMutationEvent event);
}
