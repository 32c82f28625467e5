package com.firewatch.pipeline.model;

/**
 * Emitted by the store once per upsert call.
 * Only {@code inserted = true} events are new fires.
 */
public record FireMutationEvent(FireRecord record, boolean inserted) { }
