package com.firewatch.pipeline.model;

/**
 * Outcome of a store upsert: the row as it now stands, and whether this call created it.
 */
public record UpsertResult(FireRecord record, boolean inserted) { }
