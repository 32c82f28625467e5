package com.firewatch.pipeline.model;

import java.util.List;

/**
 * One page of a region query, ordered by acquisition timestamp ascending.
 */
public record RegionPage(List<FireRecord> items, int page, int size, boolean hasMore) { }
