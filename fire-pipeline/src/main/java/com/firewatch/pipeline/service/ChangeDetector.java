package com.firewatch.pipeline.service;

import com.firewatch.pipeline.audit.PipelineLog;
import com.firewatch.pipeline.model.AlertGroup;
import com.firewatch.pipeline.model.FireMutationEvent;
import com.firewatch.pipeline.model.FireRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns one cycle of store mutation events into per-country alert groups.
 *
 * A cycle is whatever one invocation receives; nothing is carried over between invocations.
 * Updates ({@code inserted = false}), including redelivered duplicates, are ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeDetector {

    private final AlertNotifier notifier;
    private final Clock clock;

    /**
     * Group and notify. A failed notification is logged and does not stop the other regions.
     *
     * @return the groups that were formed, notified or not
     */
    public List<AlertGroup> onCycle(List<FireMutationEvent> cycle) {
        List<AlertGroup> groups = group(cycle);

        int inserts = groups.stream().mapToInt(AlertGroup::size).sum();
        log.info("Mutation cycle: {} event(s), {} new fire(s), {} region(s)",
                cycle.size(), inserts, groups.size());

        int failed = 0;
        for (AlertGroup group : groups) {
            try {
                notifier.notify(group);
            } catch (NotifyException e) {
                failed++;
                PipelineLog.error(log, "ALERT_FAILED",
                        "Alert for " + group.region() + " (" + group.size() + " fires) not published", e);
            }
        }
        if (failed > 0) {
            log.warn("{} of {} alert(s) failed this cycle; stored fires are unaffected", failed, groups.size());
        }
        return groups;
    }

    /**
     * Inserted records grouped by country in arrival order; fires without a country land in
     * {@value AlertGroup#UNKNOWN_REGION}. Every group shares the cycle's window, bounded by
     * the earliest and latest created_at among the inserts.
     */
    public List<AlertGroup> group(List<FireMutationEvent> cycle) {
        Map<String, List<FireRecord>> byRegion = new LinkedHashMap<>();
        Instant windowStart = null;
        Instant windowEnd = null;

        for (FireMutationEvent event : cycle) {
            if (event == null || !event.inserted() || event.record() == null) continue;

            FireRecord record = event.record();
            byRegion.computeIfAbsent(regionOf(record), k -> new ArrayList<>()).add(record);

            Instant createdAt = record.getCreatedAt();
            if (createdAt != null) {
                if (windowStart == null || createdAt.isBefore(windowStart)) windowStart = createdAt;
                if (windowEnd == null || createdAt.isAfter(windowEnd)) windowEnd = createdAt;
            }
        }

        if (byRegion.isEmpty()) return List.of();

        Instant now = clock.instant();
        Instant start = Objects.requireNonNullElse(windowStart, now);
        Instant end = Objects.requireNonNullElse(windowEnd, now);

        List<AlertGroup> groups = new ArrayList<>(byRegion.size());
        byRegion.forEach((region, records) -> groups.add(new AlertGroup(region, records, start, end)));
        return groups;
    }

    private String regionOf(FireRecord record) {
        String country = record.getLocationCountry();
        return (country == null || country.isBlank()) ? AlertGroup.UNKNOWN_REGION : country;
    }
}
