package com.firewatch.pipeline.service;

import com.firewatch.pipeline.audit.PipelineLog;
import com.firewatch.pipeline.model.AlertGroup;
import com.firewatch.pipeline.model.AlertMessage;
import com.firewatch.pipeline.model.FireRecord;
import com.firewatch.pipeline.output.AlertSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Formats an {@link AlertGroup} as a readable summary and publishes it.
 *
 * Publishing is best effort relative to storage: a failure is reported to the caller as a
 * {@link NotifyException} and nothing is rolled back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertNotifier {

    static final int DETAIL_LIMIT = 5;

    private static final DateTimeFormatter UTC_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final AlertSink alertSink;

    public void notify(AlertGroup group) {
        AlertMessage message = format(group);
        try {
            alertSink.publish(message);
        } catch (RuntimeException e) {
            throw new NotifyException("Could not publish alert for " + group.region(), e);
        }
        PipelineLog.event(log, "ALERT_PUBLISHED", "Alert sent: {}", message.subject());
    }

    public AlertMessage format(AlertGroup group) {
        int count = group.size();
        String subject = String.format("Firewatch Alert: %d New Fire(s) Detected in %s", count, group.region());

        List<String> lines = new ArrayList<>();
        lines.add(String.format("Firewatch has detected %d new active fire(s) in %s.", count, group.region()));
        lines.add("");

        for (FireRecord fire : group.records().subList(0, Math.min(DETAIL_LIMIT, count))) {
            lines.add(String.format(Locale.ROOT, "  • %s (%.4f, %.4f)",
                    describeLocation(fire), fire.getLatitude(), fire.getLongitude()));
            lines.add(String.format(Locale.ROOT, "    Confidence: %s, FRP: %.1f MW, acquired %s",
                    fire.getConfidence() != null ? fire.getConfidence().label() : "unknown",
                    fire.getFrp(),
                    UTC_FMT.format(Instant.ofEpochSecond(fire.getTimestamp()))));
        }
        if (count > DETAIL_LIMIT) {
            lines.add(String.format("  ... and %d more", count - DETAIL_LIMIT));
        }

        long first = group.records().stream().mapToLong(FireRecord::getTimestamp).min().orElse(0);
        long last = group.records().stream().mapToLong(FireRecord::getTimestamp).max().orElse(0);

        lines.add("");
        lines.add("Acquired between " + UTC_FMT.format(Instant.ofEpochSecond(first))
                + " and " + UTC_FMT.format(Instant.ofEpochSecond(last)));
        lines.add("Ingested between " + UTC_FMT.format(group.windowStart())
                + " and " + UTC_FMT.format(group.windowEnd()));
        lines.add("");
        lines.add("This is an automated alert from Firewatch.");

        return new AlertMessage(subject, String.join("\n", lines), group.region(), count,
                group.windowStart(), group.windowEnd());
    }

    /**
     * "City, State" from whatever enrichment is present, else "Unknown Location".
     */
    static String describeLocation(FireRecord fire) {
        List<String> parts = new ArrayList<>();
        String place = fire.getLocationCity() != null ? fire.getLocationCity() : fire.getLocationLocality();
        if (place != null) parts.add(place);
        if (fire.getLocationState() != null) parts.add(fire.getLocationState());
        if (parts.isEmpty() && fire.getLocationCountry() != null) parts.add(fire.getLocationCountry());
        return parts.isEmpty() ? "Unknown Location" : String.join(", ", parts);
    }
}
