package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.AlertGroup;
import com.firewatch.pipeline.model.AlertMessage;
import com.firewatch.pipeline.model.FireRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static com.firewatch.pipeline.FireFixtures.NOW;
import static com.firewatch.pipeline.FireFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertNotifierTest {

    private final AlertNotifier notifier = new AlertNotifier(message -> { });

    @Test
    @DisplayName("Should summarise a region's new fires")
    void shouldFormatAlert() {
        FireRecord fire = record("us-1", "United States of America")
                .locationCity("San Francisco")
                .locationState("California")
                .build();

        AlertMessage message = notifier.format(new AlertGroup("United States of America", List.of(fire), NOW, NOW));

        assertThat(message.subject()).isEqualTo("Firewatch Alert: 1 New Fire(s) Detected in United States of America");
        assertThat(message.fireCount()).isEqualTo(1);
        assertThat(message.body())
                .startsWith("Firewatch has detected 1 new active fire(s) in United States of America.")
                .contains("San Francisco, California (37.7749, -122.4194)")
                .contains("Confidence: nominal, FRP: 12.5 MW, acquired 2024-01-15 14:30 UTC")
                .contains("Ingested between 2024-01-15 15:00 UTC and 2024-01-15 15:00 UTC")
                .endsWith("This is an automated alert from Firewatch.");
    }

    @Test
    @DisplayName("Should list at most five fires and count the rest")
    void shouldTruncateLongGroups() {
        List<FireRecord> fires = IntStream.range(0, 7)
                .mapToObj(i -> record("fr-" + i, "France").build())
                .toList();

        AlertMessage message = notifier.format(new AlertGroup("France", fires, NOW, NOW));

        assertThat(message.body()).contains("  ... and 2 more");
        assertThat(message.body().lines().filter(l -> l.startsWith("  • "))).hasSize(AlertNotifier.DETAIL_LIMIT);
    }

    @Test
    @DisplayName("Should describe locations from whatever enrichment is present")
    void shouldDescribeLocation() {
        assertThat(AlertNotifier.describeLocation(record("a", "France").locationLocality("Marseille").build()))
                .isEqualTo("Marseille");
        assertThat(AlertNotifier.describeLocation(record("b", "France").build())).isEqualTo("France");
        assertThat(AlertNotifier.describeLocation(record("c", null).build())).isEqualTo("Unknown Location");
    }

    @Test
    @DisplayName("Should wrap sink failures in NotifyException")
    void shouldWrapSinkFailure() {
        AlertNotifier failing = new AlertNotifier(message -> {
            throw new IllegalStateException("exchange gone");
        });

        assertThatThrownBy(() -> failing.notify(new AlertGroup("France", List.of(record("a", "France").build()), NOW, NOW)))
                .isInstanceOf(NotifyException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
