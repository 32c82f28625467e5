package com.firewatch.pipeline;

import com.firewatch.pipeline.FireFixtures.MutableClock;
import com.firewatch.pipeline.config.ProcessSettings;
import com.firewatch.pipeline.model.AlertGroup;
import com.firewatch.pipeline.model.AlertMessage;
import com.firewatch.pipeline.model.BatchOutcome;
import com.firewatch.pipeline.model.DeadLetter;
import com.firewatch.pipeline.model.FireBatch;
import com.firewatch.pipeline.model.FireMutationEvent;
import com.firewatch.pipeline.model.LocationInfo;
import com.firewatch.pipeline.model.RegionPage;
import com.firewatch.pipeline.output.FireStore;
import com.firewatch.pipeline.service.AlertNotifier;
import com.firewatch.pipeline.service.ChangeDetector;
import com.firewatch.pipeline.service.FireEventValidator;
import com.firewatch.pipeline.service.FireFingerprint;
import com.firewatch.pipeline.service.FireRecordMapper;
import com.firewatch.pipeline.service.LocationEnricher;
import com.firewatch.pipeline.service.ProcessStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.firewatch.pipeline.FireFixtures.NOW;
import static com.firewatch.pipeline.FireFixtures.rawFire;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Process stage, H2 store and change detector wired together, with the queues replaced
 * by in-memory lists.
 */
class FirePipelineFlowTest {

    private EmbeddedDatabase database;
    private MutableClock clock;
    private List<FireMutationEvent> mutations;
    private List<DeadLetter> deadLetters;
    private List<AlertMessage> alerts;
    private FireStore store;
    private ProcessStage processStage;
    private ChangeDetector changeDetector;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .build();
        clock = new MutableClock(NOW);
        mutations = new CopyOnWriteArrayList<>();
        deadLetters = new CopyOnWriteArrayList<>();
        alerts = new ArrayList<>();

        store = new FireStore(new JdbcTemplate(database), mutations::add, clock);
        store.ensureSchema();

        LocationEnricher enricher = mock(LocationEnricher.class);
        when(enricher.enrich(anyDouble(), anyDouble())).thenReturn(Optional.of(
                new LocationInfo("San Francisco", "San Francisco", "California", "United States of America")));

        processStage = new ProcessStage(new FireEventValidator(), new FireFingerprint(), new FireRecordMapper(),
                enricher, store, deadLetters::add, new ProcessSettings(4, 3, Duration.ofMillis(1)), clock);
        changeDetector = new ChangeDetector(new AlertNotifier(alerts::add), clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("Should store, alert once, and stay quiet on redelivery")
    void shouldAlertOnceForNewFire() {
        FireBatch batch = new FireBatch("run-0000", NOW, List.of(rawFire().build()));

        BatchOutcome first = processStage.process(batch);
        List<AlertGroup> firstCycle = changeDetector.onCycle(drainMutations());

        assertThat(first.inserted()).isEqualTo(1);
        assertThat(firstCycle).singleElement().satisfies(group -> {
            assertThat(group.region()).isEqualTo("United States of America");
            assertThat(group.records()).extracting("fireId")
                    .containsExactly("37.7749_-122.4194_2024-01-15_1430");
        });
        assertThat(alerts).singleElement().extracting(AlertMessage::subject)
                .isEqualTo("Firewatch Alert: 1 New Fire(s) Detected in United States of America");

        clock.advance(Duration.ofMinutes(15));
        BatchOutcome replay = processStage.process(batch);
        List<AlertGroup> secondCycle = changeDetector.onCycle(drainMutations());

        assertThat(replay.updated()).isEqualTo(1);
        assertThat(secondCycle).isEmpty();
        assertThat(alerts).hasSize(1);
        assertThat(store.findById("37.7749_-122.4194_2024-01-15_1430"))
                .hasValueSatisfying(record -> assertThat(record.getCreatedAt()).isEqualTo(NOW));
    }

    @Test
    @DisplayName("Should make stored fires visible to region queries")
    void shouldQueryStoredFires() {
        processStage.process(new FireBatch("run-0000", NOW, List.of(
                rawFire().build(),
                rawFire().acqTime("1500").build(),
                rawFire(200, 0))));

        long from = Instant.parse("2024-01-15T00:00:00Z").getEpochSecond();
        long to = Instant.parse("2024-01-16T00:00:00Z").getEpochSecond();
        RegionPage page = store.queryByRegion("United States of America", from, to, 0, 10);

        assertThat(page.items()).extracting("acqTime").containsExactly("1430", "1500");
        assertThat(deadLetters).singleElement()
                .extracting(DeadLetter::reason).isEqualTo("latitude out of range");
    }

    private List<FireMutationEvent> drainMutations() {
        List<FireMutationEvent> cycle = new ArrayList<>(mutations);
        mutations.clear();
        return cycle;
    }
}
