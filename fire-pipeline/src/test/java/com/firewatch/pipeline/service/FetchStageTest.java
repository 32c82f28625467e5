package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.FetchSummary;
import com.firewatch.pipeline.model.FetchWindow;
import com.firewatch.pipeline.model.FireBatch;
import com.firewatch.pipeline.model.PipelineRun;
import com.firewatch.pipeline.model.RawFireEvent;
import com.firewatch.pipeline.output.BatchChannel;
import com.firewatch.pipeline.output.FireStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static com.firewatch.pipeline.FireFixtures.NOW;
import static com.firewatch.pipeline.FireFixtures.rawFire;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FetchStageTest {

    private FirmsFeedClient feedClient;
    private FireStore fireStore;
    private List<FireBatch> published;

    @BeforeEach
    void setUp() {
        feedClient = mock(FirmsFeedClient.class);
        fireStore = mock(FireStore.class);
        published = new ArrayList<>();
    }

    @Test
    @DisplayName("Should split 25 fires into batches of 10, 10 and 5")
    void shouldBatchFires() {
        when(feedClient.fetch(any())).thenReturn(fires(25));

        FetchSummary summary = stage(published::add).run(FetchWindow.ofHours(24));

        assertThat(published).extracting(FireBatch::size).containsExactly(10, 10, 5);
        assertThat(published).extracting(FireBatch::timestamp).containsOnly(NOW);
        assertThat(published).extracting(FireBatch::batchId).doesNotHaveDuplicates()
                .allMatch(id -> id.startsWith(summary.runId()));
        assertThat(summary.firesFound()).isEqualTo(25);
        assertThat(summary.firesQueued()).isEqualTo(25);
        assertThat(summary.batchesQueued()).isEqualTo(3);
        assertThat(summary.batchesFailed()).isZero();
    }

    @Test
    @DisplayName("Should keep going when one batch cannot be queued")
    void shouldContinuePastChannelFailure() {
        when(feedClient.fetch(any())).thenReturn(fires(25));
        List<FireBatch> attempted = new ArrayList<>();

        FetchSummary summary = stage(batch -> {
            attempted.add(batch);
            if (attempted.size() == 2) throw new ChannelUnavailableException("broker down", null);
            published.add(batch);
        }).run(FetchWindow.ofHours(24));

        assertThat(attempted).hasSize(3);
        assertThat(summary.firesQueued()).isEqualTo(15);
        assertThat(summary.batchesFailed()).isEqualTo(1);

        ArgumentCaptor<PipelineRun> run = ArgumentCaptor.forClass(PipelineRun.class);
        verify(fireStore).writeRun(run.capture());
        assertThat(run.getValue().getStatus()).isEqualTo("PARTIAL");
    }

    @Test
    @DisplayName("Should publish nothing for an empty feed")
    void shouldHandleEmptyFeed() {
        when(feedClient.fetch(any())).thenReturn(List.of());

        FetchSummary summary = stage(published::add).run(FetchWindow.ofHours(24));

        assertThat(published).isEmpty();
        assertThat(summary.batchesQueued()).isZero();
    }

    @Test
    @DisplayName("Should record a failed run and rethrow when the feed is down")
    void shouldPropagateFeedFailure() {
        when(feedClient.fetch(any())).thenThrow(new FeedUnavailableException("FIRMS returned HTTP 503"));

        assertThatThrownBy(() -> stage(published::add).run(FetchWindow.ofHours(24)))
                .isInstanceOf(FeedUnavailableException.class);

        ArgumentCaptor<PipelineRun> run = ArgumentCaptor.forClass(PipelineRun.class);
        verify(fireStore).writeRun(run.capture());
        assertThat(run.getValue().getStatus()).isEqualTo("FAILED");
        assertThat(run.getValue().getErrorMessage()).contains("503");
    }

    @Test
    @DisplayName("Should partition preserving order")
    void shouldPartition() {
        assertThat(FetchStage.partition(List.of(1, 2, 3, 4, 5), 2))
                .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
        assertThat(FetchStage.partition(List.of(), 10)).isEmpty();
    }

    @Test
    @DisplayName("Should convert trailing windows to whole FIRMS days")
    void shouldComputeDayRange() {
        assertThat(FetchWindow.ofHours(24).dayRange()).isEqualTo(1);
        assertThat(FetchWindow.ofHours(25).dayRange()).isEqualTo(2);
        assertThat(FetchWindow.ofHours(0).dayRange()).isEqualTo(1);
        assertThat(FetchWindow.ofHours(24 * 30).dayRange()).isEqualTo(FetchWindow.MAX_DAY_RANGE);
    }

    private FetchStage stage(BatchChannel channel) {
        return new FetchStage(feedClient, channel, fireStore, 10, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private List<RawFireEvent> fires(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> rawFire(10 + i * 0.01, 20))
                .toList();
    }
}
