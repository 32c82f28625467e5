package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.RegionPage;
import com.firewatch.pipeline.output.FireStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.firewatch.pipeline.FireFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FireQueryServiceTest {

    private FireStore fireStore;
    private FireQueryService queryService;

    @BeforeEach
    void setUp() {
        fireStore = mock(FireStore.class);
        when(fireStore.queryByRegion(anyString(), anyLong(), anyLong(), anyInt(), anyInt()))
                .thenReturn(new RegionPage(List.of(), 0, 50, false));
        queryService = new FireQueryService(fireStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should default to the last seven days")
    void shouldDefaultWindow() {
        queryService.queryByRegion("France", null, null, 0, 50);

        verify(fireStore).queryByRegion("France",
                NOW.minusSeconds(7 * 24 * 3600).getEpochSecond(), NOW.getEpochSecond(), 0, 50);
    }

    @Test
    @DisplayName("Should pass explicit bounds through as epoch seconds")
    void shouldUseExplicitWindow() {
        Instant from = Instant.parse("2024-01-01T00:00:00Z");
        Instant to = Instant.parse("2024-01-02T00:00:00Z");

        queryService.queryByRegion(" France ", from, to, 2, 10);

        verify(fireStore).queryByRegion(eq("France"), eq(from.getEpochSecond()), eq(to.getEpochSecond()), eq(2), eq(10));
    }

    @Test
    @DisplayName("Should reject a missing country or an inverted window")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> queryService.queryByRegion(" ", null, null, 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queryService.queryByRegion("France", NOW, NOW.minusSeconds(1), 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should return the store's page unchanged")
    void shouldReturnPage() {
        RegionPage page = queryService.queryByRegion("France", null, null, 0, 50);

        assertThat(page.hasMore()).isFalse();
    }
}
