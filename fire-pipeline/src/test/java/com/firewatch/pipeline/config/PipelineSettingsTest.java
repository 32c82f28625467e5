package com.firewatch.pipeline.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineSettingsTest {

    private final PipelineConfig config = new PipelineConfig();

    @Test
    @DisplayName("Should resolve secrets from the environment and ignore blanks")
    void shouldResolveSecrets() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(SecretSource.FIRMS_MAP_KEY, " map-key ")
                .withProperty(SecretSource.BIGDATACLOUD_API_KEY, "");
        SecretSource secrets = new EnvironmentSecretSource(environment);

        assertThat(secrets.get(SecretSource.FIRMS_MAP_KEY)).contains("map-key");
        assertThat(secrets.get(SecretSource.BIGDATACLOUD_API_KEY)).isEmpty();
        assertThat(secrets.get("firewatch.secrets.unknown")).isEmpty();
    }

    @Test
    @DisplayName("Should build feed settings from properties plus the map key")
    void shouldBuildFeedSettings() {
        FirewatchProperties properties = new FirewatchProperties();
        properties.getFeed().setBatchSize(25);
        SecretSource secrets = key -> SecretSource.FIRMS_MAP_KEY.equals(key)
                ? Optional.of("map-key") : Optional.empty();

        FeedSettings feed = config.feedSettings(properties, secrets);
        EnrichmentSettings enrichment = config.enrichmentSettings(properties, secrets);

        assertThat(feed.isConfigured()).isTrue();
        assertThat(feed.batchSize()).isEqualTo(25);
        assertThat(feed.source()).isEqualTo("VIIRS_SNPP_NRT");
        assertThat(enrichment.apiKey()).isNull();
        assertThat(enrichment.maxAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should treat a missing or placeholder map key as unconfigured")
    void shouldDetectUnconfiguredFeed() {
        assertThat(feed(null).isConfigured()).isFalse();
        assertThat(feed("YOUR_MAP_KEY_HERE").isConfigured()).isFalse();
        assertThat(feed("real-key").isConfigured()).isTrue();
    }

    @Test
    @DisplayName("Should reject non-positive sizes")
    void shouldRejectNonPositiveSizes() {
        assertThatThrownBy(() -> new ProcessSettings(0, 3, Duration.ofMillis(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeedSettings("https://firms.test", "k", "VIIRS_SNPP_NRT", "world", 0,
                Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private FeedSettings feed(String mapKey) {
        return new FeedSettings("https://firms.test", mapKey, "VIIRS_SNPP_NRT", "world", 10, Duration.ofSeconds(1));
    }
}
