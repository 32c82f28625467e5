package com.firewatch.pipeline.config;

import com.firewatch.pipeline.output.BatchChannel;
import com.firewatch.pipeline.output.DeadLetterChannel;
import com.firewatch.pipeline.output.FireStore;
import com.firewatch.pipeline.service.FetchStage;
import com.firewatch.pipeline.service.FireEventValidator;
import com.firewatch.pipeline.service.FireFingerprint;
import com.firewatch.pipeline.service.FireRecordMapper;
import com.firewatch.pipeline.service.FirmsCsvParser;
import com.firewatch.pipeline.service.FirmsFeedClient;
import com.firewatch.pipeline.service.LocationEnricher;
import com.firewatch.pipeline.service.ProcessStage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Builds the stages with explicit settings. Secrets are resolved here, once; the stages
 * themselves never look at the environment.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecretSource secretSource(Environment environment) {
        return new EnvironmentSecretSource(environment);
    }

    @Bean
    public FeedSettings feedSettings(FirewatchProperties properties, SecretSource secrets) {
        FirewatchProperties.Feed feed = properties.getFeed();
        return new FeedSettings(
                feed.getBaseUrl(),
                secrets.get(SecretSource.FIRMS_MAP_KEY).orElse(null),
                feed.getSource(),
                feed.getArea(),
                feed.getBatchSize(),
                feed.getTimeout());
    }

    @Bean
    public EnrichmentSettings enrichmentSettings(FirewatchProperties properties, SecretSource secrets) {
        FirewatchProperties.Enrichment enrichment = properties.getEnrichment();
        return new EnrichmentSettings(
                enrichment.getBaseUrl(),
                secrets.get(SecretSource.BIGDATACLOUD_API_KEY).orElse(null),
                enrichment.getLocalityLanguage(),
                enrichment.getTimeout(),
                enrichment.getMaxAttempts(),
                enrichment.getInitialBackoff(),
                enrichment.getBackoffMultiplier());
    }

    @Bean
    public ProcessSettings processSettings(FirewatchProperties properties) {
        return new ProcessSettings(
                properties.getProcess().getConcurrency(),
                properties.getStore().getMaxAttempts(),
                properties.getStore().getInitialBackoff());
    }

    @Bean
    public RestTemplate feedRestTemplate(RestTemplateBuilder builder, FeedSettings settings) {
        return builder
                .setConnectTimeout(settings.timeout())
                .setReadTimeout(settings.timeout())
                .build();
    }

    @Bean
    public RestTemplate geocodingRestTemplate(RestTemplateBuilder builder, EnrichmentSettings settings) {
        return builder
                .setConnectTimeout(settings.timeout())
                .setReadTimeout(settings.timeout())
                .build();
    }

    @Bean
    public FirmsFeedClient firmsFeedClient(@Qualifier("feedRestTemplate") RestTemplate restTemplate,
                                           FeedSettings settings, FirmsCsvParser parser) {
        return new FirmsFeedClient(restTemplate, settings, parser);
    }

    @Bean
    public LocationEnricher locationEnricher(@Qualifier("geocodingRestTemplate") RestTemplate restTemplate,
                                             EnrichmentSettings settings) {
        return new LocationEnricher(restTemplate, settings);
    }

    @Bean
    public FetchStage fetchStage(FirmsFeedClient feedClient, BatchChannel batchChannel, FireStore fireStore,
                                 FeedSettings settings, Clock clock) {
        return new FetchStage(feedClient, batchChannel, fireStore, settings.batchSize(), clock);
    }

    @Bean
    public ProcessStage processStage(FireEventValidator validator,
                                     FireFingerprint fingerprint,
                                     FireRecordMapper mapper,
                                     LocationEnricher enricher,
                                     FireStore fireStore,
                                     DeadLetterChannel deadLetterChannel,
                                     ProcessSettings settings,
                                     Clock clock) {
        return new ProcessStage(validator, fingerprint, mapper, enricher, fireStore,
                deadLetterChannel, settings, clock);
    }
}
