package com.firewatch.pipeline.service;

import com.firewatch.pipeline.config.EnrichmentSettings;
import com.firewatch.pipeline.model.BigDataCloudLocation;
import com.firewatch.pipeline.model.LocationInfo;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Optional;

/**
 * Reverse-geocodes a coordinate through the BigDataCloud reverse-geocode-client API.
 *
 * Works without an API key at a reduced quota. Transient failures (I/O, timeout, 5xx, 429)
 * are retried with exponential backoff; once the attempts are used up, or on any other
 * client error, the result is empty. Callers store the fire regardless and leave the
 * location columns for the backfill job.
 *
 * Example: (37.7749, -122.4194) → San Francisco, California, United States of America
 */
@Slf4j
public class LocationEnricher {

    static final String REVERSE_GEOCODE_PATH = "/data/reverse-geocode-client";

    private final RestTemplate restTemplate;
    private final EnrichmentSettings settings;
    private final Retry retry;

    public LocationEnricher(RestTemplate restTemplate, EnrichmentSettings settings) {
        this.restTemplate = restTemplate;
        this.settings = settings;
        this.retry = Retry.of("enrichment", RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.initialBackoff(), settings.backoffMultiplier()))
                .retryExceptions(TransientEnrichmentException.class)
                .build());

        if (settings.apiKey() == null) {
            log.info("No BigDataCloud API key configured, geocoding runs on the unauthenticated tier");
        }
    }

    public Optional<LocationInfo> enrich(double latitude, double longitude) {
        try {
            return retry.executeSupplier(() -> lookup(latitude, longitude));
        } catch (TransientEnrichmentException e) {
            log.warn("Geocoding unavailable for ({}, {}) after {} attempt(s): {}",
                    latitude, longitude, settings.maxAttempts(), e.getMessage());
            return Optional.empty();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<LocationInfo> lookup(double latitude, double longitude) {
        URI uri = buildUri(latitude, longitude);
        try {
            BigDataCloudLocation response = restTemplate.getForObject(uri, BigDataCloudLocation.class);
            if (response == null) {
                return Optional.empty();
            }

            LocationInfo location = new LocationInfo(
                    emptyToNull(response.getCity()),
                    emptyToNull(response.getLocality()),
                    emptyToNull(response.getPrincipalSubdivision()),
                    emptyToNull(response.getCountryName()));

            log.debug("({}, {}) → {}", latitude, longitude, location);
            return location.hasAnyField() ? Optional.of(location) : Optional.empty();

        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new TransientEnrichmentException("rate limited (429)", e);

        } catch (HttpServerErrorException e) {
            throw new TransientEnrichmentException("geocoder returned HTTP " + e.getStatusCode().value(), e);

        } catch (ResourceAccessException e) {
            throw new TransientEnrichmentException("geocoder unreachable: " + e.getMessage(), e);

        } catch (HttpClientErrorException e) {
            log.warn("Geocoder rejected ({}, {}) with HTTP {}, not retrying",
                    latitude, longitude, e.getStatusCode().value());
            return Optional.empty();

        } catch (RestClientException e) {
            log.warn("Unreadable geocoder response for ({}, {}): {}", latitude, longitude, e.getMessage());
            return Optional.empty();
        }
    }

    private URI buildUri(double latitude, double longitude) {
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(settings.baseUrl() + REVERSE_GEOCODE_PATH)
                .queryParam("latitude", latitude)
                .queryParam("longitude", longitude)
                .queryParam("localityLanguage", settings.localityLanguage());

        if (settings.apiKey() != null) {
            builder.queryParam("key", settings.apiKey());
        }
        return builder.build().toUri();
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }
}
