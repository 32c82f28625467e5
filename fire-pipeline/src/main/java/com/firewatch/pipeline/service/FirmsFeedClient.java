package com.firewatch.pipeline.service;

import com.firewatch.pipeline.config.FeedSettings;
import com.firewatch.pipeline.model.FetchWindow;
import com.firewatch.pipeline.model.RawFireEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Thin client over the NASA FIRMS area API.
 *
 * URL format: {base}/api/area/csv/{MAP_KEY}/{SOURCE}/{AREA}/{DAY_RANGE}
 * e.g. https://firms.modaps.eosdis.nasa.gov/api/area/csv/abc123/VIIRS_SNPP_NRT/world/1
 *
 * An empty feed is a normal outcome; FIRMS answers 404 when a product has no data.
 */
@Slf4j
public class FirmsFeedClient {

    private final RestTemplate restTemplate;
    private final FeedSettings settings;
    private final FirmsCsvParser parser;

    public FirmsFeedClient(RestTemplate restTemplate, FeedSettings settings, FirmsCsvParser parser) {
        this.restTemplate = restTemplate;
        this.settings = settings;
        this.parser = parser;
    }

    /**
     * Fetch every detection in the trailing window.
     *
     * @return detections in feed order (may be empty, never null)
     * @throws FeedNotConfiguredException if no map key is configured
     * @throws FeedUnavailableException   on any other HTTP or parse failure
     */
    public List<RawFireEvent> fetch(FetchWindow window) {
        if (!settings.isConfigured()) {
            throw new FeedNotConfiguredException("FIRMS map key not configured");
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(settings.baseUrl())
                .pathSegment("api", "area", "csv",
                        settings.mapKey(), settings.source(), settings.area(),
                        String.valueOf(window.dayRange()))
                .build()
                .toUri();

        log.info("Fetching FIRMS {} / {} for the last {} day(s)",
                settings.source(), settings.area(), window.dayRange());

        try {
            String body = restTemplate.getForObject(uri, String.class);
            return parser.parse(body);

        } catch (HttpClientErrorException.NotFound e) {
            log.info("No fire data available (404)");
            return List.of();

        } catch (RestClientResponseException e) {
            throw new FeedUnavailableException("FIRMS returned HTTP " + e.getStatusCode().value(), e);

        } catch (RestClientException e) {
            // the message would carry the request URL, and with it the map key
            throw new FeedUnavailableException("FIRMS request failed: " + e.getClass().getSimpleName(), e);
        }
    }
}
