package com.firewatch.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "firewatch")
@Data
public class FirewatchProperties {

    private Feed feed = new Feed();
    private Enrichment enrichment = new Enrichment();
    private Store store = new Store();
    private Process process = new Process();
    private Messaging messaging = new Messaging();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Feed {
        private String baseUrl = "https://firms.modaps.eosdis.nasa.gov";
        private String source = "VIIRS_SNPP_NRT";
        private String area = "world";
        private int trailingWindowHours = 24;
        private int batchSize = 10;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Enrichment {
        private String baseUrl = "https://api.bigdatacloud.net";
        private String localityLanguage = "en";
        private Duration timeout = Duration.ofSeconds(10);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Store {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class Process {
        /** Parallel workers per batch; bounds concurrent geocoding calls */
        private int concurrency = 4;
    }

    @Data
    public static class Messaging {
        private String ingestQueue = "firewatch.fires.ingest";
        private String parkedQueue = "firewatch.fires.ingest.parked";
        private String deadLetterQueue = "firewatch.fires.dead-letter";
        private String mutationQueue = "firewatch.fires.mutations";
        private String alertExchange = "firewatch.alerts";
        private int mutationCycleSize = 100;
        private Duration mutationCycleTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Scheduling {
        private String fetchCron = "0 */15 * * * *";
        private String backfillCron = "0 30 * * * *";
        private boolean runOnStartup = false;
        private int backfillLimit = 200;
    }
}
