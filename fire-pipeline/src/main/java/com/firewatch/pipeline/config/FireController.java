package com.firewatch.pipeline.config;

import com.firewatch.pipeline.model.FetchWindow;
import com.firewatch.pipeline.model.RegionPage;
import com.firewatch.pipeline.service.EnrichmentBackfillService;
import com.firewatch.pipeline.service.FetchStage;
import com.firewatch.pipeline.service.FireQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class FireController {

    private final FetchStage fetchStage;
    private final EnrichmentBackfillService backfillService;
    private final FireQueryService fireQueryService;
    private final FirewatchProperties properties;

    // ── Pipeline triggers ─────────────────────────────────────────────────────

    @PostMapping("/pipeline/fetch")
    public ResponseEntity<Map<String, String>> triggerFetch() {
        FetchWindow window = FetchWindow.ofHours(properties.getFeed().getTrailingWindowHours());
        new Thread(() -> {
            try {
                fetchStage.run(window);
            } catch (Exception e) {
                log.error("Manual fetch failed: {}", e.getMessage(), e);
            }
        }, "manual-fetch").start();
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "dayRange", String.valueOf(window.dayRange())));
    }

    @PostMapping("/pipeline/backfill")
    public ResponseEntity<Map<String, String>> triggerBackfill(
            @RequestParam(defaultValue = "200") int limit) {
        if (limit < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be >= 1"));
        }
        new Thread(() -> {
            try {
                backfillService.backfill(limit);
            } catch (Exception e) {
                log.error("Manual backfill failed: {}", e.getMessage(), e);
            }
        }, "manual-backfill").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "limit", String.valueOf(limit)));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "firewatch-fire-pipeline",
                "version", "1.0.0",
                "feedSource", properties.getFeed().getSource(),
                "feedArea", properties.getFeed().getArea(),
                "trailingWindowHours", properties.getFeed().getTrailingWindowHours()
        ));
    }

    // ── Fire query API ────────────────────────────────────────────────────────

    /**
     * Fires in a country, oldest first.
     *
     * GET /fires?country=France&from=2024-01-15T00:00:00Z&to=2024-01-16T00:00:00Z&page=0&size=50
     */
    @GetMapping("/fires")
    public ResponseEntity<?> queryByRegion(
            @RequestParam String country,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        try {
            RegionPage result = fireQueryService.queryByRegion(country, from, to, page, size);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Region query failed for {}: {}", country, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/fires/{fireId}")
    public ResponseEntity<?> getFire(@PathVariable String fireId) {
        return fireQueryService.findById(fireId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
