package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.RawFireEvent;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses a FIRMS area CSV response into raw detections.
 *
 * Columns are looked up by header name, so VIIRS and MODIS products both work:
 *   VIIRS: latitude,longitude,bright_ti4,scan,track,acq_date,acq_time,satellite,
 *          instrument,confidence,version,bright_ti5,frp,daynight
 *   MODIS: latitude,longitude,brightness,scan,track,acq_date,acq_time,satellite,
 *          instrument,confidence,version,bright_t31,frp,daynight
 *
 * Cells are passed on as text, blanks as null; the validator decides what they mean.
 */
@Component
@Slf4j
public class FirmsCsvParser {

    private static final String COL_LATITUDE   = "latitude";
    private static final String COL_LONGITUDE  = "longitude";
    private static final String COL_BRIGHTNESS = "brightness";
    private static final String COL_BRIGHT_TI4 = "bright_ti4";
    private static final String COL_CONFIDENCE = "confidence";
    private static final String COL_FRP        = "frp";
    private static final String COL_ACQ_DATE   = "acq_date";
    private static final String COL_ACQ_TIME   = "acq_time";
    private static final String COL_SATELLITE  = "satellite";
    private static final String COL_INSTRUMENT = "instrument";
    private static final String COL_DAYNIGHT   = "daynight";

    public List<RawFireEvent> parse(String csv) {
        if (csv == null || csv.isBlank()) return List.of();

        List<String[]> rows;
        try (CSVReader reader = new CSVReader(new StringReader(csv.strip()))) {
            rows = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new FeedUnavailableException("Unreadable FIRMS CSV: " + e.getMessage(), e);
        }

        if (rows.isEmpty()) return List.of();

        Map<String, Integer> header = indexHeader(rows.get(0));
        if (!header.containsKey(COL_LATITUDE) || !header.containsKey(COL_LONGITUDE)) {
            throw new FeedUnavailableException("Unexpected FIRMS response, no coordinate columns: "
                    + abbreviate(String.join(",", rows.get(0))));
        }

        List<RawFireEvent> events = new ArrayList<>();
        int malformed = 0;

        // Skip header (index 0)
        for (int i = 1; i < rows.size(); i++) {
            String[] cols = rows.get(i);
            if (cols.length == 1 && cols[0].isBlank()) continue;

            if (cols.length < header.size()) {
                malformed++;
                continue;
            }

            String brightnessCol = header.containsKey(COL_BRIGHTNESS) ? COL_BRIGHTNESS : COL_BRIGHT_TI4;

            events.add(RawFireEvent.builder()
                    .latitude(emptyToNull(get(cols, header, COL_LATITUDE)))
                    .longitude(emptyToNull(get(cols, header, COL_LONGITUDE)))
                    .brightness(emptyToNull(get(cols, header, brightnessCol)))
                    .confidence(emptyToNull(get(cols, header, COL_CONFIDENCE)))
                    .frp(emptyToNull(get(cols, header, COL_FRP)))
                    .acqDate(emptyToNull(get(cols, header, COL_ACQ_DATE)))
                    .acqTime(emptyToNull(get(cols, header, COL_ACQ_TIME)))
                    .satellite(emptyToNull(get(cols, header, COL_SATELLITE)))
                    .instrument(emptyToNull(get(cols, header, COL_INSTRUMENT)))
                    .daynight(emptyToNull(get(cols, header, COL_DAYNIGHT)))
                    .build());
        }

        log.info("Parsed FIRMS CSV: {} detections, {} short rows skipped", events.size(), malformed);
        return events;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            index.put(header[i].trim().toLowerCase(Locale.ROOT), i);
        }
        return index;
    }

    private String get(String[] cols, Map<String, Integer> header, String name) {
        Integer idx = header.get(name);
        if (idx == null || idx >= cols.length) return "";
        return cols[idx] == null ? "" : cols[idx].trim();
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }

    private String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
