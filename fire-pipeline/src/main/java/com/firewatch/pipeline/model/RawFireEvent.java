package com.firewatch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One detection as it arrives from the FIRMS feed.
 *
 * Every field is kept as the text the feed sent, numbers included, so a malformed value
 * travels through the batch untouched and the validator can reject that one detection with
 * its original payload intact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawFireEvent {

    private String latitude;

    private String longitude;

    /** Brightness temperature in Kelvin */
    private String brightness;

    /** low | nominal | high, VIIRS letters l | n | h, or a MODIS percentage */
    private String confidence;

    /** Fire radiative power in MW */
    private String frp;

    /** YYYY-MM-DD */
    @JsonProperty("acq_date")
    private String acqDate;

    /** HHMM, leading zeros may be missing */
    @JsonProperty("acq_time")
    private String acqTime;

    private String satellite;

    private String instrument;

    /** D | N */
    private String daynight;

    /**
     * Reads a batch element without ever failing: scalars become their text, nested
     * structures their JSON, and anything that is not an object an empty event.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RawFireEvent fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new RawFireEvent();
        }
        return RawFireEvent.builder()
                .latitude(text(node, "latitude"))
                .longitude(text(node, "longitude"))
                .brightness(text(node, "brightness"))
                .confidence(text(node, "confidence"))
                .frp(text(node, "frp"))
                .acqDate(text(node, "acq_date"))
                .acqTime(text(node, "acq_time"))
                .satellite(text(node, "satellite"))
                .instrument(text(node, "instrument"))
                .daynight(text(node, "daynight"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
