package com.firewatch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Raw DTO for the BigDataCloud reverse-geocode-client response.
 * Kept separate from {@link LocationInfo} to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BigDataCloudLocation {

    private String city;

    private String locality;

    /** State / province / region */
    private String principalSubdivision;

    private String countryName;

    private String countryCode;
}
