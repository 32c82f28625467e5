package com.firewatch.pipeline.model;

/**
 * Place names resolved for a coordinate. Any field may be null.
 */
public record LocationInfo(String city, String locality, String state, String country) {

    public boolean hasAnyField() {
        return city != null || locality != null || state != null || country != null;
    }
}
