package com.firewatch.pipeline.service;

import com.firewatch.pipeline.model.FireRecord;
import com.firewatch.pipeline.model.LocationInfo;
import com.firewatch.pipeline.model.ValidatedFireEvent;
import org.springframework.stereotype.Component;

/**
 * Maps a validated detection to the persisted {@link FireRecord}.
 * {@code createdAt} is left unset, the store stamps it on first insert.
 */
@Component
public class FireRecordMapper {

    /**
     * @param event    Validated detection
     * @param fireId   Fingerprint for the detection
     * @param location Geocoding result, or null when enrichment was unavailable
     */
    public FireRecord map(ValidatedFireEvent event, String fireId, LocationInfo location) {
        FireRecord record = FireRecord.builder()
                .fireId(fireId)
                .latitude(event.latitude())
                .longitude(event.longitude())
                .brightness(event.brightness())
                .confidence(event.confidence())
                .frp(event.frp())
                .acqDate(event.acquisitionDate())
                .acqTime(event.acquisitionTimeHhmm())
                .satellite(event.satellite())
                .instrument(event.instrument())
                .dayNight(event.dayNight())
                .timestamp(event.epochSeconds())
                .build();

        return record.withLocation(location);
    }
}
