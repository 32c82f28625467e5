package com.firewatch.pipeline.output;

import com.firewatch.pipeline.model.DeadLetter;

/**
 * Terminal sink for detections that could not be stored. Never consumed by the pipeline.
 */
@FunctionalInterface
public interface DeadLetterChannel {

    /**
     * @throws com.firewatch.pipeline.service.ChannelUnavailableException if the record was not accepted
     */
    void publish(DeadLetter deadLetter);
}
