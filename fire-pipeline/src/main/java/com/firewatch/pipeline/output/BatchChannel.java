package com.firewatch.pipeline.output;

import com.firewatch.pipeline.model.FireBatch;

/**
 * At-least-once delivery of fetched batches to the process stage.
 */
@FunctionalInterface
public interface BatchChannel {

    /**
     * @throws com.firewatch.pipeline.service.ChannelUnavailableException if the batch was not accepted
     */
    void publish(FireBatch batch);
}
