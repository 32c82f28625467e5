package com.firewatch.pipeline.output;

import com.firewatch.pipeline.model.AlertMessage;

/**
 * Fan-out destination for formatted alerts.
 */
@FunctionalInterface
public interface AlertSink {

    void publish(AlertMessage message);
}
