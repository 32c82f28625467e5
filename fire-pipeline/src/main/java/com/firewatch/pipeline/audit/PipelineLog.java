package com.firewatch.pipeline.audit;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Tags lifecycle log lines with an {@code event.type} MDC entry so they can be filtered
 * downstream, e.g. every BATCH_ACKED or FIRE_DEAD_LETTERED line.
 */
public final class PipelineLog {

    public static final String EVENT_TYPE = "event.type";
    public static final String BATCH_ID = "batch.id";
    public static final String FIRE_ID = "fire.id";

    private PipelineLog() {
    }

    public static void event(Logger logger, String eventType, String message, Object... args) {
        if (logger.isInfoEnabled()) {
            MDC.put(EVENT_TYPE, eventType);
            try {
                logger.info(message, args);
            } finally {
                MDC.remove(EVENT_TYPE);
            }
        }
    }

    public static void warn(Logger logger, String eventType, String message, Object... args) {
        if (logger.isWarnEnabled()) {
            MDC.put(EVENT_TYPE, eventType);
            try {
                logger.warn(message, args);
            } finally {
                MDC.remove(EVENT_TYPE);
            }
        }
    }

    public static void error(Logger logger, String eventType, String message, Throwable throwable) {
        if (logger.isErrorEnabled()) {
            MDC.put(EVENT_TYPE, eventType);
            try {
                logger.error(message, throwable);
            } finally {
                MDC.remove(EVENT_TYPE);
            }
        }
    }
}
