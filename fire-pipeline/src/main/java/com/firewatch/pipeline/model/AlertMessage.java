package com.firewatch.pipeline.model;

import java.time.Instant;

/**
 * Notification payload published to the alert fan-out exchange.
 */
public record AlertMessage(
        String subject,
        String body,
        String region,
        int fireCount,
        Instant windowStart,
        Instant windowEnd
) { }
