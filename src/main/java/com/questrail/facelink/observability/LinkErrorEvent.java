package com.questrail.facelink.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the link stack.
 */
public record LinkErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
