package com.questrail.callwatch.protocol.ami.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the manager protocol stack.
 */
public record AmiErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
