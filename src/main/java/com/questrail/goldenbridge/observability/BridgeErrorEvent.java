package com.questrail.goldenbridge.observability;

import java.time.Instant;

/**
 * Record representing a failure detected by the golden bridge.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
