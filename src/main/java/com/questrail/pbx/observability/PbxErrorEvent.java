package com.questrail.pbx.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the PBX.
 */
public record PbxErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
