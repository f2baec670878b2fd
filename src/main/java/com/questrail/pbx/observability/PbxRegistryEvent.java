package com.questrail.pbx.observability;

import java.time.Instant;

/**
 * Record representing a change in extension directory membership.
 */
public record PbxRegistryEvent(
    Instant timestamp,
    Kind kind,
    int extension,
    int occupied,
    int capacity,
    String connection
) {
    public enum Kind {
        REGISTERED,
        REJECTED,
        UNREGISTERED,
        DRAINED
    }
}
