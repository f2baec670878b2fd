package com.questrail.pbx.observability;

import com.questrail.pbx.api.TuState;

import java.time.Instant;

/**
 * Record representing a call-state transition of one telephone unit.
 *
 * <p>{@code oldState == newState} for operations that had no effect and only
 * re-notified the client.</p>
 */
public record TuStateTransitionEvent(
    Instant timestamp,
    int extension,
    TuState oldState,
    TuState newState,
    String operation
) {
    public boolean isStateChange() {
        return oldState != newState;
    }
}
