package com.questrail.pbx.observability;

/**
 * Main interface for receiving PBX observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive while a telephone unit or the directory is locked;
 * implementations must not call back into the PBX.</p>
 */
public interface PbxObservabilitySink {
    /**
     * Called after every telephone unit operation, including those that only
     * re-notified the current state.
     * @param event the transition details
     */
    void onStateTransition(TuStateTransitionEvent event);

    /**
     * Called when a unit is registered, rejected, or unregistered, and when the
     * directory drains during shutdown.
     * @param event the registry event
     */
    void onRegistryEvent(PbxRegistryEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(PbxErrorEvent event);
}
