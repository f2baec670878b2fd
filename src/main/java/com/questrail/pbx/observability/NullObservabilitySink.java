package com.questrail.pbx.observability;

/**
 * No-op implementation of PbxObservabilitySink.
 */
public final class NullObservabilitySink implements PbxObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(TuStateTransitionEvent event) {}

    @Override
    public void onRegistryEvent(PbxRegistryEvent event) {}

    @Override
    public void onError(PbxErrorEvent event) {}
}
