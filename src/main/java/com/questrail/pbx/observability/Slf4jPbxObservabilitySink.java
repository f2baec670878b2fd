package com.questrail.pbx.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PbxObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPbxObservabilitySink implements PbxObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPbxObservabilitySink.class);

    @Override
    public void onStateTransition(TuStateTransitionEvent event) {
        if (event.isStateChange()) {
            log.debug("Extension {}: {} {} -> {}",
                event.extension(),
                event.operation(),
                event.oldState(),
                event.newState());
        } else {
            log.trace("Extension {}: {} left state {}",
                event.extension(),
                event.operation(),
                event.newState());
        }
    }

    @Override
    public void onRegistryEvent(PbxRegistryEvent event) {
        switch (event.kind()) {
            case REJECTED:
                log.warn("Registration refused ({}/{} in use), closing {}",
                    event.occupied(), event.capacity(), event.connection());
                break;
            case DRAINED:
                log.info("Directory drained");
                break;
            default:
                log.info("Extension {} {} ({}), {}/{} in use",
                    event.extension(),
                    event.kind() == PbxRegistryEvent.Kind.REGISTERED ? "registered" : "unregistered",
                    event.connection(),
                    event.occupied(),
                    event.capacity());
        }
    }

    @Override
    public void onError(PbxErrorEvent event) {
        log.error("PBX Error: {}", event.message(), event.cause());
    }
}
