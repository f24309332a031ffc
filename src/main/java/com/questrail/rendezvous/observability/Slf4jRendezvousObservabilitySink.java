package com.questrail.rendezvous.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RendezvousObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRendezvousObservabilitySink implements RendezvousObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRendezvousObservabilitySink.class);

    @Override
    public void onPhase(TransferPhaseEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Slice{} {} {} ({} bytes{})",
                event.direction() == TransferPhaseEvent.Direction.SEND ? "Send" : "Recv",
                event.phase(),
                event.key().fullKey(),
                event.payloadBytes(),
                event.live() ? "" : ", dead");
        }
    }

    @Override
    public void onAbort(AbortEvent event) {
        log.warn("Rendezvous aborted: {} ({} pending receives failed)",
            event.status(),
            event.failedWaiters());
    }

    @Override
    public void onError(RendezvousErrorEvent event) {
        log.error("Rendezvous error: {}", event.message(), event.cause());
    }
}
