package com.questrail.rendezvous.observability;

/**
 * Receives rendezvous and transfer observability events. Implementations can
 * provide logging, metrics, or tracing; they must not throw and must return
 * quickly because they are called on transfer paths.
 */
public interface RendezvousObservabilitySink {
    /**
     * Called for every phase a sliced transfer sends or receives.
     */
    void onPhase(TransferPhaseEvent event);

    /**
     * Called once, when a rendezvous is aborted.
     */
    void onAbort(AbortEvent event);

    /**
     * Called when an error is detected that has no caller to report to.
     */
    void onError(RendezvousErrorEvent event);
}
