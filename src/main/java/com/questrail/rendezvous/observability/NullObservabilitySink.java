package com.questrail.rendezvous.observability;

/**
 * No-op implementation of RendezvousObservabilitySink.
 */
public final class NullObservabilitySink implements RendezvousObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhase(TransferPhaseEvent event) {}

    @Override
    public void onAbort(AbortEvent event) {}

    @Override
    public void onError(RendezvousErrorEvent event) {}
}
