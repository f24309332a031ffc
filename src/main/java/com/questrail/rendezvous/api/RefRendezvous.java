package com.questrail.rendezvous.api;

import com.questrail.rendezvous.key.RendezvousKey;

/**
 * Extension for backends that can hand a mutable value to a consumer by
 * reference instead of by copy.
 *
 * <p>Ref channels share the abort state of the owning rendezvous but are
 * matched independently of envelope channels.</p>
 */
public interface RefRendezvous extends Rendezvous
{
    /**
     * @throws RendezvousAbortedException if the rendezvous has been aborted
     */
    <T> void sendRef(RendezvousKey key, TransferContext context, ValueRef<T> ref, boolean live);

    /**
     * The delivered reference carries whatever element type the sender used.
     * Sender and receiver of one key agree on it, as they do for envelope
     * payloads.
     */
    RecvHandle<RefDelivery<?>> recvRefAsync(RendezvousKey key, TransferContext context);
}
