package com.questrail.rendezvous.api;

import com.questrail.rendezvous.key.RendezvousKey;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Extension for backends that can receive a batch of keys as one operation.
 */
public interface FusedRendezvous extends Rendezvous
{
    /**
     * Receive every key in {@code keys}. The result lists deliveries in key
     * order and completes once all of them have arrived, or fails with the
     * first failure.
     */
    CompletableFuture<List<Delivery>> fuseRecvAsync(List<RendezvousKey> keys, TransferContext context);
}
