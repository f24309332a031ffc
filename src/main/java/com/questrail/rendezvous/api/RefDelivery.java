package com.questrail.rendezvous.api;

import java.util.Objects;

/**
 * Delivery of an aliased {@link ValueRef}. The consumer receives the very
 * instance the producer sent.
 */
public record RefDelivery<T>(ValueRef<T> ref, boolean live, TransferContext senderContext, TransferContext receiverContext)
{
    public RefDelivery {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(senderContext, "senderContext");
        Objects.requireNonNull(receiverContext, "receiverContext");
    }
}
