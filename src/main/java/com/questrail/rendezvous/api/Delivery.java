package com.questrail.rendezvous.api;

import java.util.Objects;

/**
 * What a consumer receives once its channel is matched: the producer's
 * envelope and both sides' transfer contexts.
 */
public record Delivery(Envelope envelope, TransferContext senderContext, TransferContext receiverContext)
{
    public Delivery {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(senderContext, "senderContext");
        Objects.requireNonNull(receiverContext, "receiverContext");
    }

    public boolean isDead() {
        return envelope.isDead();
    }
}
