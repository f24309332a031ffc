package com.questrail.rendezvous.cancel;

import com.questrail.rendezvous.api.Delivery;
import com.questrail.rendezvous.api.RendezvousException;

import java.util.Objects;

/**
 * Result of a blocking receive race. Exactly one of {@code delivery} and
 * {@code failure} is non-null.
 */
public record RecvResult(RecvOutcome outcome, Delivery delivery, RendezvousException failure)
{
    public RecvResult {
        Objects.requireNonNull(outcome, "outcome");
        if ((outcome == RecvOutcome.DELIVERED) != (delivery != null) || (delivery == null) == (failure == null)) {
            throw new IllegalArgumentException("inconsistent result: " + outcome);
        }
    }

    static RecvResult delivered(Delivery delivery) {
        return new RecvResult(RecvOutcome.DELIVERED, Objects.requireNonNull(delivery, "delivery"), null);
    }

    static RecvResult failed(RecvOutcome outcome, RendezvousException failure) {
        return new RecvResult(outcome, null, Objects.requireNonNull(failure, "failure"));
    }

    /**
     * The delivery, or the failure thrown.
     *
     * @throws RendezvousException if the receive did not deliver
     */
    public Delivery orThrow() {
        if (failure != null) {
            throw failure;
        }
        return delivery;
    }
}
