package com.questrail.rendezvous.api;

/**
 * Callback form of an asynchronous receive.
 *
 * <p>Invoked exactly once: with {@link Status#ok()} and the delivery when the
 * channel is matched, or with the failure status and a {@code null} delivery
 * (for example the abort status).</p>
 */
@FunctionalInterface
public interface DoneCallback
{
    void done(Status status, Delivery delivery);
}
