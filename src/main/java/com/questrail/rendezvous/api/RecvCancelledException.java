package com.questrail.rendezvous.api;

/**
 * A blocking receive gave up because its cancellation token fired first.
 */
public final class RecvCancelledException extends RendezvousException
{
    public RecvCancelledException(String message) {
        super(Status.cancelled(message));
    }
}
