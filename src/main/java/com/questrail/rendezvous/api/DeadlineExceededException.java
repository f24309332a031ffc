package com.questrail.rendezvous.api;

/**
 * A blocking receive gave up because its deadline elapsed first.
 */
public final class DeadlineExceededException extends RendezvousException
{
    public DeadlineExceededException(String message) {
        super(Status.deadlineExceeded(message));
    }
}
