package com.questrail.rendezvous.api;

/**
 * Raised by every operation on a rendezvous after it has been aborted.
 *
 * <p>{@link #status()} is the status that was passed to
 * {@link Rendezvous#abort(Status)}, unchanged.</p>
 */
public final class RendezvousAbortedException extends RendezvousException
{
    public RendezvousAbortedException(Status abortStatus) {
        super(abortStatus);
    }
}
