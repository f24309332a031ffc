package com.questrail.rendezvous.protocol.slice;

import com.questrail.rendezvous.api.RendezvousException;
import com.questrail.rendezvous.api.Status;

/**
 * The peer broke the sliced transfer protocol: a phase after the first
 * arrived dead, a slice or element had the wrong length, or a metadata
 * envelope could not be decoded.
 *
 * <p>Indicates a bug or a mismatched peer configuration. The transfer is
 * abandoned and never retried.</p>
 */
public final class ProtocolViolationException extends RendezvousException
{
    public ProtocolViolationException(String message) {
        super(Status.internal(message));
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(Status.internal(message), cause);
    }
}
