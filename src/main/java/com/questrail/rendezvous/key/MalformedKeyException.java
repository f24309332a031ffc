package com.questrail.rendezvous.key;

import com.questrail.rendezvous.api.RendezvousException;
import com.questrail.rendezvous.api.Status;

/**
 * A rendezvous key string did not decompose into
 * {@code src;incarnation;dst;channel;frame:iter}, or one of its endpoints is
 * not a well-formed {@link EndpointName}.
 *
 * <p>Fatal to the single operation that tried to use the key; the rendezvous
 * itself is unaffected.</p>
 */
public final class MalformedKeyException extends RendezvousException
{
    public MalformedKeyException(String message) {
        super(Status.invalidArgument(message));
    }
}
