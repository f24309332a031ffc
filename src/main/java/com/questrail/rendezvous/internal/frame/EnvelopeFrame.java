package com.questrail.rendezvous.internal.frame;

import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.key.RendezvousKey;

import java.util.Objects;

/**
 * EnvelopeFrame
 * -----------------------------------------------------------------------------
 * One send carried between processes: the key it was sent on, the sender's
 * transfer context and the envelope itself.
 *
 * <p>This is the post-wire form. Magic, version and checksum handling live
 * exclusively in the codec layer.</p>
 */
public record EnvelopeFrame(RendezvousKey key, TransferContext senderContext, Envelope envelope)
{
    public EnvelopeFrame {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(senderContext, "senderContext");
        Objects.requireNonNull(envelope, "envelope");
    }

    @Override
    public String toString() {
        return "EnvelopeFrame[" +
                "key=" + key.fullKey() +
                ", attributes=" + senderContext.attributes().size() +
                ", payloadLength=" + envelope.size() +
                ", live=" + envelope.isLive() +
                ']';
    }
}
