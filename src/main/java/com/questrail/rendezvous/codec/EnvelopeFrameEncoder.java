package com.questrail.rendezvous.codec;

import com.questrail.rendezvous.internal.frame.EnvelopeFrame;

/**
 * EnvelopeFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for rendezvous datagrams; the mechanical inverse of
 * {@link EnvelopeFrameDecoder}.
 *
 * <p>The encoder does not enforce datagram size limits. Callers compare the
 * result against {@link #MAX_DATAGRAM_BYTES} before handing it to a UDP
 * transport.</p>
 */
public interface EnvelopeFrameEncoder
{
    /** Largest UDP payload over IPv4. */
    int MAX_DATAGRAM_BYTES = 65_507;

    /**
     * Encode a frame into a wire-ready datagram payload.
     */
    byte[] encode(EnvelopeFrame frame);
}
