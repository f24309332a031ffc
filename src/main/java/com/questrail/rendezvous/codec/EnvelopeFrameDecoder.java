package com.questrail.rendezvous.codec;

import com.questrail.rendezvous.internal.frame.EnvelopeFrame;

import java.util.Optional;

/**
 * EnvelopeFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for rendezvous datagrams.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating magic, version and checksum</li>
 *   <li>Detecting truncation or corruption</li>
 *   <li>Constructing an {@link EnvelopeFrame} on success</li>
 * </ul>
 *
 * <p>All failures at this layer are transport defects. They must not reach
 * the rendezvous table: a defective datagram is dropped.</p>
 */
public interface EnvelopeFrameDecoder
{
    /**
     * Attempt to decode exactly one datagram.
     *
     * @return the frame if the datagram is well-formed;
     *         {@link Optional#empty()} if it is invalid or corrupt
     */
    Optional<EnvelopeFrame> decode(byte[] datagram);
}
