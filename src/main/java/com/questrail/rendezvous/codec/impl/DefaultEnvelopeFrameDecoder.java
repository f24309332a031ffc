package com.questrail.rendezvous.codec.impl;

import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.codec.EnvelopeFrameDecoder;
import com.questrail.rendezvous.internal.frame.EnvelopeFrame;
import com.questrail.rendezvous.key.MalformedKeyException;
import com.questrail.rendezvous.key.RendezvousKey;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * DefaultEnvelopeFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EnvelopeFrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Length and checksum validation</li>
 *   <li>Preamble (magic, version, flags)</li>
 *   <li>Structural parsing of key, attributes and payload</li>
 *   <li>Key parsing into {@link RendezvousKey}</li>
 * </ol>
 *
 * <p>A frame whose key does not parse is dropped like any other defect: the
 * sender validated the key before encoding, so a bad key means corruption
 * that slipped past the checksum or a foreign sender.</p>
 */
public final class DefaultEnvelopeFrameDecoder implements EnvelopeFrameDecoder
{
    @Override
    public Optional<EnvelopeFrame> decode(byte[] datagram)
    {
        try {
            if (datagram == null || datagram.length < FrameLayout.MIN_FRAME_LENGTH) {
                throw new FramingException("Datagram too short for rendezvous frame");
            }

            // 1) Checksum covers everything before it
            FrameChecksum.validate(datagram);
            ByteBuffer buf = ByteBuffer.wrap(datagram, 0, datagram.length - FrameChecksum.LENGTH);

            // 2) Preamble
            if (buf.get() != FrameLayout.MAGIC_0 || buf.get() != FrameLayout.MAGIC_1) {
                throw new FramingException("Bad magic");
            }
            int version = buf.get() & 0xFF;
            if (version != FrameLayout.VERSION) {
                throw new FramingException("Unsupported frame version " + version);
            }
            int flags = buf.get() & 0xFF;
            boolean live = (flags & FrameLayout.FLAG_LIVE) != 0;

            // 3) Structure
            String key = readString(buf);
            int attributeCount = buf.getShort() & 0xFFFF;
            Map<String, String> attributes = new LinkedHashMap<>();
            for (int i = 0; i < attributeCount; i++) {
                String name = readString(buf);
                attributes.put(name, readString(buf));
            }

            int payloadLength = buf.getInt();
            if (payloadLength < 0 || payloadLength != buf.remaining()) {
                throw new FramingException("Payload length " + payloadLength + " does not match frame");
            }
            if (!live && payloadLength != 0) {
                throw new FramingException("Dead frame carries a payload");
            }
            Envelope envelope;
            if (live) {
                byte[] payload = new byte[payloadLength];
                buf.get(payload);
                envelope = Envelope.live(payload);
            } else {
                envelope = Envelope.dead();
            }

            // 4) Key
            return Optional.of(new EnvelopeFrame(RendezvousKey.parse(key), new TransferContext(attributes), envelope));
        }
        catch (FramingException | ChecksumException | BufferUnderflowException | MalformedKeyException e) {
            // Wire-level failure → drop datagram
            return Optional.empty();
        }
    }

    private static String readString(ByteBuffer buf) throws FramingException
    {
        int length = buf.getShort() & 0xFFFF;
        if (length > buf.remaining()) {
            throw new FramingException("String field overruns frame");
        }
        byte[] utf8 = new byte[length];
        buf.get(utf8);
        return new String(utf8, StandardCharsets.UTF_8);
    }
}
