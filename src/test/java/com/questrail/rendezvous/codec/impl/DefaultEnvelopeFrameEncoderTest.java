package com.questrail.rendezvous.codec.impl;

import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.internal.frame.EnvelopeFrame;
import com.questrail.rendezvous.key.RendezvousKey;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DefaultEnvelopeFrameEncoder}.
 */
final class DefaultEnvelopeFrameEncoderTest
{
    private static final RendezvousKey KEY = RendezvousKey.parse(
            "/job:a/replica:0/task:0/device:CPU:0;1;/job:b/replica:0/task:0/device:CPU:0;x;0:0");

    private final DefaultEnvelopeFrameEncoder encoder = new DefaultEnvelopeFrameEncoder();

    @Test
    void writesPreambleKeyAndChecksum()
    {
        byte[] datagram = encoder.encode(new EnvelopeFrame(KEY, TransferContext.EMPTY, Envelope.live(new byte[] { 42 })));

        ByteBuffer buf = ByteBuffer.wrap(datagram);
        assertEquals('R', buf.get());
        assertEquals('V', buf.get());
        assertEquals(1, buf.get());
        assertEquals(FrameLayout.FLAG_LIVE, buf.get());

        byte[] key = new byte[buf.getShort() & 0xFFFF];
        buf.get(key);
        assertEquals(KEY.fullKey(), new String(key, StandardCharsets.UTF_8));
        assertEquals(0, buf.getShort());
        assertEquals(1, buf.getInt());
        assertEquals(42, buf.get());
        assertEquals(FrameChecksum.LENGTH, buf.remaining());

        assertDoesNotThrow(() -> FrameChecksum.validate(datagram));
    }

    @Test
    void deadEnvelopeClearsLiveFlag()
    {
        byte[] datagram = encoder.encode(new EnvelopeFrame(KEY, TransferContext.EMPTY, Envelope.dead()));

        assertEquals(0, datagram[3]);
        // zero payload length immediately before the checksum
        assertEquals(0, ByteBuffer.wrap(datagram, datagram.length - FrameChecksum.LENGTH - 4, 4).getInt());
    }

    @Test
    void rejectsOverlongAttribute()
    {
        String huge = "v".repeat(FrameLayout.MAX_STRING_LENGTH + 1);
        EnvelopeFrame frame = new EnvelopeFrame(KEY, TransferContext.of("k", huge), Envelope.dead());

        assertThrows(IllegalArgumentException.class, () -> encoder.encode(frame));
    }
}
