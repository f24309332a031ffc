package com.questrail.rendezvous.codec.impl;

import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.internal.frame.EnvelopeFrame;
import com.questrail.rendezvous.key.FrameAndIter;
import com.questrail.rendezvous.key.RendezvousKey;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultEnvelopeFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultEnvelopeFrameDecoder}.
 *
 * <p>Every wire-level defect must result in a dropped datagram, never an
 * exception.</p>
 */
final class DefaultEnvelopeFrameDecoderTest
{
    private static final String KEY =
            "/job:ps/replica:0/task:1/device:CPU:0;7;/job:worker/replica:0/task:0/device:CPU:0;w_grad;0:3";

    private final DefaultEnvelopeFrameDecoder decoder = new DefaultEnvelopeFrameDecoder();
    private final DefaultEnvelopeFrameEncoder encoder = new DefaultEnvelopeFrameEncoder();

    @Test
    void decodesHandBuiltLiveFrame() throws IOException
    {
        byte[] datagram = frame(FrameLayout.FLAG_LIVE, KEY, new String[] { "device", "GPU:0" }, new byte[] { 9, 8, 7 });

        EnvelopeFrame frame = decoder.decode(datagram).orElseThrow();

        assertEquals(KEY, frame.key().fullKey());
        assertEquals(FrameAndIter.of(0, 3), frame.key().frameAndIter());
        assertEquals("GPU:0", frame.senderContext().attribute("device").orElseThrow());
        assertArrayEquals(new byte[] { 9, 8, 7 }, frame.envelope().payload().orElseThrow());
    }

    @Test
    void decodesEncoderOutput()
    {
        EnvelopeFrame original = new EnvelopeFrame(RendezvousKey.parse(KEY),
                TransferContext.of("a", "1").with("b", "2"), Envelope.live(new byte[] { 1, 2 }));

        EnvelopeFrame decoded = decoder.decode(encoder.encode(original)).orElseThrow();

        assertEquals(original.key(), decoded.key());
        assertEquals(original.senderContext(), decoded.senderContext());
        assertArrayEquals(new byte[] { 1, 2 }, decoded.envelope().payload().orElseThrow());
    }

    @Test
    void decodesDeadFrame() throws IOException
    {
        EnvelopeFrame frame = decoder.decode(frame(0, KEY, new String[0], new byte[0])).orElseThrow();

        assertTrue(frame.envelope().isDead());
        assertTrue(frame.senderContext().isEmpty());
    }

    @Test
    void dropsDeadFrameWithPayload() throws IOException
    {
        assertTrue(decoder.decode(frame(0, KEY, new String[0], new byte[] { 1 })).isEmpty());
    }

    @Test
    void dropsCorruptedByte()
    {
        byte[] datagram = encoder.encode(new EnvelopeFrame(RendezvousKey.parse(KEY),
                TransferContext.EMPTY, Envelope.live(new byte[] { 1, 2, 3 })));
        datagram[datagram.length - 6] ^= 0x40;

        assertTrue(decoder.decode(datagram).isEmpty());
    }

    @Test
    void dropsTruncatedDatagram()
    {
        byte[] datagram = encoder.encode(new EnvelopeFrame(RendezvousKey.parse(KEY),
                TransferContext.EMPTY, Envelope.live(new byte[] { 1, 2, 3 })));

        assertTrue(decoder.decode(Arrays.copyOf(datagram, datagram.length - 1)).isEmpty());
        assertTrue(decoder.decode(new byte[3]).isEmpty());
        assertTrue(decoder.decode(null).isEmpty());
    }

    @Test
    void dropsBadMagicAndVersion() throws IOException
    {
        byte[] good = frame(FrameLayout.FLAG_LIVE, KEY, new String[0], new byte[0]);

        byte[] badMagic = Arrays.copyOf(good, good.length);
        badMagic[0] = 'X';
        FrameChecksum.write(badMagic, badMagic.length - FrameChecksum.LENGTH);
        assertTrue(decoder.decode(badMagic).isEmpty());

        byte[] badVersion = Arrays.copyOf(good, good.length);
        badVersion[2] = 2;
        FrameChecksum.write(badVersion, badVersion.length - FrameChecksum.LENGTH);
        assertTrue(decoder.decode(badVersion).isEmpty());
    }

    @Test
    void dropsMalformedKey() throws IOException
    {
        assertTrue(decoder.decode(frame(FrameLayout.FLAG_LIVE, "not-a-key", new String[0], new byte[0])).isEmpty());
    }

    @Test
    void dropsPayloadLengthMismatch() throws IOException
    {
        byte[] datagram = frame(FrameLayout.FLAG_LIVE, KEY, new String[0], new byte[] { 1, 2 });
        // payload length field sits right before the payload bytes
        int lengthOffset = datagram.length - FrameChecksum.LENGTH - 2 - 4;
        datagram[lengthOffset + 3] = 5;
        FrameChecksum.write(datagram, datagram.length - FrameChecksum.LENGTH);

        assertTrue(decoder.decode(datagram).isEmpty());
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static byte[] frame(int flags, String key, String[] attributes, byte[] payload) throws IOException
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeByte('R');
        out.writeByte('V');
        out.writeByte(1);
        out.writeByte(flags);
        writeString(out, key);
        out.writeShort(attributes.length / 2);
        for (String s : attributes) {
            writeString(out, s);
        }
        out.writeInt(payload.length);
        out.write(payload);
        out.flush();

        int len = bytes.size();
        byte[] datagram = Arrays.copyOf(bytes.toByteArray(), len + FrameChecksum.LENGTH);
        FrameChecksum.write(datagram, len);
        return datagram;
    }

    private static void writeString(DataOutputStream out, String s) throws IOException
    {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        out.writeShort(utf8.length);
        out.write(utf8);
    }
}
