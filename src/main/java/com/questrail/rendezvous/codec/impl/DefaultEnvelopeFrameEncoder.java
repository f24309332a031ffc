package com.questrail.rendezvous.codec.impl;

import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.codec.EnvelopeFrameEncoder;
import com.questrail.rendezvous.internal.frame.EnvelopeFrame;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Concrete implementation of {@link EnvelopeFrameEncoder}; the mechanical
 * inverse of {@link DefaultEnvelopeFrameDecoder}.
 */
public final class DefaultEnvelopeFrameEncoder implements EnvelopeFrameEncoder
{
    @Override
    public byte[] encode(EnvelopeFrame frame)
    {
        Objects.requireNonNull(frame, "frame");
        Envelope envelope = frame.envelope();
        Map<String, String> attributes = frame.senderContext().attributes();
        if (attributes.size() > FrameLayout.MAX_ATTRIBUTES) {
            throw new IllegalArgumentException("Too many context attributes: " + attributes.size());
        }

        ByteArrayOutputStream bytes = new ByteArrayOutputStream(64 + envelope.size());
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            // 1) Preamble
            out.writeByte(FrameLayout.MAGIC_0);
            out.writeByte(FrameLayout.MAGIC_1);
            out.writeByte(FrameLayout.VERSION);
            out.writeByte(envelope.isLive() ? FrameLayout.FLAG_LIVE : 0);

            // 2) Key and sender context
            writeString(out, frame.key().fullKey());
            out.writeShort(attributes.size());
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                writeString(out, attribute.getKey());
                writeString(out, attribute.getValue());
            }

            // 3) Payload
            out.writeInt(envelope.size());
            if (envelope.isLive()) {
                out.write(envelope.payload().orElseThrow());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        // 4) Checksum
        int len = bytes.size();
        byte[] datagram = Arrays.copyOf(bytes.toByteArray(), len + FrameChecksum.LENGTH);
        FrameChecksum.write(datagram, len);
        return datagram;
    }

    private static void writeString(DataOutputStream out, String s) throws IOException
    {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        if (utf8.length > FrameLayout.MAX_STRING_LENGTH) {
            throw new IllegalArgumentException("String field of " + utf8.length + " bytes is too long");
        }
        out.writeShort(utf8.length);
        out.write(utf8);
    }
}
