package com.questrail.rendezvous.codec.impl;

import java.util.zip.CRC32;

/**
 * FrameChecksum
 * -----------------------------------------------------------------------------
 * Trailing CRC-32 (IEEE 802.3, as {@link CRC32}) over every byte of the frame
 * before the checksum, appended big-endian.
 */
final class FrameChecksum
{
    static final int LENGTH = 4;

    private FrameChecksum() {}

    static long compute(byte[] data, int off, int len) {
        CRC32 crc = new CRC32();
        crc.update(data, off, len);
        return crc.getValue();
    }

    /**
     * Writes the checksum of {@code frame[0, len)} into {@code frame[len, len + 4)}.
     */
    static void write(byte[] frame, int len) {
        long crc = compute(frame, 0, len);
        frame[len] = (byte) (crc >>> 24);
        frame[len + 1] = (byte) (crc >>> 16);
        frame[len + 2] = (byte) (crc >>> 8);
        frame[len + 3] = (byte) crc;
    }

    /**
     * @throws ChecksumException if the trailing checksum does not match
     */
    static void validate(byte[] frame) throws ChecksumException {
        if (frame.length < LENGTH) {
            throw new ChecksumException("Frame too short for checksum");
        }
        int len = frame.length - LENGTH;
        long transmitted = ((frame[len] & 0xFFL) << 24)
                | ((frame[len + 1] & 0xFFL) << 16)
                | ((frame[len + 2] & 0xFFL) << 8)
                | (frame[len + 3] & 0xFFL);
        long computed = compute(frame, 0, len);
        if (transmitted != computed) {
            throw new ChecksumException(String.format(
                    "CRC mismatch: transmitted=0x%08X computed=0x%08X", transmitted, computed));
        }
    }
}
