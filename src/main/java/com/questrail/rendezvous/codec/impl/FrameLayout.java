package com.questrail.rendezvous.codec.impl;

/**
 * Constants of the rendezvous datagram layout; see the codec package
 * documentation for the field order.
 */
final class FrameLayout
{
    static final byte MAGIC_0 = 'R';
    static final byte MAGIC_1 = 'V';
    static final int VERSION = 1;

    static final int FLAG_LIVE = 0x01;

    /** magic + version + flags */
    static final int PREAMBLE_LENGTH = 4;

    static final int MAX_STRING_LENGTH = 0xFFFF;
    static final int MAX_ATTRIBUTES = 0xFFFF;

    /** Preamble, key length, attribute count, payload length and checksum. */
    static final int MIN_FRAME_LENGTH = PREAMBLE_LENGTH + 2 + 2 + 4 + FrameChecksum.LENGTH;

    private FrameLayout() {}
}
