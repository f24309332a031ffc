package com.questrail.rendezvous.key;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyPrefixTest {

    private final KeyPrefix prefix = KeyPrefix.of("/job:w/task:0", 7L, "/job:w/task:1", "grad");

    @Test
    void appendsSuffixToChannelName() {
        RendezvousKey key = prefix.key("_slice_transfer_totalbytes", FrameAndIter.of(0, 5));

        assertEquals("/job:w/task:0;7;/job:w/task:1;grad_slice_transfer_totalbytes;0:5", key.fullKey());
        assertEquals("grad_slice_transfer_totalbytes", key.channelName());
    }

    @Test
    void serializedFormIsLeadingPartOfEveryKey() {
        assertEquals("/job:w/task:0;7;/job:w/task:1;grad", prefix.serialized());
        assertTrue(prefix.key("_transfer_data", FrameAndIter.ROOT).fullKey().startsWith(prefix.serialized()));
    }

    @Test
    void senderAndReceiverPrefixesAgree() {
        KeyPrefix other = KeyPrefix.of("/job:w/task:0", 7L, "/job:w/task:1", "grad");

        assertEquals(prefix, other);
        assertEquals(prefix.key("_transfer_data", FrameAndIter.ROOT),
            other.key("_transfer_data", FrameAndIter.ROOT));
    }

    @Test
    void distinctFramesYieldDistinctKeys() {
        assertNotEquals(prefix.key("", FrameAndIter.of(1, 0)), prefix.key("", FrameAndIter.of(0, 1)));
    }

    @Test
    void rejectsSuffixWithSeparator() {
        assertThrows(MalformedKeyException.class, () -> prefix.key("_a;b", FrameAndIter.ROOT));
    }

    @Test
    void rejectsEmptyChannel() {
        assertThrows(MalformedKeyException.class, () -> KeyPrefix.of("/job:w", 0L, "/job:w", ""));
    }
}
