package com.questrail.rendezvous.key;

import com.questrail.rendezvous.api.StatusCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RendezvousKeyTest {

    private static final String SRC = "/job:worker/replica:0/task:0/device:CPU:0";
    private static final String DST = "/job:worker/replica:0/task:1/device:CPU:0";

    @Test
    void createProducesExactWireForm() {
        RendezvousKey key = RendezvousKey.create(SRC, 42L, DST, "edge_7", FrameAndIter.of(3, 11));

        assertEquals(SRC + ";42;" + DST + ";edge_7;3:11", key.fullKey());
    }

    @Test
    void parseExposesStructuredFields() {
        RendezvousKey key = RendezvousKey.parse(SRC + ";42;" + DST + ";edge_7;3:11");

        assertEquals(EndpointName.of(SRC), key.source());
        assertEquals(42L, key.sourceIncarnation());
        assertEquals(EndpointName.of(DST), key.destination());
        assertEquals("edge_7", key.channelName());
        assertEquals(FrameAndIter.of(3, 11), key.frameAndIter());
    }

    @Test
    void incarnationIsRenderedUnsigned() {
        RendezvousKey key = RendezvousKey.create(SRC, -1L, DST, "x", FrameAndIter.ROOT);

        assertEquals(SRC + ";18446744073709551615;" + DST + ";x;0:0", key.fullKey());
        assertEquals(-1L, RendezvousKey.parse(key.fullKey()).sourceIncarnation());
    }

    @Test
    void equalityIsByFullKeyOnly() {
        RendezvousKey a = RendezvousKey.create(SRC, 1L, DST, "x", FrameAndIter.of(0, 1));
        RendezvousKey b = RendezvousKey.parse(a.fullKey());
        RendezvousKey c = RendezvousKey.create(SRC, 1L, DST, "x", FrameAndIter.of(0, 2));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void formattingRejectsSemicolonInChannel() {
        MalformedKeyException e = assertThrows(MalformedKeyException.class,
            () -> RendezvousKey.create(SRC, 1L, DST, "a;b", FrameAndIter.ROOT));
        assertEquals(StatusCode.INVALID_ARGUMENT, e.code());
    }

    @Test
    void formattingRejectsMalformedEndpoint() {
        assertThrows(MalformedKeyException.class,
            () -> RendezvousKey.create("worker0", 1L, DST, "x", FrameAndIter.ROOT));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "/job:a;1;/job:b;x",
        "/job:a;1;/job:b;x;0:0;extra",
        "/job:a;one;/job:b;x;0:0",
        "/job:a;-1;/job:b;x;0:0",
        "/job:a;1;/job:b;;0:0",
        "/job:a;1;/job:b;x;0",
        "/job:a;1;/job:b;x;0:0:0",
        "/job:a;1;/job:b;x;:0",
        "/job:a;1;/job:b;x;0:18446744073709551616",
        "bad;1;/job:b;x;0:0",
        "/job:a;1;bad;x;0:0"
    })
    void parseRejectsMalformedKeys(String text) {
        assertThrows(MalformedKeyException.class, () -> RendezvousKey.parse(text));
    }
}
