package com.questrail.rendezvous.transport.udp;

import com.questrail.rendezvous.api.Delivery;
import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.api.RecvHandle;
import com.questrail.rendezvous.api.RendezvousAbortedException;
import com.questrail.rendezvous.api.RendezvousException;
import com.questrail.rendezvous.api.StatusCode;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.codec.impl.DefaultEnvelopeFrameDecoder;
import com.questrail.rendezvous.codec.impl.DefaultEnvelopeFrameEncoder;
import com.questrail.rendezvous.config.PeerDirectory;
import com.questrail.rendezvous.core.LocalRendezvous;
import com.questrail.rendezvous.internal.frame.EnvelopeFrame;
import com.questrail.rendezvous.internal.time.SystemWallClock;
import com.questrail.rendezvous.key.FrameAndIter;
import com.questrail.rendezvous.key.RendezvousKey;
import com.questrail.rendezvous.observability.RecordingObservabilitySink;
import com.questrail.rendezvous.observability.RendezvousErrorEvent;
import com.questrail.rendezvous.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DatagramRendezvousTest
 * -----------------------------------------------------------------------------
 * Routing tests for {@link DatagramRendezvous} over a
 * {@link FakeDatagramEndpoint}; no sockets are opened.
 */
class DatagramRendezvousTest {

    private static final String WORKER = "/job:worker/replica:0/task:0/device:CPU:0";
    private static final String PS = "/job:ps/replica:0/task:0/device:CPU:0";
    private static final String UNKNOWN = "/job:ps/replica:0/task:9/device:CPU:0";
    private static final InetSocketAddress PS_ADDRESS = new InetSocketAddress("127.0.0.1", 47001);

    private FakeDatagramEndpoint endpoint;
    private LocalRendezvous local;
    private RecordingObservabilitySink sink;
    private DatagramRendezvous rendezvous;

    private final DefaultEnvelopeFrameEncoder encoder = new DefaultEnvelopeFrameEncoder();
    private final DefaultEnvelopeFrameDecoder decoder = new DefaultEnvelopeFrameDecoder();

    @BeforeEach
    void setUp() {
        endpoint = new FakeDatagramEndpoint();
        sink = new RecordingObservabilitySink();
        local = new LocalRendezvous(Runnable::run, sink, SystemWallClock.INSTANCE);
        PeerDirectory peers = PeerDirectory.builder().addPeer(PS, PS_ADDRESS).build();
        rendezvous = new DatagramRendezvous(local, endpoint, peers, WORKER,
            encoder, decoder, sink, SystemWallClock.INSTANCE);
    }

    private static RendezvousKey key(String src, String dst, String channel) {
        return RendezvousKey.create(src, 1L, dst, channel, FrameAndIter.ROOT);
    }

    @Test
    void localDestinationStaysInProcess() throws Exception {
        RendezvousKey key = key(PS, "/job:worker/replica:0/task:0/device:GPU:0", "loss");

        rendezvous.send(key, TransferContext.EMPTY, Envelope.live(new byte[] { 1 }));

        assertTrue(endpoint.sent().isEmpty());
        Delivery delivery = rendezvous.recvAsync(key, TransferContext.EMPTY).result().get();
        assertArrayEquals(new byte[] { 1 }, delivery.envelope().payload().orElseThrow());
    }

    @Test
    void remoteDestinationIsFramedToPeer() {
        rendezvous.start();
        RendezvousKey key = key(WORKER, PS, "grad");
        TransferContext ctx = TransferContext.of("step", "12");

        rendezvous.send(key, ctx, Envelope.live(new byte[] { 4, 5 }));

        assertEquals(1, endpoint.sent().size());
        FakeDatagramEndpoint.Sent sent = endpoint.sent().get(0);
        assertEquals(PS_ADDRESS, sent.remote());
        EnvelopeFrame frame = decoder.decode(sent.payload()).orElseThrow();
        assertEquals(key, frame.key());
        assertEquals(ctx, frame.senderContext());
        assertArrayEquals(new byte[] { 4, 5 }, frame.envelope().payload().orElseThrow());
        assertEquals(0, local.pendingChannels());
    }

    @Test
    void inboundFrameIsDeposited() throws Exception {
        rendezvous.start();
        RendezvousKey key = key(PS, WORKER, "weights");
        RecvHandle<Delivery> handle = rendezvous.recvAsync(key, TransferContext.EMPTY);

        endpoint.injectDatagram(PS_ADDRESS, encoder.encode(
            new EnvelopeFrame(key, TransferContext.of("origin", "ps"), Envelope.dead())));

        Delivery delivery = handle.result().get();
        assertTrue(delivery.isDead());
        assertEquals("ps", delivery.senderContext().attribute("origin").orElseThrow());
    }

    @Test
    void garbageAndMisaddressedDatagramsAreDropped() {
        rendezvous.start();

        endpoint.injectDatagram(PS_ADDRESS, new byte[] { 1, 2, 3 });
        endpoint.injectDatagram(PS_ADDRESS, encoder.encode(
            new EnvelopeFrame(key(WORKER, PS, "x"), TransferContext.EMPTY, Envelope.dead())));

        assertEquals(0, local.pendingChannels());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void duplicateInboundFrameIsReportedNotThrown() {
        rendezvous.start();
        byte[] datagram = encoder.encode(
            new EnvelopeFrame(key(PS, WORKER, "dup"), TransferContext.EMPTY, Envelope.live(new byte[] { 1 })));

        endpoint.injectDatagram(PS_ADDRESS, datagram);
        endpoint.injectDatagram(PS_ADDRESS, datagram);

        assertTrue(sink.hasEventOfType(RendezvousErrorEvent.class));
        assertEquals(1, local.pendingChannels());
    }

    @Test
    void unknownPeerIsInvalidArgument() {
        rendezvous.start();

        RendezvousException e = assertThrows(RendezvousException.class,
            () -> rendezvous.send(key(WORKER, UNKNOWN, "x"), TransferContext.EMPTY, Envelope.dead()));
        assertEquals(StatusCode.INVALID_ARGUMENT, e.status().code());
    }

    @Test
    void oversizeFrameIsInvalidArgument() {
        rendezvous.start();
        byte[] huge = new byte[70_000];

        RendezvousException e = assertThrows(RendezvousException.class,
            () -> rendezvous.send(key(WORKER, PS, "big"), TransferContext.EMPTY, Envelope.live(huge)));
        assertEquals(StatusCode.INVALID_ARGUMENT, e.status().code());
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void sendBeforeStartIsUnavailable() {
        RendezvousException e = assertThrows(RendezvousException.class,
            () -> rendezvous.send(key(WORKER, PS, "x"), TransferContext.EMPTY, Envelope.dead()));
        assertEquals(StatusCode.UNAVAILABLE, e.status().code());
    }

    @Test
    void transportFailureAbortsPendingReceives() {
        rendezvous.start();
        RecvHandle<Delivery> handle = rendezvous.recvAsync(key(PS, WORKER, "w"), TransferContext.EMPTY);

        endpoint.failTransport(new IOException("socket closed"));

        assertFalse(rendezvous.isTransportUp());
        ExecutionException e = assertThrows(ExecutionException.class, () -> handle.result().get());
        RendezvousAbortedException aborted = assertInstanceOf(RendezvousAbortedException.class, e.getCause());
        assertEquals(StatusCode.UNAVAILABLE, aborted.status().code());
        assertTrue(sink.hasEventOfType(RendezvousErrorEvent.class));

        assertThrows(RendezvousAbortedException.class,
            () -> rendezvous.send(key(WORKER, PS, "late"), TransferContext.EMPTY, Envelope.dead()));
    }
}
