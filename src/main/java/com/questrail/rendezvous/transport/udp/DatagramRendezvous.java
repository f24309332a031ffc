package com.questrail.rendezvous.transport.udp;

import com.questrail.rendezvous.api.Delivery;
import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.api.RecvHandle;
import com.questrail.rendezvous.api.Rendezvous;
import com.questrail.rendezvous.api.RendezvousAbortedException;
import com.questrail.rendezvous.api.RendezvousException;
import com.questrail.rendezvous.api.Status;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.codec.EnvelopeFrameDecoder;
import com.questrail.rendezvous.codec.EnvelopeFrameEncoder;
import com.questrail.rendezvous.config.PeerDirectory;
import com.questrail.rendezvous.core.LocalRendezvous;
import com.questrail.rendezvous.internal.frame.EnvelopeFrame;
import com.questrail.rendezvous.internal.time.WallClock;
import com.questrail.rendezvous.key.EndpointName;
import com.questrail.rendezvous.key.RendezvousKey;
import com.questrail.rendezvous.observability.RendezvousErrorEvent;
import com.questrail.rendezvous.observability.RendezvousObservabilitySink;
import com.questrail.rendezvous.transport.DatagramEndpoint;
import com.questrail.rendezvous.transport.DatagramEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * DatagramRendezvous
 * =============================================================================
 * A {@link Rendezvous} that spans processes over a datagram transport.
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   send(key) ── destination task is local ──→ LocalRendezvous.send
 *             └─ otherwise ─→ EnvelopeFrameEncoder
 *                                 → PeerDirectory.resolve(destination)
 *                                     → DatagramEndpoint.send
 * </pre>
 *
 * <h2>Inbound path (decode-before-deposit)</h2>
 * <pre>
 *   DatagramEndpoint
 *        → EnvelopeFrameDecoder        (defective datagrams dropped)
 *            → LocalRendezvous.send    (frames for other tasks dropped)
 * </pre>
 *
 * <p>Receives are always served by the local table: a consumer's key names
 * its own task as destination.</p>
 *
 * <h2>Failure model</h2>
 * Delivery is best effort; a lost datagram surfaces as a receive timeout on
 * the consumer. Losing the transport aborts the local table with
 * {@link com.questrail.rendezvous.api.StatusCode#UNAVAILABLE}. A frame that
 * does not fit in one datagram is rejected with
 * {@link com.questrail.rendezvous.api.StatusCode#INVALID_ARGUMENT}; large
 * values should go through the slice protocol with a smaller slice size.
 */
public final class DatagramRendezvous implements Rendezvous
{
    private static final Logger log = LoggerFactory.getLogger(DatagramRendezvous.class);

    private final LocalRendezvous local;
    private final DatagramEndpoint endpoint;
    private final PeerDirectory peers;
    private final String localTask;
    private final EnvelopeFrameEncoder frameEncoder;
    private final EnvelopeFrameDecoder frameDecoder;
    private final RendezvousObservabilitySink sink;
    private final WallClock wallClock;

    private volatile boolean transportUp;

    /**
     * @param localTask any endpoint name of this process; only its task
     *        address is used
     */
    public DatagramRendezvous(LocalRendezvous local,
                              DatagramEndpoint endpoint,
                              PeerDirectory peers,
                              String localTask,
                              EnvelopeFrameEncoder frameEncoder,
                              EnvelopeFrameDecoder frameDecoder,
                              RendezvousObservabilitySink sink,
                              WallClock wallClock) {
        this.local = Objects.requireNonNull(local, "local");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.peers = Objects.requireNonNull(peers, "peers");
        this.localTask = EndpointName.of(Objects.requireNonNull(localTask, "localTask")).taskAddress();
        this.frameEncoder = Objects.requireNonNull(frameEncoder, "frameEncoder");
        this.frameDecoder = Objects.requireNonNull(frameDecoder, "frameDecoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.endpoint.setListener(new Listener());
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isTransportUp() {
        return transportUp;
    }

    public LocalRendezvous local() {
        return local;
    }

    /**
     * @throws RendezvousException with {@code INVALID_ARGUMENT} if the
     *         destination task has no known peer or the frame exceeds one
     *         datagram; with {@code UNAVAILABLE} if the transport is down
     * @throws RendezvousAbortedException if this rendezvous was aborted
     */
    @Override
    public void send(RendezvousKey key, TransferContext context, Envelope envelope) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(envelope, "envelope");

        if (isLocal(key.destination())) {
            local.send(key, context, envelope);
            return;
        }

        Optional<Status> aborted = local.abortStatus();
        if (aborted.isPresent()) {
            throw new RendezvousAbortedException(aborted.get());
        }

        String task = key.destination().taskAddress();
        SocketAddress remote = peers.lookup(task).orElseThrow(() -> new RendezvousException(
                Status.invalidArgument("No peer for task '" + task + "' of key " + key)));

        byte[] datagram = frameEncoder.encode(new EnvelopeFrame(key, context, envelope));
        if (datagram.length > EnvelopeFrameEncoder.MAX_DATAGRAM_BYTES) {
            throw new RendezvousException(Status.invalidArgument(
                    "Frame of " + datagram.length + " bytes exceeds the datagram limit of "
                            + EnvelopeFrameEncoder.MAX_DATAGRAM_BYTES + " for key " + key));
        }
        if (!transportUp) {
            throw new RendezvousException(Status.unavailable("Datagram transport is down"));
        }
        try {
            endpoint.send(remote, datagram);
        } catch (IllegalStateException e) {
            throw new RendezvousException(Status.unavailable("Datagram transport is down"), e);
        }
    }

    @Override
    public RecvHandle<Delivery> recvAsync(RendezvousKey key, TransferContext context) {
        return local.recvAsync(key, context);
    }

    @Override
    public void abort(Status status) {
        local.abort(status);
    }

    @Override
    public Optional<Status> abortStatus() {
        return local.abortStatus();
    }

    private boolean isLocal(EndpointName destination) {
        return destination.taskAddress().equals(localTask);
    }

    // -------------------------------------------------------------------------
    // Transport Listener
    // -------------------------------------------------------------------------

    private final class Listener implements DatagramEndpointListener {
        @Override
        public void onTransportUp() {
            transportUp = true;
            log.info("Datagram rendezvous for {} is up on {}", localTask,
                    endpoint.localAddress().map(Object::toString).orElse("?"));
        }

        @Override
        public void onTransportDown(Throwable cause) {
            transportUp = false;
            if (cause != null) {
                sink.onError(new RendezvousErrorEvent(wallClock.now(), "Datagram transport failed", cause));
            }
            local.abort(Status.unavailable(cause == null
                    ? "Datagram transport stopped"
                    : "Datagram transport failed: " + cause.getMessage()));
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            Optional<EnvelopeFrame> frameOpt = frameDecoder.decode(payload);
            if (frameOpt.isEmpty()) {
                log.debug("Dropped undecodable datagram of {} bytes from {}", payload.length, remote);
                return;
            }

            EnvelopeFrame frame = frameOpt.get();
            if (!isLocal(frame.key().destination())) {
                log.debug("Dropped frame from {} addressed to another task: {}", remote, frame);
                return;
            }

            try {
                local.send(frame.key(), frame.senderContext(), frame.envelope());
            } catch (RendezvousException | IllegalStateException e) {
                // No caller to report to: the producer lives in another process.
                sink.onError(new RendezvousErrorEvent(wallClock.now(),
                        "Inbound frame from " + remote + " not deposited: " + frame, e));
            }
        }
    }
}
