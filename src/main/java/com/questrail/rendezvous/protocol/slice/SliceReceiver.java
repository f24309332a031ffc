package com.questrail.rendezvous.protocol.slice;

import com.questrail.rendezvous.api.Delivery;
import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.api.Rendezvous;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.cancel.BlockingRecv;
import com.questrail.rendezvous.cancel.CancellationToken;
import com.questrail.rendezvous.internal.time.SystemWallClock;
import com.questrail.rendezvous.internal.time.WallClock;
import com.questrail.rendezvous.key.FrameAndIter;
import com.questrail.rendezvous.key.KeyPrefix;
import com.questrail.rendezvous.key.RendezvousKey;
import com.questrail.rendezvous.model.DataType;
import com.questrail.rendezvous.model.Shape;
import com.questrail.rendezvous.model.TransferValue;
import com.questrail.rendezvous.observability.NullObservabilitySink;
import com.questrail.rendezvous.observability.RendezvousObservabilitySink;
import com.questrail.rendezvous.observability.TransferPhaseEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SliceReceiver
 * -----------------------------------------------------------------------------
 * Consumer half of the sliced transfer protocol; mirrors {@link SliceSender}
 * phase for phase.
 *
 * <p>Each phase is received through {@link BlockingRecv} with the configured
 * timeout and the caller's cancellation token. The first failing phase
 * abandons the whole transfer: its exception propagates unchanged.</p>
 *
 * <p>Only the total-bytes phase may be dead; the receiver then returns
 * {@link Optional#empty()}. A dead envelope in any later phase, or a payload
 * whose size disagrees with the announced sizes, raises
 * {@link ProtocolViolationException}.</p>
 */
public final class SliceReceiver
{
    private final SliceTransferConfig config;
    private final KeyPrefix keyPrefix;
    private final BlockingRecv blockingRecv;
    private final RendezvousObservabilitySink sink;
    private final WallClock wallClock;

    public SliceReceiver(SliceTransferConfig config, BlockingRecv blockingRecv) {
        this(config, blockingRecv, NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public SliceReceiver(SliceTransferConfig config,
                         BlockingRecv blockingRecv,
                         RendezvousObservabilitySink sink,
                         WallClock wallClock) {
        this.config = Objects.requireNonNull(config, "config");
        this.keyPrefix = config.keyPrefix();
        this.blockingRecv = Objects.requireNonNull(blockingRecv, "blockingRecv");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public SliceTransferConfig config() {
        return config;
    }

    /**
     * Receive one value.
     *
     * @return the value, or empty if the producer sent a dead value
     * @throws ProtocolViolationException if the producer broke the protocol
     * @throws com.questrail.rendezvous.api.RendezvousException if a phase
     *         failed, timed out or was cancelled
     */
    public Optional<TransferValue> receive(Rendezvous rendezvous,
                                           FrameAndIter frameAndIter,
                                           TransferContext context,
                                           CancellationToken token) {
        Objects.requireNonNull(rendezvous, "rendezvous");
        Objects.requireNonNull(frameAndIter, "frameAndIter");
        Objects.requireNonNull(context, "context");
        CancellationToken cancellation = (token == null) ? CancellationToken.none() : token;
        Exchange exchange = new Exchange(rendezvous, frameAndIter, context, cancellation);

        Envelope totalEnvelope = exchange.recv(SlicePhase.TOTAL_BYTES, SlicePhase.TOTAL_BYTES.suffix());
        if (totalEnvelope.isDead()) {
            return Optional.empty();
        }
        long total = ValueCodec.decodeInt64(totalEnvelope);
        if (total < 0) {
            throw new ProtocolViolationException("Negative total bytes " + total);
        }

        if (total <= config.sliceSize()) {
            TransferValue value = ValueCodec.decodeValue(
                    exchange.recvLive(SlicePhase.DIRECT, SlicePhase.DIRECT.suffix()));
            requireType(value.dtype());
            if (value.totalBytes() != total) {
                throw new ProtocolViolationException(
                        "Direct value has " + value.totalBytes() + " bytes, announced " + total);
            }
            return Optional.of(value);
        }

        Shape shape;
        try {
            shape = Shape.of(ValueCodec.decodeInt64s(exchange.recvLive(SlicePhase.SHAPE, SlicePhase.SHAPE.suffix())));
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new ProtocolViolationException("Invalid shape: " + e.getMessage(), e);
        }

        DataType dtype = config.dataType();
        if (dtype.isVariableLength()) {
            return Optional.of(receiveElements(exchange, shape, total));
        }

        long expected = Math.multiplyExact(shape.numElements(), (long) dtype.byteWidth());
        if (expected != total) {
            throw new ProtocolViolationException(
                    "Shape " + shape + " of " + dtype + " needs " + expected + " bytes, announced " + total);
        }
        byte[] data = new byte[Math.toIntExact(total)];
        for (Slicing.Slice slice : Slicing.slices(total, config.sliceSize())) {
            byte[] bytes = exchange.recvExact(SlicePhase.DATA, SlicePhase.dataSuffix(slice.index()), slice.length());
            System.arraycopy(bytes, 0, data, (int) slice.start(), bytes.length);
        }
        return Optional.of(TransferValue.of(dtype, shape, data));
    }

    private TransferValue receiveElements(Exchange exchange, Shape shape, long total) {
        long[] sizes = ValueCodec.decodeInt64s(
                exchange.recvLive(SlicePhase.ELEMENT_SIZES, SlicePhase.ELEMENT_SIZES.suffix()));
        if (sizes.length != shape.numElements()) {
            throw new ProtocolViolationException(
                    "Shape " + shape + " has " + shape.numElements() + " elements, got " + sizes.length + " sizes");
        }
        long sum = 0;
        for (long size : sizes) {
            if (size < 0) {
                throw new ProtocolViolationException("Negative element size " + size);
            }
            sum += size;
        }
        if (sum != total) {
            throw new ProtocolViolationException("Element sizes sum to " + sum + ", announced " + total);
        }

        long sliceSize = config.sliceSize();
        List<byte[]> elements = new ArrayList<>(sizes.length);
        for (int i = 0; i < sizes.length; i++) {
            if (sizes[i] <= sliceSize) {
                elements.add(exchange.recvExact(SlicePhase.DATA, SlicePhase.dataSuffix(i), sizes[i]));
                continue;
            }
            byte[] element = new byte[Math.toIntExact(sizes[i])];
            for (Slicing.Slice slice : Slicing.slices(sizes[i], sliceSize)) {
                byte[] bytes = exchange.recvExact(
                        SlicePhase.DATA_SUB, SlicePhase.dataSuffix(i, slice.index()), slice.length());
                System.arraycopy(bytes, 0, element, (int) slice.start(), bytes.length);
            }
            elements.add(element);
        }
        return TransferValue.ofElements(shape, elements);
    }

    private void requireType(DataType actual) {
        if (actual != config.dataType()) {
            throw new ProtocolViolationException("Received " + actual + ", edge carries " + config.dataType());
        }
    }

    /**
     * Per-call receive state.
     */
    private final class Exchange
    {
        private final Rendezvous rendezvous;
        private final FrameAndIter frameAndIter;
        private final TransferContext context;
        private final CancellationToken token;

        Exchange(Rendezvous rendezvous, FrameAndIter frameAndIter, TransferContext context, CancellationToken token) {
            this.rendezvous = rendezvous;
            this.frameAndIter = frameAndIter;
            this.context = context;
            this.token = token;
        }

        Envelope recv(SlicePhase phase, String suffix) {
            RendezvousKey key = keyPrefix.key(suffix, frameAndIter);
            Delivery delivery = blockingRecv.recv(rendezvous, key, context, config.recvTimeout(), token);
            Envelope envelope = delivery.envelope();
            sink.onPhase(new TransferPhaseEvent(wallClock.now(), TransferPhaseEvent.Direction.RECV,
                    phase, key, envelope.size(), envelope.isLive()));
            return envelope;
        }

        Envelope recvLive(SlicePhase phase, String suffix) {
            Envelope envelope = recv(phase, suffix);
            if (envelope.isDead()) {
                throw new ProtocolViolationException("Phase " + suffix + " arrived dead after a live total");
            }
            return envelope;
        }

        byte[] recvExact(SlicePhase phase, String suffix, long length) {
            Envelope envelope = recvLive(phase, suffix);
            if (envelope.size() != length) {
                throw new ProtocolViolationException(
                        "Phase " + suffix + " carried " + envelope.size() + " bytes, expected " + length);
            }
            return envelope.payload().orElseThrow();
        }
    }
}
