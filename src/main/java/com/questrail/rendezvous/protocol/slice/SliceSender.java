package com.questrail.rendezvous.protocol.slice;

import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.api.Rendezvous;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.internal.time.SystemWallClock;
import com.questrail.rendezvous.internal.time.WallClock;
import com.questrail.rendezvous.key.FrameAndIter;
import com.questrail.rendezvous.key.KeyPrefix;
import com.questrail.rendezvous.key.RendezvousKey;
import com.questrail.rendezvous.model.TransferValue;
import com.questrail.rendezvous.observability.NullObservabilitySink;
import com.questrail.rendezvous.observability.RendezvousObservabilitySink;
import com.questrail.rendezvous.observability.TransferPhaseEvent;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * SliceSender
 * -----------------------------------------------------------------------------
 * Producer half of the sliced transfer protocol.
 *
 * <p>Per execution instance the sender performs, in order:</p>
 * <ol>
 *   <li>{@link SlicePhase#TOTAL_BYTES}: the payload size, or a dead envelope
 *       and nothing else when the input is dead.</li>
 *   <li>If the payload fits in one slice, {@link SlicePhase#DIRECT} with the
 *       whole value, and stop.</li>
 *   <li>{@link SlicePhase#SHAPE}.</li>
 *   <li>Fixed-width values: one {@link SlicePhase#DATA} phase per slice of the
 *       flat buffer.</li>
 *   <li>String values: {@link SlicePhase#ELEMENT_SIZES}, then per element
 *       either one {@code DATA} phase or, when the element is larger than a
 *       slice, one {@link SlicePhase#DATA_SUB} phase per slice of it.</li>
 * </ol>
 *
 * <p>Metadata phases carry an empty {@link TransferContext}. Data phases
 * carry the caller's context.</p>
 *
 * <p>Sends never block. A failed send (for example an aborted rendezvous)
 * propagates and abandons the remaining phases.</p>
 */
public final class SliceSender
{
    private final SliceTransferConfig config;
    private final KeyPrefix keyPrefix;
    private final RendezvousObservabilitySink sink;
    private final WallClock wallClock;

    public SliceSender(SliceTransferConfig config) {
        this(config, NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public SliceSender(SliceTransferConfig config, RendezvousObservabilitySink sink, WallClock wallClock) {
        this.config = Objects.requireNonNull(config, "config");
        this.keyPrefix = config.keyPrefix();
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public SliceTransferConfig config() {
        return config;
    }

    /**
     * Transfer a live value.
     *
     * @throws IllegalArgumentException if the value's type differs from the
     *         configured data type
     */
    public void send(Rendezvous rendezvous, FrameAndIter frameAndIter, TransferValue value, TransferContext context) {
        Objects.requireNonNull(rendezvous, "rendezvous");
        Objects.requireNonNull(frameAndIter, "frameAndIter");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(context, "context");
        if (value.dtype() != config.dataType()) {
            throw new IllegalArgumentException(
                    "Value is " + value.dtype() + " but edge carries " + config.dataType());
        }

        long total = value.totalBytes();
        long sliceSize = config.sliceSize();
        phase(rendezvous, frameAndIter, SlicePhase.TOTAL_BYTES, SlicePhase.TOTAL_BYTES.suffix(),
                TransferContext.EMPTY, ValueCodec.encodeInt64(total));

        if (total <= sliceSize) {
            phase(rendezvous, frameAndIter, SlicePhase.DIRECT, SlicePhase.DIRECT.suffix(),
                    context, ValueCodec.encodeValue(value));
            return;
        }

        phase(rendezvous, frameAndIter, SlicePhase.SHAPE, SlicePhase.SHAPE.suffix(),
                TransferContext.EMPTY, ValueCodec.encodeInt64s(value.shape().dims()));

        if (value.isVariableLength()) {
            sendElements(rendezvous, frameAndIter, value, context);
        } else {
            ByteBuffer data = value.data();
            for (Slicing.Slice slice : Slicing.slices(total, sliceSize)) {
                phase(rendezvous, frameAndIter, SlicePhase.DATA, SlicePhase.dataSuffix(slice.index()),
                        context, Envelope.live(copyRange(data, slice.start(), slice.length())));
            }
        }
    }

    /**
     * Transfer a dead value: only the total-bytes phase is exchanged.
     */
    public void sendDead(Rendezvous rendezvous, FrameAndIter frameAndIter, TransferContext context) {
        Objects.requireNonNull(rendezvous, "rendezvous");
        Objects.requireNonNull(frameAndIter, "frameAndIter");
        Objects.requireNonNull(context, "context");
        phase(rendezvous, frameAndIter, SlicePhase.TOTAL_BYTES, SlicePhase.TOTAL_BYTES.suffix(),
                TransferContext.EMPTY, Envelope.dead());
    }

    private void sendElements(Rendezvous rendezvous, FrameAndIter frameAndIter,
                              TransferValue value, TransferContext context) {
        int n = Math.toIntExact(value.numElements());
        long[] sizes = new long[n];
        for (int i = 0; i < n; i++) {
            sizes[i] = value.elementSize(i);
        }
        phase(rendezvous, frameAndIter, SlicePhase.ELEMENT_SIZES, SlicePhase.ELEMENT_SIZES.suffix(),
                TransferContext.EMPTY, ValueCodec.encodeInt64s(sizes));

        long sliceSize = config.sliceSize();
        for (int i = 0; i < n; i++) {
            if (sizes[i] <= sliceSize) {
                phase(rendezvous, frameAndIter, SlicePhase.DATA, SlicePhase.dataSuffix(i),
                        context, Envelope.live(value.element(i)));
                continue;
            }
            ByteBuffer element = value.elementBuffer(i);
            for (Slicing.Slice slice : Slicing.slices(sizes[i], sliceSize)) {
                phase(rendezvous, frameAndIter, SlicePhase.DATA_SUB, SlicePhase.dataSuffix(i, slice.index()),
                        context, Envelope.live(copyRange(element, slice.start(), slice.length())));
            }
        }
    }

    private void phase(Rendezvous rendezvous, FrameAndIter frameAndIter, SlicePhase phase, String suffix,
                       TransferContext context, Envelope envelope) {
        RendezvousKey key = keyPrefix.key(suffix, frameAndIter);
        sink.onPhase(new TransferPhaseEvent(wallClock.now(), TransferPhaseEvent.Direction.SEND,
                phase, key, envelope.size(), envelope.isLive()));
        rendezvous.send(key, context, envelope);
    }

    private static byte[] copyRange(ByteBuffer source, long start, long length) {
        byte[] out = new byte[Math.toIntExact(length)];
        source.get(Math.toIntExact(start), out);
        return out;
    }
}
