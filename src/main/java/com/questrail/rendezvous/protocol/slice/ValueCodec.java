package com.questrail.rendezvous.protocol.slice;

import com.questrail.rendezvous.api.Envelope;
import com.questrail.rendezvous.model.DataType;
import com.questrail.rendezvous.model.Shape;
import com.questrail.rendezvous.model.TransferValue;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * ValueCodec
 * -----------------------------------------------------------------------------
 * Payload encodings of the sliced transfer protocol.
 *
 * <h2>Metadata envelopes</h2>
 * Total-bytes, shape and element-size phases carry int64 scalars or vectors,
 * big-endian, eight bytes per value.
 *
 * <h2>Whole-value encoding (direct transfer)</h2>
 * <pre>
 *   u8     dtype code
 *   u8     rank
 *   i64[]  dims                       (rank entries)
 *   fixed width:  data bytes          (numElements * byteWidth)
 *   string:       i64[] sizes, then the element bytes back to back
 * </pre>
 *
 * <p>Decoding failures raise {@link ProtocolViolationException}: a metadata
 * envelope the peer produced with the wrong size is a protocol defect, not a
 * transport one.</p>
 */
public final class ValueCodec
{
    private static final int MAX_RANK = 255;

    private ValueCodec() {}

    public static Envelope encodeInt64(long value) {
        return Envelope.live(ByteBuffer.allocate(Long.BYTES).putLong(value).array());
    }

    public static Envelope encodeInt64s(long[] values) {
        ByteBuffer buf = ByteBuffer.allocate(Math.multiplyExact(values.length, Long.BYTES));
        for (long v : values) {
            buf.putLong(v);
        }
        return Envelope.live(buf.array());
    }

    public static long decodeInt64(Envelope envelope) {
        ByteBuffer buf = requireLive(envelope);
        if (buf.remaining() != Long.BYTES) {
            throw new ProtocolViolationException(
                    "Expected an 8-byte int64 scalar, got " + buf.remaining() + " bytes");
        }
        return buf.getLong();
    }

    public static long[] decodeInt64s(Envelope envelope) {
        ByteBuffer buf = requireLive(envelope);
        if (buf.remaining() % Long.BYTES != 0) {
            throw new ProtocolViolationException(
                    "int64 vector payload of " + buf.remaining() + " bytes is not a multiple of 8");
        }
        long[] out = new long[buf.remaining() / Long.BYTES];
        buf.asLongBuffer().get(out);
        return out;
    }

    public static Envelope encodeValue(TransferValue value) {
        Shape shape = value.shape();
        if (shape.rank() > MAX_RANK) {
            throw new IllegalArgumentException("Rank " + shape.rank() + " exceeds " + MAX_RANK);
        }
        int n = Math.toIntExact(value.numElements());
        int header = 2 + shape.rank() * Long.BYTES;
        int body = value.isVariableLength()
                ? Math.addExact(Math.multiplyExact(n, Long.BYTES), Math.toIntExact(value.totalBytes()))
                : Math.toIntExact(value.totalBytes());

        ByteBuffer buf = ByteBuffer.allocate(Math.addExact(header, body));
        buf.put((byte) value.dtype().code());
        buf.put((byte) shape.rank());
        for (long d : shape.dims()) {
            buf.putLong(d);
        }
        if (value.isVariableLength()) {
            for (int i = 0; i < n; i++) {
                buf.putLong(value.elementSize(i));
            }
            for (int i = 0; i < n; i++) {
                buf.put(value.elementBuffer(i));
            }
        } else {
            buf.put(value.data());
        }
        return Envelope.live(buf.array());
    }

    public static TransferValue decodeValue(Envelope envelope) {
        ByteBuffer buf = requireLive(envelope);
        try {
            int code = buf.get() & 0xFF;
            DataType dtype = DataType.fromCode(code)
                    .orElseThrow(() -> new ProtocolViolationException("Unknown dtype code " + code));
            int rank = buf.get() & 0xFF;
            long[] dims = new long[rank];
            for (int i = 0; i < rank; i++) {
                dims[i] = buf.getLong();
            }
            Shape shape = Shape.of(dims);

            if (!dtype.isVariableLength()) {
                byte[] data = new byte[buf.remaining()];
                buf.get(data);
                return TransferValue.of(dtype, shape, data);
            }

            int n = Math.toIntExact(shape.numElements());
            long[] sizes = new long[n];
            for (int i = 0; i < n; i++) {
                sizes[i] = buf.getLong();
            }
            List<byte[]> elements = new ArrayList<>(n);
            for (long size : sizes) {
                if (size < 0 || size > buf.remaining()) {
                    throw new ProtocolViolationException("Element size " + size + " exceeds remaining payload");
                }
                byte[] e = new byte[(int) size];
                buf.get(e);
                elements.add(e);
            }
            if (buf.hasRemaining()) {
                throw new ProtocolViolationException(buf.remaining() + " trailing bytes after string elements");
            }
            return TransferValue.ofElements(shape, elements);
        } catch (BufferUnderflowException | IllegalArgumentException | ArithmeticException e) {
            throw new ProtocolViolationException("Malformed direct-transfer value: " + e.getMessage(), e);
        }
    }

    private static ByteBuffer requireLive(Envelope envelope) {
        if (envelope.isDead()) {
            throw new ProtocolViolationException("Metadata envelope is dead");
        }
        return envelope.payloadBuffer();
    }
}
