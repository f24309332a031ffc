package com.questrail.rendezvous.model;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * TransferValue
 * =============================================================================
 * Immutable payload moved by the slice transfer protocol.
 *
 * <p>Only the structure the protocol needs is modelled: a {@link DataType},
 * a {@link Shape}, and either</p>
 * <ul>
 *   <li>one flat byte buffer of {@code numElements * byteWidth} bytes for
 *       fixed-width types, or</li>
 *   <li>one byte string per element for {@link DataType#STRING}.</li>
 * </ul>
 *
 * <p>Numeric convenience factories lay elements out little-endian. The
 * protocol itself never looks inside the bytes.</p>
 *
 * <p>Byte arrays are copied in and out.</p>
 */
public final class TransferValue
{
    private final DataType dtype;
    private final Shape shape;
    private final byte[] data;
    private final byte[][] elements;
    private final long totalBytes;

    private TransferValue(DataType dtype, Shape shape, byte[] data, byte[][] elements) {
        this.dtype = dtype;
        this.shape = shape;
        this.data = data;
        this.elements = elements;
        if (elements == null) {
            this.totalBytes = data.length;
        } else {
            long total = 0;
            for (byte[] e : elements) {
                total += e.length;
            }
            this.totalBytes = total;
        }
    }

    /**
     * A fixed-width value backed by a copy of {@code data}.
     *
     * @throws IllegalArgumentException if {@code dtype} is variable-length or
     *         {@code data} does not hold exactly {@code shape.numElements()}
     *         elements
     */
    public static TransferValue of(DataType dtype, Shape shape, byte[] data) {
        Objects.requireNonNull(dtype, "dtype");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(data, "data");
        if (dtype.isVariableLength()) {
            throw new IllegalArgumentException(dtype + " values must be built from elements");
        }
        long expected = Math.multiplyExact(shape.numElements(), (long) dtype.byteWidth());
        if (data.length != expected) {
            throw new IllegalArgumentException(
                    "Shape " + shape + " of " + dtype + " needs " + expected + " bytes, got " + data.length);
        }
        return new TransferValue(dtype, shape, data.clone(), null);
    }

    /**
     * A {@link DataType#STRING} value with one byte string per element.
     */
    public static TransferValue ofElements(Shape shape, List<byte[]> elements) {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(elements, "elements");
        if (elements.size() != shape.numElements()) {
            throw new IllegalArgumentException(
                    "Shape " + shape + " needs " + shape.numElements() + " elements, got " + elements.size());
        }
        byte[][] copy = new byte[elements.size()][];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = Objects.requireNonNull(elements.get(i), "element").clone();
        }
        return new TransferValue(DataType.STRING, shape, null, copy);
    }

    /**
     * A {@link DataType#STRING} value of UTF-8 encoded strings.
     */
    public static TransferValue ofStrings(Shape shape, List<String> strings) {
        Objects.requireNonNull(strings, "strings");
        List<byte[]> encoded = new ArrayList<>(strings.size());
        for (String s : strings) {
            encoded.add(Objects.requireNonNull(s, "string").getBytes(StandardCharsets.UTF_8));
        }
        return ofElements(shape, encoded);
    }

    public static TransferValue ofStrings(String... strings) {
        return ofStrings(Shape.vector(strings.length), Arrays.asList(strings));
    }

    public static TransferValue ofInt64s(Shape shape, long... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (long v : values) {
            buf.putLong(v);
        }
        return of(DataType.INT64, shape, buf.array());
    }

    public static TransferValue ofInt32s(Shape shape, int... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int v : values) {
            buf.putInt(v);
        }
        return of(DataType.INT32, shape, buf.array());
    }

    public static TransferValue ofFloat64s(Shape shape, double... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (double v : values) {
            buf.putDouble(v);
        }
        return of(DataType.FLOAT64, shape, buf.array());
    }

    public DataType dtype() {
        return dtype;
    }

    public Shape shape() {
        return shape;
    }

    public long numElements() {
        return shape.numElements();
    }

    /**
     * Payload size: the buffer length for fixed-width values, the sum of the
     * element lengths for strings.
     */
    public long totalBytes() {
        return totalBytes;
    }

    public boolean isVariableLength() {
        return elements != null;
    }

    /**
     * Read-only view of the flat buffer of a fixed-width value.
     */
    public ByteBuffer data() {
        requireFixedWidth();
        return ByteBuffer.wrap(data).asReadOnlyBuffer();
    }

    public byte[] toByteArray() {
        requireFixedWidth();
        return data.clone();
    }

    public int elementSize(int index) {
        requireVariableLength();
        return elements[index].length;
    }

    public byte[] element(int index) {
        requireVariableLength();
        return elements[index].clone();
    }

    /**
     * Read-only view of one string element.
     */
    public ByteBuffer elementBuffer(int index) {
        requireVariableLength();
        return ByteBuffer.wrap(elements[index]).asReadOnlyBuffer();
    }

    public List<String> asStrings() {
        requireVariableLength();
        List<String> out = new ArrayList<>(elements.length);
        for (byte[] e : elements) {
            out.add(new String(e, StandardCharsets.UTF_8));
        }
        return out;
    }

    public long[] asInt64s() {
        requireType(DataType.INT64);
        long[] out = new long[(int) numElements()];
        ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asLongBuffer().get(out);
        return out;
    }

    public int[] asInt32s() {
        requireType(DataType.INT32);
        int[] out = new int[(int) numElements()];
        ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asIntBuffer().get(out);
        return out;
    }

    public double[] asFloat64s() {
        requireType(DataType.FLOAT64);
        double[] out = new double[(int) numElements()];
        ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asDoubleBuffer().get(out);
        return out;
    }

    private void requireFixedWidth() {
        if (elements != null) {
            throw new IllegalStateException(dtype + " value has no flat buffer");
        }
    }

    private void requireVariableLength() {
        if (elements == null) {
            throw new IllegalStateException(dtype + " value has no elements");
        }
    }

    private void requireType(DataType expected) {
        if (dtype != expected) {
            throw new IllegalStateException("Value is " + dtype + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransferValue other)) {
            return false;
        }
        return dtype == other.dtype
                && shape.equals(other.shape)
                && Arrays.equals(data, other.data)
                && Arrays.deepEquals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(dtype, shape);
        h = 31 * h + Arrays.hashCode(data);
        return 31 * h + Arrays.deepHashCode(elements);
    }

    @Override
    public String toString() {
        return "TransferValue[" + dtype + ", shape=" + shape + ", totalBytes=" + totalBytes + ']';
    }
}
