package com.questrail.rendezvous.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransferValueTest {

    @Test
    void fixedWidthTotalBytesIsElementsTimesWidth() {
        TransferValue v = TransferValue.ofInt64s(Shape.of(2, 3), 1, 2, 3, 4, 5, 6);

        assertEquals(DataType.INT64, v.dtype());
        assertEquals(6, v.numElements());
        assertEquals(48, v.totalBytes());
        assertArrayEquals(new long[] {1, 2, 3, 4, 5, 6}, v.asInt64s());
    }

    @Test
    void stringTotalBytesIsSumOfUtf8Lengths() {
        TransferValue v = TransferValue.ofStrings("a", "", "été");

        assertEquals(3, v.numElements());
        assertEquals(1 + 0 + "été".getBytes(StandardCharsets.UTF_8).length, v.totalBytes());
        assertEquals(List.of("a", "", "été"), v.asStrings());
        assertEquals(0, v.elementSize(1));
    }

    @Test
    void rejectsBufferThatDoesNotMatchShape() {
        assertThrows(IllegalArgumentException.class,
            () -> TransferValue.of(DataType.INT32, Shape.of(3), new byte[8]));
        assertThrows(IllegalArgumentException.class,
            () -> TransferValue.of(DataType.STRING, Shape.scalar(), new byte[0]));
        assertThrows(IllegalArgumentException.class,
            () -> TransferValue.ofStrings(Shape.of(2), List.of("only one")));
    }

    @Test
    void isImmutable() {
        byte[] data = {1, 2, 3, 4};
        TransferValue v = TransferValue.of(DataType.UINT8, Shape.of(4), data);
        data[0] = 9;

        assertEquals(1, v.toByteArray()[0]);
        assertTrue(v.data().isReadOnly());
    }

    @Test
    void scalarAndEmptyShapes() {
        assertEquals(1, Shape.scalar().numElements());
        assertEquals(0, Shape.of(4, 0).numElements());
        assertThrows(IllegalArgumentException.class, () -> Shape.of(-1));
    }

    @Test
    void shapeDimensionsAreIndexedOutermostFirst() {
        Shape shape = Shape.of(2, 5);

        assertEquals(2, shape.rank());
        assertEquals(2, shape.dim(0));
        assertEquals(5, shape.dim(1));
        assertThrows(IndexOutOfBoundsException.class, () -> shape.dim(2));
    }

    @Test
    void int32ValuesAreLittleEndian() {
        TransferValue v = TransferValue.ofInt32s(Shape.of(3), 1, -2, 3);

        assertEquals(12, v.totalBytes());
        assertArrayEquals(new int[] {1, -2, 3}, v.asInt32s());
        assertArrayEquals(new byte[] {1, 0, 0, 0}, Arrays.copyOf(v.toByteArray(), 4));
        assertThrows(IllegalStateException.class, v::asInt64s);
    }

    @Test
    void accessorsRejectWrongKind() {
        TransferValue strings = TransferValue.ofStrings("x");
        TransferValue doubles = TransferValue.ofFloat64s(Shape.of(1), 1.5);

        assertThrows(IllegalStateException.class, strings::data);
        assertThrows(IllegalStateException.class, () -> doubles.element(0));
        assertThrows(IllegalStateException.class, doubles::asInt64s);
        assertEquals(1.5, doubles.asFloat64s()[0]);
    }
}
