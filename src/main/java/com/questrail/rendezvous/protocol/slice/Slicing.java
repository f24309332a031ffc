package com.questrail.rendezvous.protocol.slice;

import java.util.ArrayList;
import java.util.List;

/**
 * Slice boundaries of a byte range.
 *
 * <p>Slice {@code i} of a {@code total}-byte range starts at
 * {@code i * sliceSize} and is {@code sliceSize} long, except the final slice
 * which holds the remainder. Sender and receiver both use these functions so
 * their boundaries always agree.</p>
 */
public final class Slicing
{
    private Slicing() {}

    public record Slice(long index, long start, long length) {}

    /**
     * {@code ceil(total / sliceSize)}; zero for an empty range.
     */
    public static long sliceCount(long total, long sliceSize) {
        requireArguments(total, sliceSize);
        return total / sliceSize + (total % sliceSize == 0 ? 0 : 1);
    }

    public static long sliceStart(long index, long sliceSize) {
        return Math.multiplyExact(index, sliceSize);
    }

    public static long sliceLength(long index, long total, long sliceSize) {
        requireArguments(total, sliceSize);
        long start = sliceStart(index, sliceSize);
        if (index < 0 || start >= total) {
            throw new IndexOutOfBoundsException("Slice " + index + " outside " + total + " bytes");
        }
        // Written as a difference so huge slice sizes cannot overflow.
        return (start > total - sliceSize) ? total - start : sliceSize;
    }

    public static List<Slice> slices(long total, long sliceSize) {
        long count = sliceCount(total, sliceSize);
        List<Slice> out = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            out.add(new Slice(i, sliceStart(i, sliceSize), sliceLength(i, total, sliceSize)));
        }
        return out;
    }

    private static void requireArguments(long total, long sliceSize) {
        if (sliceSize <= 0) {
            throw new IllegalArgumentException("sliceSize must be > 0, was " + sliceSize);
        }
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0, was " + total);
        }
    }
}
