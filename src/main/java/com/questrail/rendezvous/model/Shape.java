package com.questrail.rendezvous.model;

import java.util.Arrays;

/**
 * Immutable dimension list of a {@link TransferValue}. A rank-0 shape is a
 * scalar with one element.
 */
public final class Shape
{
    private static final Shape SCALAR = new Shape(new long[0]);

    private final long[] dims;
    private final long numElements;

    private Shape(long[] dims) {
        long n = 1;
        for (long d : dims) {
            if (d < 0) {
                throw new IllegalArgumentException("Negative dimension in " + Arrays.toString(dims));
            }
            n = Math.multiplyExact(n, d);
        }
        this.dims = dims;
        this.numElements = n;
    }

    public static Shape of(long... dims) {
        if (dims == null || dims.length == 0) {
            return SCALAR;
        }
        return new Shape(dims.clone());
    }

    public static Shape scalar() {
        return SCALAR;
    }

    /**
     * One-dimensional shape of {@code n} elements.
     */
    public static Shape vector(long n) {
        return of(n);
    }

    public int rank() {
        return dims.length;
    }

    public long dim(int index) {
        return dims[index];
    }

    public long[] dims() {
        return dims.clone();
    }

    public long numElements() {
        return numElements;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Shape other && Arrays.equals(dims, other.dims));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        return Arrays.toString(dims);
    }
}
