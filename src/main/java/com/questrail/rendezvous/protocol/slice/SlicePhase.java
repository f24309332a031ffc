package com.questrail.rendezvous.protocol.slice;

/**
 * The exchanges that make up one sliced transfer, each on its own channel.
 *
 * <p>A phase's channel name is the configured channel name followed by the
 * phase suffix. {@link #DATA} and {@link #DATA_SUB} suffixes carry slice and
 * element indices and are built with {@link #dataSuffix(long)} and
 * {@link #dataSuffix(long, long)}.</p>
 */
public enum SlicePhase
{
    /** Total payload size; the only phase that may be dead. */
    TOTAL_BYTES("_slice_transfer_totalbytes"),
    /** Whole value in one envelope when it fits in a single slice. */
    DIRECT("_transfer_data"),
    SHAPE("_slice_transfer_shape"),
    /** Per-element sizes of a variable-length value. */
    ELEMENT_SIZES("_slice_transfer_elements_size"),
    /** Slice {@code i} of a fixed-width buffer, or element {@code i} of a string value. */
    DATA("_slice_transfer_data_"),
    /** Slice {@code j} of string element {@code i}. */
    DATA_SUB("_slice_transfer_data_");

    private final String suffix;

    SlicePhase(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Suffix of a phase without indices.
     *
     * @throws IllegalStateException for {@link #DATA} and {@link #DATA_SUB}
     */
    public String suffix() {
        if (this == DATA || this == DATA_SUB) {
            throw new IllegalStateException(name() + " suffix needs indices");
        }
        return suffix;
    }

    public static String dataSuffix(long index) {
        return DATA.suffix + index;
    }

    public static String dataSuffix(long element, long slice) {
        return DATA_SUB.suffix + element + '_' + slice;
    }
}
