package com.questrail.rendezvous.model;

import java.util.Optional;

/**
 * Element type of a {@link TransferValue}.
 *
 * <p>Fixed-width types are transferred as one flat byte buffer. The
 * variable-length {@link #STRING} type is transferred element by element,
 * preceded by the per-element sizes.</p>
 */
public enum DataType
{
    BOOL(1, 1),
    INT8(2, 1),
    UINT8(3, 1),
    INT16(4, 2),
    INT32(5, 4),
    INT64(6, 8),
    FLOAT32(7, 4),
    FLOAT64(8, 8),
    STRING(9, 0);

    private final int code;
    private final int byteWidth;

    DataType(int code, int byteWidth) {
        this.code = code;
        this.byteWidth = byteWidth;
    }

    /**
     * Stable one-byte wire code.
     */
    public int code() {
        return code;
    }

    /**
     * Bytes per element.
     *
     * @throws UnsupportedOperationException for variable-length types
     */
    public int byteWidth() {
        if (isVariableLength()) {
            throw new UnsupportedOperationException(name() + " has no fixed element width");
        }
        return byteWidth;
    }

    public boolean isVariableLength() {
        return byteWidth == 0;
    }

    public static Optional<DataType> fromCode(int code) {
        for (DataType t : values()) {
            if (t.code == code) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
