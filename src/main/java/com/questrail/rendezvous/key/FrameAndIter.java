package com.questrail.rendezvous.key;

/**
 * Execution-frame / iteration discriminator. Distinguishes concurrent or
 * repeated executions of the same logical edge so that each execution
 * instance gets its own keys.
 *
 * <p>Both ids are unsigned 64-bit values and are rendered as unsigned
 * decimals on the wire.</p>
 */
public record FrameAndIter(long frameId, long iterId)
{
    public static final FrameAndIter ROOT = new FrameAndIter(0L, 0L);

    public static FrameAndIter of(long frameId, long iterId) {
        return new FrameAndIter(frameId, iterId);
    }

    /**
     * Wire form: {@code <frame>:<iter>}.
     */
    public String wireForm() {
        return Long.toUnsignedString(frameId) + ':' + Long.toUnsignedString(iterId);
    }

    @Override
    public String toString() {
        return wireForm();
    }
}
