package com.questrail.rendezvous.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for receive deadlines.
 *
 * <h2>Binding invariant</h2>
 * Deadlines MUST be computed from a monotonic source. Wall-clock time is
 * permitted only for observability timestamps (see {@link WallClock}).
 */
public interface MonotonicClock
{
    /**
     * Monotonically non-decreasing tick value in nanoseconds. Only meaningful
     * for elapsed-time arithmetic.
     */
    long nowNanos();
}
