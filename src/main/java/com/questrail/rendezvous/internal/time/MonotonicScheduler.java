package com.questrail.rendezvous.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Arms deadline tasks (for example the timeout arm of a blocking receive).
 *
 * <h2>Binding invariant</h2>
 * Deadlines are expressed in monotonic nanoseconds or durations, never in
 * wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} at or after {@code deadlineNanos}.
     *
     * @param deadlineNanos deadline on the {@link MonotonicClock} time line
     * @return handle that withdraws the task if it has not run yet
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once {@code delay} has elapsed on {@code clock}.
     * A deadline beyond the range of {@code long} nanoseconds saturates to
     * {@link Long#MAX_VALUE}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline;
        if (delay.compareTo(Duration.ofNanos(Long.MAX_VALUE)) >= 0) {
            deadline = Long.MAX_VALUE;
        } else {
            long now = clock.nowNanos();
            long nanos = delay.toNanos();
            deadline = (now > Long.MAX_VALUE - nanos) ? Long.MAX_VALUE : now + nanos;
        }
        return scheduleAtNanos(deadline, task);
    }
}
