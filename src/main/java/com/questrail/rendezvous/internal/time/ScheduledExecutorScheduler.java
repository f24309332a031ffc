package com.questrail.rendezvous.internal.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Absolute monotonic deadlines are converted into relative delays at
 * scheduling time using the supplied {@link MonotonicClock}; callers must
 * compute their deadlines with the same clock. Past deadlines run
 * immediately.</p>
 *
 * <p>The executor is not owned: whoever created it shuts it down.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws RejectedExecutionException if the executor has been shut down
     */
    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = delayUntil(deadlineNanos, clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        // Never interrupt a deadline task that is already running.
        return () -> future.cancel(false);
    }

    /** {@code deadline - now}, clamped to {@code [0, Long.MAX_VALUE]} without overflowing. */
    static long delayUntil(long deadlineNanos, long nowNanos) {
        if (deadlineNanos <= nowNanos) {
            return 0;
        }
        long delay = deadlineNanos - nowNanos;
        return delay < 0 ? Long.MAX_VALUE : delay;
    }
}
