package com.questrail.rendezvous.cancel;

import com.questrail.rendezvous.api.DeadlineExceededException;
import com.questrail.rendezvous.api.Delivery;
import com.questrail.rendezvous.api.RecvCancelledException;
import com.questrail.rendezvous.api.RecvHandle;
import com.questrail.rendezvous.api.Rendezvous;
import com.questrail.rendezvous.api.RendezvousException;
import com.questrail.rendezvous.api.Status;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.internal.time.Cancellable;
import com.questrail.rendezvous.internal.time.MonotonicClock;
import com.questrail.rendezvous.internal.time.MonotonicScheduler;
import com.questrail.rendezvous.key.RendezvousKey;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * BlockingRecv
 * =============================================================================
 * Synchronous receive built on {@link Rendezvous#recvAsync}.
 *
 * <h2>Three-way race</h2>
 * A blocking receive ends when the first of these happens:
 * <ol>
 *   <li>the rendezvous resolves the receive (delivery or failure),</li>
 *   <li>the deadline armed on the {@link MonotonicScheduler} elapses,</li>
 *   <li>the {@link CancellationToken} fires.</li>
 * </ol>
 * Arms 2 and 3 resolve the receive by {@link RecvHandle#withdraw withdrawing}
 * it, which goes through the same single-resolution latch the rendezvous
 * uses. A late producer therefore finds no waiter and deposits instead of
 * handing its payload to a consumer that has given up. Whichever arms lose
 * are deregistered before returning.
 *
 * <p>A {@code null}, zero or negative timeout waits indefinitely, and so does
 * one too long to express in nanoseconds (for example
 * {@code Duration.ofMillis(Long.MAX_VALUE)}). If the deadline or the
 * cancellation subscription cannot be armed, the receive is withdrawn and
 * fails with {@code UNAVAILABLE} (scheduler shut down) or {@code INTERNAL}.</p>
 */
public final class BlockingRecv
{
    private static final Cancellable UNARMED = () -> false;

    /** Longest timeout that is armed; anything longer waits indefinitely. */
    private static final Duration MAX_DEADLINE = Duration.ofNanos(Long.MAX_VALUE);

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;

    public BlockingRecv(MonotonicClock clock, MonotonicScheduler scheduler) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Receive {@code key}, blocking until delivery, failure, deadline or
     * cancellation.
     *
     * @throws DeadlineExceededException if the deadline elapsed first
     * @throws RecvCancelledException if {@code token} fired first, or the
     *         calling thread was interrupted
     * @throws RendezvousException for failures reported by the rendezvous
     */
    public Delivery recv(Rendezvous rendezvous,
                         RendezvousKey key,
                         TransferContext context,
                         Duration timeout,
                         CancellationToken token) {
        return race(rendezvous, key, context, timeout, token).orThrow();
    }

    /**
     * Same as {@link #recv} but reports which arm won instead of throwing.
     */
    public RecvResult race(Rendezvous rendezvous,
                           RendezvousKey key,
                           TransferContext context,
                           Duration timeout,
                           CancellationToken token) {
        Objects.requireNonNull(rendezvous, "rendezvous");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(context, "context");
        CancellationToken cancellation = (token == null) ? CancellationToken.none() : token;

        if (cancellation.isCancelled()) {
            return RecvResult.failed(RecvOutcome.CANCELLED, cancelled(key));
        }

        RecvHandle<Delivery> handle = rendezvous.recvAsync(key, context);

        Cancellable deadline = UNARMED;
        Cancellable subscription = UNARMED;
        try {
            if (hasDeadline(timeout)) {
                deadline = scheduler.scheduleAfter(timeout, clock, () -> handle.withdraw(
                        new DeadlineExceededException("Timed out after " + timeout.toMillis() + " ms receiving " + key)));
            }
            subscription = cancellation.onCancel(() -> handle.withdraw(cancelled(key)));
        } catch (RuntimeException e) {
            deadline.cancel();
            // The waiter is already registered: withdraw it so a later send deposits.
            handle.withdraw(armingFailed(key, e));
            return await(handle);
        }

        try {
            return RecvResult.delivered(handle.result().get());
        } catch (ExecutionException e) {
            RendezvousException failure = RendezvousException.from(e);
            return RecvResult.failed(outcomeOf(failure), failure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // If the rendezvous already claimed the receive, its resolution is imminent.
            handle.withdraw(new RecvCancelledException("Interrupted while receiving " + key));
            return await(handle);
        } finally {
            deadline.cancel();
            subscription.cancel();
        }
    }

    private static RecvResult await(RecvHandle<Delivery> handle) {
        Delivery delivery = handle.result().handle((d, t) -> d).join();
        if (delivery != null) {
            return RecvResult.delivered(delivery);
        }
        RendezvousException failure = RendezvousException.from(handle.result().handle((d, t) -> t).join());
        return RecvResult.failed(outcomeOf(failure), failure);
    }

    private static RecvOutcome outcomeOf(RendezvousException failure) {
        if (failure instanceof DeadlineExceededException) {
            return RecvOutcome.DEADLINE_EXCEEDED;
        }
        if (failure instanceof RecvCancelledException) {
            return RecvOutcome.CANCELLED;
        }
        return RecvOutcome.FAILED;
    }

    private static boolean hasDeadline(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative() && timeout.compareTo(MAX_DEADLINE) < 0;
    }

    private static RendezvousException armingFailed(RendezvousKey key, RuntimeException cause) {
        String message = "Could not arm receive of " + key + ": " + cause;
        Status status = (cause instanceof RejectedExecutionException)
                ? Status.unavailable(message)
                : Status.internal(message);
        return new RendezvousException(status, cause);
    }

    private static RecvCancelledException cancelled(RendezvousKey key) {
        return new RecvCancelledException("Receive of " + key + " was cancelled");
    }
}
