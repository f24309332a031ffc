package com.questrail.rendezvous.core;

import com.questrail.rendezvous.api.RendezvousAbortedException;
import com.questrail.rendezvous.api.RendezvousException;
import com.questrail.rendezvous.api.Status;
import com.questrail.rendezvous.api.TransferContext;
import com.questrail.rendezvous.key.RendezvousKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiFunction;

/**
 * ChannelTable
 * =============================================================================
 * The synchronization core of a rendezvous: a map from full key to a channel
 * that holds either one deposited item or the consumers waiting for one.
 *
 * <h2>Per-channel state machine</h2>
 * <pre>
 *   Empty ─ send ──────▶ HasDeposit ─ recv ─▶ Matched (removed)
 *   Empty ─ recv ──────▶ HasWaiter  ─ send ─▶ Matched (removed)
 *                        HasWaiter  ─ withdraw ─▶ Empty (removed)
 * </pre>
 * The shared {@link AbortState} overrides all of this: once set, every
 * pending waiter fails and every later send or receive fails.
 *
 * <h2>Locking</h2>
 * The match-or-deposit decision for one key runs inside
 * {@link ConcurrentHashMap#compute}, which serializes that key only.
 * Unrelated keys never contend.
 *
 * <h2>Resolution</h2>
 * Waiters resolved by a send or by an abort are completed on the callback
 * executor, never on the producer's stack. A receive that finds a deposit
 * completes inline on the consumer's thread.
 *
 * @param <D> deposited item type
 * @param <R> type handed to the consumer
 */
final class ChannelTable<D, R>
{
    private static final Logger log = LoggerFactory.getLogger(ChannelTable.class);

    private final ConcurrentHashMap<String, Channel<D, R>> channels = new ConcurrentHashMap<>();
    private final AbortState abortState;
    private final Executor callbackExecutor;
    private final BiFunction<D, TransferContext, R> resolver;

    /**
     * @param resolver combines a deposit with the receiver's context into
     *                 what the consumer gets
     */
    ChannelTable(AbortState abortState, Executor callbackExecutor, BiFunction<D, TransferContext, R> resolver) {
        this.abortState = Objects.requireNonNull(abortState, "abortState");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    void send(RendezvousKey key, D item) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(item, "item");
        abortState.throwIfAborted();

        List<Waiter<R>> matched = new ArrayList<>(1);
        channels.compute(key.fullKey(), (k, channel) -> {
            Channel<D, R> ch = (channel == null) ? new Channel<>() : channel;
            Waiter<R> waiter = ch.claimOldestWaiter();
            if (waiter != null) {
                matched.add(waiter);
            } else if (ch.deposit != null) {
                throw new IllegalStateException("Duplicate send on key " + k);
            } else {
                ch.deposit = item;
            }
            return ch.isEmpty() ? null : ch;
        });

        if (!matched.isEmpty()) {
            Waiter<R> waiter = matched.get(0);
            R value = resolver.apply(item, waiter.receiverContext());
            dispatch(() -> waiter.promise().complete(value));
            return;
        }

        // An abort that raced with the deposit may have swept the table
        // before the deposit landed.
        if (abortState.isAborted()) {
            channels.computeIfPresent(key.fullKey(), (k, ch) -> {
                if (ch.deposit == item) {
                    ch.deposit = null;
                }
                return ch.isEmpty() ? null : ch;
            });
            abortState.throwIfAborted();
        }
    }

    Waiter<R> recvAsync(RendezvousKey key, TransferContext receiverContext) {
        Objects.requireNonNull(key, "key");
        Waiter<R> waiter = new Waiter<>(key, receiverContext, this);

        Status aborted = abortState.status().orElse(null);
        if (aborted != null) {
            waiter.claim();
            waiter.promise().completeExceptionally(new RendezvousAbortedException(aborted));
            return waiter;
        }

        List<D> found = new ArrayList<>(1);
        channels.compute(key.fullKey(), (k, channel) -> {
            Channel<D, R> ch = (channel == null) ? new Channel<>() : channel;
            if (ch.deposit != null) {
                found.add(ch.deposit);
                ch.deposit = null;
                waiter.claim();
            } else {
                ch.waiters.addLast(waiter);
            }
            return ch.isEmpty() ? null : ch;
        });

        if (!found.isEmpty()) {
            waiter.promise().complete(resolver.apply(found.get(0), receiverContext));
            return waiter;
        }

        abortState.status().ifPresent(status -> withdraw(waiter, new RendezvousAbortedException(status)));
        return waiter;
    }

    boolean withdraw(Waiter<R> waiter, RendezvousException reason) {
        if (!waiter.claim()) {
            return false;
        }
        channels.computeIfPresent(waiter.key().fullKey(), (k, ch) -> {
            ch.waiters.remove(waiter);
            return ch.isEmpty() ? null : ch;
        });
        waiter.promise().completeExceptionally(reason);
        return true;
    }

    /**
     * Fails every waiter and drops every deposit. The abort status must
     * already be set so that operations racing with the sweep fail on their
     * own re-check.
     *
     * @return number of waiters failed by this sweep
     */
    int abortAll(Status status) {
        List<Waiter<R>> failed = new ArrayList<>();
        for (String k : channels.keySet()) {
            channels.computeIfPresent(k, (key, ch) -> {
                for (Waiter<R> waiter : ch.waiters) {
                    if (waiter.claim()) {
                        failed.add(waiter);
                    }
                }
                return null;
            });
        }
        for (Waiter<R> waiter : failed) {
            dispatch(() -> waiter.promise().completeExceptionally(new RendezvousAbortedException(status)));
        }
        return failed.size();
    }

    int pendingChannels() {
        return channels.size();
    }

    private void dispatch(Runnable resolution) {
        try {
            callbackExecutor.execute(resolution);
        } catch (RejectedExecutionException e) {
            log.warn("Callback executor rejected a resolution; completing on the calling thread", e);
            resolution.run();
        }
    }

    private static final class Channel<D, R>
    {
        private D deposit;
        private final Deque<Waiter<R>> waiters = new ArrayDeque<>(1);

        /**
         * Pops waiters until one can be claimed. Waiters that lost their claim
         * to a concurrent withdrawal are discarded.
         */
        private Waiter<R> claimOldestWaiter() {
            Waiter<R> w;
            while ((w = waiters.pollFirst()) != null) {
                if (w.claim()) {
                    return w;
                }
            }
            return null;
        }

        private boolean isEmpty() {
            return deposit == null && waiters.isEmpty();
        }
    }
}
