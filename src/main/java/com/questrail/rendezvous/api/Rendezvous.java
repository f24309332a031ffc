package com.questrail.rendezvous.api;

import com.questrail.rendezvous.key.RendezvousKey;

import java.util.Objects;
import java.util.Optional;

/**
 * Rendezvous
 * =============================================================================
 * A table of one-shot channels keyed by {@link RendezvousKey}. A producer
 * hands one {@link Envelope} to one consumer through each channel.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #send} never blocks. It resolves an already waiting consumer or
 *       deposits the envelope until one arrives.</li>
 *   <li>A consumer may arrive before or after the producer; both orders are
 *       observably identical.</li>
 *   <li>A channel is removed as soon as it is matched. The table keeps no
 *       history.</li>
 *   <li>{@link #abort} fails every pending receive and every later operation
 *       with the abort status.</li>
 * </ul>
 *
 * <p>Concurrent duplicate sends (or duplicate receives) on one key violate the
 * caller contract; behavior is then undefined.</p>
 *
 * <p>This is the minimal capability. Aliasing and batched receives are the
 * separate {@link RefRendezvous} and {@link FusedRendezvous} extensions.</p>
 */
public interface Rendezvous
{
    /**
     * Deposit {@code envelope} under {@code key} or hand it to the waiting
     * consumer.
     *
     * @throws RendezvousAbortedException if the rendezvous has been aborted
     */
    void send(RendezvousKey key, TransferContext context, Envelope envelope);

    /**
     * Register interest in {@code key}. Resolves immediately if an envelope is
     * already deposited, otherwise when one is sent or the table is aborted.
     */
    RecvHandle<Delivery> recvAsync(RendezvousKey key, TransferContext context);

    /**
     * Callback form of {@link #recvAsync(RendezvousKey, TransferContext)}.
     * {@code done} is invoked exactly once.
     */
    default void recvAsync(RendezvousKey key, TransferContext context, DoneCallback done) {
        Objects.requireNonNull(done, "done");
        recvAsync(key, context).result().whenComplete((delivery, failure) -> {
            if (failure == null) {
                done.done(Status.ok(), delivery);
            } else {
                done.done(RendezvousException.from(failure).status(), null);
            }
        });
    }

    /**
     * Fail all pending and future operations with {@code status}. Does not
     * wait for in-flight callbacks. The first abort wins; later calls are
     * ignored.
     *
     * @throws IllegalArgumentException if {@code status} is OK
     */
    void abort(Status status);

    /**
     * The status this rendezvous was aborted with, if any.
     */
    Optional<Status> abortStatus();
}
