package com.questrail.rendezvous.api;

import com.questrail.rendezvous.key.RendezvousKey;

import java.util.concurrent.CompletableFuture;

/**
 * RecvHandle
 * -----------------------------------------------------------------------------
 * Consumer-side view of one pending receive: the future half of a
 * single-resolution promise whose other half is held by the rendezvous.
 *
 * <h2>Single resolution</h2>
 * Exactly one party resolves a receive: the producer's send, an abort, or the
 * consumer itself via {@link #withdraw(RendezvousException)}. Whoever claims
 * the receive first wins; the others observe that it is already claimed.
 * Callers must not complete {@link #result()} directly.
 *
 * @param <T> delivered value type
 */
public interface RecvHandle<T>
{
    RendezvousKey key();

    /**
     * Completes with the delivered value, or exceptionally with a
     * {@link RendezvousException}.
     */
    CompletableFuture<T> result();

    /**
     * Withdraw this receive if no producer or abort has claimed it yet.
     *
     * <p>On success the waiter is removed from its channel, so a later send to
     * the same key is deposited rather than handed to a consumer that has
     * given up, and {@link #result()} fails with {@code reason}.</p>
     *
     * @return {@code true} if this call resolved the receive; {@code false} if
     *         it had already been claimed (the result is, or will be, the
     *         claimant's)
     */
    boolean withdraw(RendezvousException reason);
}
