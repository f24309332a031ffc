package com.questrail.rendezvous.cancel;

import com.questrail.rendezvous.internal.time.Cancellable;

/**
 * CancellationToken
 * -----------------------------------------------------------------------------
 * Cooperative cancellation signal passed explicitly to a blocking receive.
 *
 * <p>A token transitions at most once, from pending to cancelled. It can be
 * polled with {@link #isCancelled()} or subscribed to with
 * {@link #onCancel(Runnable)}.</p>
 */
public interface CancellationToken
{
    boolean isCancelled();

    /**
     * Run {@code callback} when the token is cancelled. If it is already
     * cancelled the callback runs immediately on the calling thread.
     *
     * @return handle that unsubscribes the callback if it has not run yet
     */
    Cancellable onCancel(Runnable callback);

    /**
     * A token that is never cancelled.
     */
    static CancellationToken none() {
        return NeverCancelled.INSTANCE;
    }

    enum NeverCancelled implements CancellationToken
    {
        INSTANCE;

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public Cancellable onCancel(Runnable callback) {
            return () -> false;
        }
    }
}
