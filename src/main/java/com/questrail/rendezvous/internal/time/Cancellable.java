package com.questrail.rendezvous.internal.time;

/**
 * Handle for withdrawing something that was registered for later execution:
 * a scheduled deadline task or a cancellation subscription.
 */
public interface Cancellable
{
    /**
     * Withdraw the registration.
     *
     * @return {@code true} if it was withdrawn before running; {@code false}
     *         if it had already run or was withdrawn earlier
     */
    boolean cancel();
}
