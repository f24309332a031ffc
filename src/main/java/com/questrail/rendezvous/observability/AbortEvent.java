package com.questrail.rendezvous.observability;

import com.questrail.rendezvous.api.Status;

import java.time.Instant;

/**
 * A rendezvous was aborted.
 *
 * @param failedWaiters number of pending receives that were failed by the abort
 */
public record AbortEvent(
    Instant timestamp,
    Status status,
    int failedWaiters
) {
}
