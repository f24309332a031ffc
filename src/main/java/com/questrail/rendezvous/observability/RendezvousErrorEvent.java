package com.questrail.rendezvous.observability;

import java.time.Instant;

/**
 * An error or anomaly outside the caller's direct view, for example an
 * inbound datagram that failed to decode.
 */
public record RendezvousErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
