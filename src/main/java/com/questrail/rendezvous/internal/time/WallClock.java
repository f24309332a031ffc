package com.questrail.rendezvous.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly to timestamp observability events. It may
 * jump, so it MUST NOT drive deadlines.
 */
public interface WallClock
{
    Instant now();
}
