package com.questrail.rendezvous.observability;

import com.questrail.rendezvous.key.RendezvousKey;
import com.questrail.rendezvous.protocol.slice.SlicePhase;

import java.time.Instant;

/**
 * One phase of a sliced transfer was sent or received.
 *
 * @param payloadBytes envelope payload size; zero for a dead envelope
 */
public record TransferPhaseEvent(
    Instant timestamp,
    Direction direction,
    SlicePhase phase,
    RendezvousKey key,
    int payloadBytes,
    boolean live
) {
    public enum Direction { SEND, RECV }
}
