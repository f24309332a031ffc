package com.questrail.rendezvous.core;

import com.questrail.rendezvous.api.RendezvousAbortedException;
import com.questrail.rendezvous.api.Status;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Table-wide abort flag, shared by every channel table of one rendezvous.
 * Set at most once; the first status wins.
 */
final class AbortState
{
    private final AtomicReference<Status> status = new AtomicReference<>();

    /**
     * @return {@code true} if this call set the status
     */
    boolean trySet(Status abortStatus) {
        Objects.requireNonNull(abortStatus, "abortStatus");
        if (abortStatus.isOk()) {
            throw new IllegalArgumentException("abort requires a failure status");
        }
        return status.compareAndSet(null, abortStatus);
    }

    Optional<Status> status() {
        return Optional.ofNullable(status.get());
    }

    boolean isAborted() {
        return status.get() != null;
    }

    void throwIfAborted() {
        Status s = status.get();
        if (s != null) {
            throw new RendezvousAbortedException(s);
        }
    }
}
