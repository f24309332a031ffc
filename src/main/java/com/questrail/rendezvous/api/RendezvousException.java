package com.questrail.rendezvous.api;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Root of all failures reported by the rendezvous and the transfer protocol.
 *
 * <p>Every instance carries the {@link Status} that describes it, so callers
 * that only care about the code can branch on {@link #status()} without
 * knowing the concrete subclass.</p>
 */
public class RendezvousException extends RuntimeException
{
    private final Status status;

    public RendezvousException(Status status) {
        super(Objects.requireNonNull(status, "status").toString());
        if (status.isOk()) {
            throw new IllegalArgumentException("RendezvousException requires a failure status");
        }
        this.status = status;
    }

    public RendezvousException(Status status, Throwable cause) {
        this(status);
        initCause(cause);
    }

    /**
     * Recovers the rendezvous failure behind a future's failure, unwrapping
     * {@link CompletionException} and {@link ExecutionException}. Anything
     * that is not already a {@code RendezvousException} is reported as
     * {@link StatusCode#INTERNAL}.
     */
    public static RendezvousException from(Throwable failure) {
        Throwable t = failure;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof RendezvousException re) {
            return re;
        }
        return new RendezvousException(Status.internal(String.valueOf(t)), t);
    }

    public Status status() {
        return status;
    }

    public StatusCode code() {
        return status.code();
    }
}
