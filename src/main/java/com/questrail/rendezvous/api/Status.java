package com.questrail.rendezvous.api;

import java.util.Objects;

/**
 * Status
 * -----------------------------------------------------------------------------
 * Outcome of a rendezvous operation: a {@link StatusCode} plus a diagnostic
 * message.
 *
 * <p>Statuses are the currency of {@link Rendezvous#abort(Status)}. An abort
 * status must be a failure; {@link #isOk()} statuses are rejected there.</p>
 */
public record Status(StatusCode code, String message)
{
    private static final Status OK = new Status(StatusCode.OK, "");

    public Status {
        Objects.requireNonNull(code, "code");
        message = (message == null) ? "" : message;
    }

    public static Status ok() {
        return OK;
    }

    public static Status cancelled(String message) {
        return new Status(StatusCode.CANCELLED, message);
    }

    public static Status aborted(String message) {
        return new Status(StatusCode.ABORTED, message);
    }

    public static Status unavailable(String message) {
        return new Status(StatusCode.UNAVAILABLE, message);
    }

    public static Status internal(String message) {
        return new Status(StatusCode.INTERNAL, message);
    }

    public static Status invalidArgument(String message) {
        return new Status(StatusCode.INVALID_ARGUMENT, message);
    }

    public static Status deadlineExceeded(String message) {
        return new Status(StatusCode.DEADLINE_EXCEEDED, message);
    }

    public boolean isOk() {
        return code == StatusCode.OK;
    }

    @Override
    public String toString() {
        return message.isEmpty() ? code.name() : code + ": " + message;
    }
}
