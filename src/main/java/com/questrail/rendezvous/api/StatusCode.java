package com.questrail.rendezvous.api;

/**
 * Canonical status codes carried by {@link Status}.
 */
public enum StatusCode
{
    OK,
    CANCELLED,
    INVALID_ARGUMENT,
    DEADLINE_EXCEEDED,
    ABORTED,
    INTERNAL,
    UNAVAILABLE
}
