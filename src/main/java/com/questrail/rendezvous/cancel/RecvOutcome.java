package com.questrail.rendezvous.cancel;

/**
 * Which arm of a blocking receive race resolved it.
 */
public enum RecvOutcome
{
    /** The envelope arrived. */
    DELIVERED,
    /** The rendezvous reported a failure, for example an abort. */
    FAILED,
    /** The deadline elapsed first. */
    DEADLINE_EXCEEDED,
    /** The cancellation token fired first. */
    CANCELLED
}
