package com.questrail.rendezvous.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}. Unaffected by
 * NTP or manual wall-clock adjustments.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
