package com.questrail.booking.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}; used by both
 * runtimes. Tests substitute a manually advanced clock.
 */
public enum SystemMonotonicClock implements MonotonicClock
{
    INSTANCE;

    @Override
    public long nowNanos()
    {
        return System.nanoTime();
    }
}
