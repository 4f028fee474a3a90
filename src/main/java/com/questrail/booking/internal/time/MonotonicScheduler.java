package com.questrail.booking.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * One-shot timer surface used by the client for retransmission and for the
 * end of a monitoring window.
 *
 * <p>Deadlines are expressed in ticks of {@link #clock()}; a scheduler and the
 * code computing its deadlines must share the same clock instance.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule {@code task} to run at or after {@code deadlineNanos}.
     * A deadline already in the past runs as soon as possible.
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Clock against which deadlines are interpreted.
     */
    MonotonicClock clock();

    default Cancellable scheduleAfter(Duration delay, Runnable task)
    {
        Objects.requireNonNull(task, "task");
        return scheduleAtNanos(clock().deadlineAfter(delay), task);
    }
}
