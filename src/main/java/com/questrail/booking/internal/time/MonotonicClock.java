package com.questrail.booking.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicClock
 * =============================================================================
 * Elapsed-time source for every timing decision in the booking system:
 * retransmission deadlines, monitoring windows, subscription expiry and
 * reply-cache retention.
 *
 * <h2>Binding invariant</h2>
 * Values are only comparable with other values of the same clock. Wall-clock
 * time never takes part in expiry decisions, so NTP steps cannot revive an
 * expired subscription or evict a cached reply early.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     */
    long nowNanos();

    /**
     * Deadline lying {@code delay} after the current tick.
     */
    default long deadlineAfter(Duration delay)
    {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return nowNanos() + delay.toNanos();
    }

    /**
     * Whether {@code deadlineNanos} has been reached. Overflow-safe as long as
     * deadlines lie within ~292 years of each other.
     */
    default boolean hasReached(long deadlineNanos)
    {
        return nowNanos() - deadlineNanos >= 0;
    }

    /**
     * Time elapsed since an earlier tick of this clock.
     */
    default Duration elapsedSince(long earlierNanos)
    {
        return Duration.ofNanos(Math.max(0, nowNanos() - earlierNanos));
    }
}
