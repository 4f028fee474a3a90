package com.questrail.booking.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a timer armed on a {@link MonotonicScheduler}.
 *
 * <p>Retransmission timers are cancelled when the matching reply arrives;
 * monitoring-window timers are cancelled when the client is closed.</p>
 */
public interface Cancellable
{
    /**
     * @return {@code true} if this call prevented the task from running;
     *         {@code false} if it already ran or was cancelled before
     */
    boolean cancel();
}
