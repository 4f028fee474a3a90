package com.questrail.booking.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <p>Absolute deadlines are turned into relative delays at scheduling time.
 * The executor's lifecycle belongs to the caller: the runtimes shut it down
 * in their {@code stop()}.</p>
 *
 * <p>The client runtime uses a single-thread executor, so timer callbacks for
 * one client never run concurrently with each other.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler
{
    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public MonotonicClock clock()
    {
        return clock;
    }
}
