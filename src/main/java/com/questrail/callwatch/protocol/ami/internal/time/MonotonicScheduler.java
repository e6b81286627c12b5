package com.questrail.callwatch.protocol.ami.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * One-shot task scheduling against a {@link MonotonicClock} deadline.
 *
 * <p>The session, the correlator and the facade all schedule through this port
 * so tests can replace real time with a manually advanced clock.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in the time base of {@link MonotonicClock#nowNanos()}
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task to run once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
