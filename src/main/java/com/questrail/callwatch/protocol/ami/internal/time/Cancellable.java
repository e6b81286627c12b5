package com.questrail.callwatch.protocol.ami.internal.time;

/**
 * Cancellation handle for a task handed to a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run because of this call;
     *         {@code false} if it already ran or was cancelled before.
     */
    boolean cancel();
}
