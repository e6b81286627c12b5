package com.questrail.callwatch.protocol.ami.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational deadline in the client: action timeouts,
 * keep-alive idle detection, reconnect backoff and the ended-call retention
 * window.
 *
 * <p>Wall-clock time can jump (NTP, sleep/wake on a laptop) and is only used
 * for call timestamps shown to the user; see {@link WallClock}.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick in nanoseconds. Only
     * differences between two ticks are meaningful.
     */
    long nowNanos();
}
