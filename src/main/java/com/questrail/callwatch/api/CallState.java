package com.questrail.callwatch.api;

/**
 * CallState
 * -----------------------------------------------------------------------------
 * Lifecycle state of a single observed {@link Call}.
 *
 * <p>Transitions are monotonic: {@code RINGING -> ANSWERED -> ENDED} or
 * {@code RINGING -> ENDED}. A call never moves backward.</p>
 */
public enum CallState
{
    RINGING,
    ANSWERED,
    ENDED;

    /**
     * Returns {@code true} if moving from this state to {@code next} is a legal
     * forward transition.
     */
    public boolean canAdvanceTo(CallState next)
    {
        return next.ordinal() > this.ordinal();
    }
}
