package com.questrail.callwatch.api;

/**
 * Automatic reconnection gave up after the configured number of attempts.
 */
public final class ReconnectExhaustedException extends CallWatchException
{
    private final int attempts;

    public ReconnectExhaustedException(int attempts, Throwable lastCause)
    {
        super("Gave up reconnecting after " + attempts + " attempts", lastCause);
        this.attempts = attempts;
    }

    public int attempts()
    {
        return attempts;
    }
}
