package com.questrail.callwatch.api;

/**
 * The connection was not available, or went away while an action was pending.
 */
public final class DisconnectedException extends CallWatchException
{
    public DisconnectedException(String message)
    {
        super(message);
    }

    public DisconnectedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
