package com.questrail.callwatch.api;

/**
 * Base type for all failures surfaced by a {@link CallWatchClient}.
 */
public class CallWatchException extends RuntimeException
{
    public CallWatchException(String message)
    {
        super(message);
    }

    public CallWatchException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
