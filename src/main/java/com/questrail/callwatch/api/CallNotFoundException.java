package com.questrail.callwatch.api;

/**
 * A command referenced a call that is unknown or has already ended.
 */
public final class CallNotFoundException extends CallWatchException
{
    private final String callId;

    public CallNotFoundException(String callId)
    {
        super("No active call with id " + callId);
        this.callId = callId;
    }

    public String callId()
    {
        return callId;
    }
}
