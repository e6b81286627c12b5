package com.questrail.callwatch.api;

import java.time.Duration;

/**
 * No response arrived for an action within its deadline.
 */
public final class ActionTimeoutException extends CallWatchException
{
    private final String action;
    private final String actionId;
    private final Duration timeout;

    public ActionTimeoutException(String action, String actionId, Duration timeout)
    {
        super("Action " + action + " (" + actionId + ") timed out after " + timeout.toMillis() + " ms");
        this.action = action;
        this.actionId = actionId;
        this.timeout = timeout;
    }

    public String action()
    {
        return action;
    }

    public String actionId()
    {
        return actionId;
    }

    public Duration timeout()
    {
        return timeout;
    }
}
