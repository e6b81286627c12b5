package com.questrail.callwatch.api;

/**
 * The server answered an action with a failure response.
 */
public final class ActionRejectedException extends CallWatchException
{
    private final String action;
    private final String serverMessage;

    public ActionRejectedException(String action, String serverMessage)
    {
        super("Action " + action + " rejected: " + serverMessage);
        this.action = action;
        this.serverMessage = serverMessage;
    }

    public String action()
    {
        return action;
    }

    /**
     * The server's {@code Message} field, or an empty string if none was sent.
     */
    public String serverMessage()
    {
        return serverMessage;
    }
}
