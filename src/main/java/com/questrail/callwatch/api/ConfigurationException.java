package com.questrail.callwatch.api;

/**
 * Indicates that the supplied configuration cannot be used.
 *
 * <p>Configuration errors are fatal to a connect attempt and are never retried
 * automatically.</p>
 */
public class ConfigurationException extends CallWatchException
{
    public ConfigurationException(String message)
    {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
