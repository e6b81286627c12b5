package com.questrail.callwatch.api;

/**
 * The server rejected the login credentials.
 */
public final class AuthenticationException extends ConfigurationException
{
    public AuthenticationException(String message)
    {
        super(message);
    }
}
