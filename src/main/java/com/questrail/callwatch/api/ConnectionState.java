package com.questrail.callwatch.api;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Lifecycle of the management connection as seen by consumers.
 *
 * <pre>
 *   DISCONNECTED -> CONNECTING -> AUTHENTICATING -> CONNECTED
 *        ^              |               |              |
 *        |              +---------------+--------------+--> RECONNECTING -> CONNECTING ...
 *        +--------------------- explicit close / auth failure / give up
 * </pre>
 *
 * <p>Only the transport session mutates this state; consumers observe it.</p>
 */
public enum ConnectionState
{
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    CONNECTED,
    RECONNECTING
}
