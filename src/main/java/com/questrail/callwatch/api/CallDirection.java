package com.questrail.callwatch.api;

/**
 * Direction of a call relative to the monitored extension.
 */
public enum CallDirection
{
    /** An external party is calling the monitored extension. */
    INBOUND,

    /** The monitored extension placed the call. */
    OUTBOUND,

    /** Both parties are local extensions. */
    INTERNAL,

    /** Not derivable from the events observed so far. */
    UNKNOWN
}
