package com.questrail.callwatch.protocol.ami.internal.session;

import com.questrail.callwatch.api.ConnectionState;

/**
 * Lifecycle callbacks from {@link AmiSession}. Invoked while the session lock
 * is held; implementations must not block.
 */
public interface SessionListener
{
    void onStateChanged(ConnectionState oldState, ConnectionState newState);

    /**
     * The connection went away, for any reason including an explicit
     * disconnect. Calls in progress can no longer be observed.
     */
    void onConnectionLost();
}
