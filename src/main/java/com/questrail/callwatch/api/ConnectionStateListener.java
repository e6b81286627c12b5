package com.questrail.callwatch.api;

/**
 * Receives connection state changes.
 *
 * <p>Invoked on the session's read or timer thread. Implementations must return
 * quickly and hand long-running work to another thread.</p>
 */
@FunctionalInterface
public interface ConnectionStateListener
{
    void onConnectionStateChanged(ConnectionState oldState, ConnectionState newState);
}
