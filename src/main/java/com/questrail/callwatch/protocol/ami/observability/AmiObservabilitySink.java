package com.questrail.callwatch.protocol.ami.observability;

/**
 * Main interface for receiving manager protocol observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the thread that produced the event (usually the transport
 * read loop) and must return quickly.</p>
 */
public interface AmiObservabilitySink {
    /**
     * Called when the transport session changes {@link com.questrail.callwatch.api.ConnectionState}.
     * @param event the transition event details
     */
    void onConnectionStateTransition(ConnectionStateTransitionEvent event);

    /**
     * Called when a tracked call is created or changes state.
     * @param event the call transition
     */
    void onCallTransition(CallTransitionEvent event);

    /**
     * Called when a protocol-level observability event occurs (e.g., keep-alive, reconnect).
     * @param event the protocol event
     */
    void onProtocolEvent(AmiProtocolObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs in the protocol stack.
     * @param event the error event
     */
    void onError(AmiErrorEvent event);
}
