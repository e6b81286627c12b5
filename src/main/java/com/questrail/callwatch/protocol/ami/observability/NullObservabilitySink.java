package com.questrail.callwatch.protocol.ami.observability;

/**
 * No-op implementation of AmiObservabilitySink.
 */
public final class NullObservabilitySink implements AmiObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionStateTransition(ConnectionStateTransitionEvent event) {}

    @Override
    public void onCallTransition(CallTransitionEvent event) {}

    @Override
    public void onProtocolEvent(AmiProtocolObservabilityEvent event) {}

    @Override
    public void onError(AmiErrorEvent event) {}
}
