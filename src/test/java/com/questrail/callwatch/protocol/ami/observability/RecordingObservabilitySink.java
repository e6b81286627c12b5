package com.questrail.callwatch.protocol.ami.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements AmiObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onConnectionStateTransition(ConnectionStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCallTransition(CallTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onProtocolEvent(AmiProtocolObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(AmiErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    public synchronized List<AmiErrorEvent> errors() {
        return eventsOfType(AmiErrorEvent.class);
    }
}
