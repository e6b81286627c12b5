package com.questrail.callwatch.protocol.ami.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of AmiObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jAmiObservabilitySink implements AmiObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAmiObservabilitySink.class);

    @Override
    public void onConnectionStateTransition(ConnectionStateTransitionEvent event) {
        if (event.isLoss()) {
            log.warn("AMI connection: {} -> {} ({})", event.oldState(), event.newState(), event.reason());
        } else {
            log.info("AMI connection: {} -> {} ({})", event.oldState(), event.newState(), event.reason());
        }
    }

    @Override
    public void onCallTransition(CallTransitionEvent event) {
        var call = event.current();
        if (event.isNewCall()) {
            log.info("Call {} on {}: {} {} from {}",
                call.callId(),
                call.extension(),
                call.direction(),
                call.state(),
                call.callerIdNumber().orElse("unknown"));
        } else {
            log.info("Call {} on {}: {} -> {}{}",
                call.callId(),
                call.extension(),
                event.previous().state(),
                call.state(),
                call.endCause().map(c -> " (" + c + ")").orElse(""));
        }
    }

    @Override
    public void onProtocolEvent(AmiProtocolObservabilityEvent event) {
        if (event instanceof AmiProtocolObservabilityEvent.ReconnectScheduled r) {
            log.info("AMI reconnect attempt {} in {} ms", r.attempt(), r.delay().toMillis());
        } else if (event instanceof AmiProtocolObservabilityEvent.GreetingReceived g) {
            log.info("AMI server: {}", g.banner());
        } else {
            log.debug("AMI protocol event: {}", event);
        }
    }

    @Override
    public void onError(AmiErrorEvent event) {
        log.error("AMI error: {}", event.message(), event.cause());
    }
}
