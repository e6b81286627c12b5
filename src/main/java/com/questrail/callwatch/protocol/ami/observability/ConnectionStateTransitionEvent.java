package com.questrail.callwatch.protocol.ami.observability;

import com.questrail.callwatch.api.ConnectionState;

import java.time.Instant;

/**
 * Record representing a transport session state change.
 *
 * @param reason short human-readable trigger, e.g. {@code "login accepted"}
 */
public record ConnectionStateTransitionEvent(
    Instant timestamp,
    ConnectionState oldState,
    ConnectionState newState,
    String reason
) {
    public boolean isLoss() {
        return oldState == ConnectionState.CONNECTED && newState != ConnectionState.CONNECTED;
    }
}
