package com.questrail.callwatch.protocol.ami.observability;

import com.questrail.callwatch.api.Call;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a call lifecycle transition produced by the tracker.
 *
 * @param previous the call before the transition; {@code null} for a new call
 * @param current  the call after the transition
 * @param trigger  name of the event that caused it (e.g. {@code Hangup}), or a
 *                 synthetic reason such as {@code connection lost}
 */
public record CallTransitionEvent(
    Instant timestamp,
    Call previous,
    Call current,
    String trigger
) {
    public boolean isNewCall() {
        return previous == null;
    }

    public Optional<Call> previousCall() {
        return Optional.ofNullable(previous);
    }
}
