package com.questrail.callwatch.protocol.ami.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Protocol-level observations that are neither state transitions nor errors.
 */
public sealed interface AmiProtocolObservabilityEvent
{
    Instant timestamp();

    /** Server banner received at the start of a connection. */
    record GreetingReceived(Instant timestamp, String banner) implements AmiProtocolObservabilityEvent {}

    /** The server reported that it finished booting. */
    record ServerFullyBooted(Instant timestamp, String status) implements AmiProtocolObservabilityEvent {}

    /** A reconnect attempt has been scheduled after a network failure. */
    record ReconnectScheduled(Instant timestamp, int attempt, Duration delay) implements AmiProtocolObservabilityEvent {}

    /** The connection was idle and a keep-alive probe was sent. */
    record KeepAlivePing(Instant timestamp, Duration idleFor) implements AmiProtocolObservabilityEvent {}

    /** The framer discarded an oversized block. */
    record MalformedBlockDropped(Instant timestamp, long totalDropped) implements AmiProtocolObservabilityEvent {}

    /** A response arrived whose ActionID matches no pending action. */
    record UnmatchedResponse(Instant timestamp, String actionId) implements AmiProtocolObservabilityEvent {}

    /** A pending action expired without a response. */
    record ActionTimedOut(Instant timestamp, String action, String actionId, Duration timeout)
        implements AmiProtocolObservabilityEvent {}
}
