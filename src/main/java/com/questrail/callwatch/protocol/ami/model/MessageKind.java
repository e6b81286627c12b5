package com.questrail.callwatch.protocol.ami.model;

/**
 * Classification of an inbound block.
 */
public enum MessageKind {
    /** Carries an {@code Event} field. */
    EVENT,

    /** Carries a {@code Response} field. */
    RESPONSE,

    /** Neither; e.g. the greeting banner sent when a connection opens. */
    UNKNOWN
}
