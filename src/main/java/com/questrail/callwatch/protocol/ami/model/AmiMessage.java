package com.questrail.callwatch.protocol.ami.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AmiMessage
 * -----------------------------------------------------------------------------
 * One parsed inbound protocol unit: an event, a response, or unsolicited data.
 *
 * <p>Immutable. Unrecognized fields are retained so newer server versions never
 * lose information on the way through the client.</p>
 *
 * @param kind    classification derived from the fields present
 * @param fields  ordered, case-insensitive fields
 * @param payload lines that did not belong to any field (in wire order)
 */
public record AmiMessage(MessageKind kind, AmiFields fields, List<String> payload) {

    public static final String EVENT = "Event";
    public static final String RESPONSE = "Response";
    public static final String ACTION_ID = "ActionID";
    public static final String MESSAGE = "Message";

    public AmiMessage {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(fields, "fields");
        payload = List.copyOf(payload);
    }

    /**
     * Builds a message whose kind is derived from its fields.
     */
    public static AmiMessage of(AmiFields fields, List<String> payload) {
        MessageKind kind;
        if (fields.contains(EVENT)) {
            kind = MessageKind.EVENT;
        } else if (fields.contains(RESPONSE)) {
            kind = MessageKind.RESPONSE;
        } else {
            kind = MessageKind.UNKNOWN;
        }
        return new AmiMessage(kind, fields, payload);
    }

    public static AmiMessage of(AmiFields fields) {
        return of(fields, List.of());
    }

    public boolean isEvent() {
        return kind == MessageKind.EVENT;
    }

    public boolean isResponse() {
        return kind == MessageKind.RESPONSE;
    }

    public Optional<String> eventName() {
        return fields.first(EVENT);
    }

    public Optional<String> actionId() {
        return fields.first(ACTION_ID);
    }

    /**
     * The {@code Response} value, e.g. {@code Success}, {@code Error}, {@code Follows}.
     */
    public Optional<String> response() {
        return fields.first(RESPONSE);
    }

    /**
     * {@code true} for any response other than {@code Error}.
     */
    public boolean isSuccess() {
        return response().map(r -> !r.equalsIgnoreCase("Error")).orElse(false);
    }

    /**
     * The human-readable {@code Message} field, if present.
     */
    public Optional<String> message() {
        return fields.first(MESSAGE);
    }

    /**
     * Shorthand for {@code fields().first(name)}.
     */
    public Optional<String> get(String name) {
        return fields.first(name);
    }

    /**
     * Event name equality, ignoring case.
     */
    public boolean isEvent(String name) {
        return eventName().map(n -> n.equalsIgnoreCase(name)).orElse(false);
    }
}
