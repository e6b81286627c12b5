package com.questrail.callwatch.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Call
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one phone call as reconstructed from the server's
 * event stream.
 *
 * <h2>Ownership</h2>
 * Calls are produced exclusively by the call state tracker. Every lifecycle
 * notification and every query hands out a {@code Call} value; because the type
 * is immutable, a consumer can keep it without observing later changes.
 *
 * <h2>Timestamps</h2>
 * {@link #startedAt()} is always present. {@link #answeredAt()} and
 * {@link #endedAt()} are set at most once each and satisfy
 * {@code startedAt <= answeredAt <= endedAt} whenever present.
 *
 * <h2>Caller identity</h2>
 * Name and number are the latest non-empty values reported for the remote
 * party. Once set, a field is never cleared by a later event that omits it.
 */
public final class Call
{
    private final String callId;
    private final String linkedId;
    private final String channel;
    private final String extension;
    private final String callerIdName;
    private final String callerIdNumber;
    private final CallDirection direction;
    private final CallState state;
    private final Instant startedAt;
    private final Instant answeredAt;
    private final Instant endedAt;
    private final EndCause endCause;
    private final String endCauseDetail;

    private Call(String callId,
                 String linkedId,
                 String channel,
                 String extension,
                 String callerIdName,
                 String callerIdNumber,
                 CallDirection direction,
                 CallState state,
                 Instant startedAt,
                 Instant answeredAt,
                 Instant endedAt,
                 EndCause endCause,
                 String endCauseDetail)
    {
        this.callId = Objects.requireNonNull(callId, "callId");
        this.linkedId = linkedId;
        this.channel = Objects.requireNonNull(channel, "channel");
        this.extension = Objects.requireNonNull(extension, "extension");
        this.callerIdName = callerIdName;
        this.callerIdNumber = callerIdNumber;
        this.direction = Objects.requireNonNull(direction, "direction");
        this.state = Objects.requireNonNull(state, "state");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.answeredAt = answeredAt;
        this.endedAt = endedAt;
        this.endCause = endCause;
        this.endCauseDetail = endCauseDetail;
    }

    /**
     * Creates a newly observed call in {@link CallState#RINGING}.
     */
    public static Call ringing(String callId,
                               String linkedId,
                               String channel,
                               String extension,
                               CallDirection direction,
                               Instant startedAt)
    {
        return new Call(callId, linkedId, channel, extension, null, null,
                direction, CallState.RINGING, startedAt, null, null, null, null);
    }

    public String callId()
    {
        return callId;
    }

    /**
     * Server token shared by every channel of the same call, if reported.
     */
    public Optional<String> linkedId()
    {
        return Optional.ofNullable(linkedId);
    }

    /**
     * Latest known channel of the monitored leg.
     */
    public String channel()
    {
        return channel;
    }

    public String extension()
    {
        return extension;
    }

    public Optional<String> callerIdName()
    {
        return Optional.ofNullable(callerIdName);
    }

    public Optional<String> callerIdNumber()
    {
        return Optional.ofNullable(callerIdNumber);
    }

    public CallDirection direction()
    {
        return direction;
    }

    public CallState state()
    {
        return state;
    }

    public Instant startedAt()
    {
        return startedAt;
    }

    public Optional<Instant> answeredAt()
    {
        return Optional.ofNullable(answeredAt);
    }

    public Optional<Instant> endedAt()
    {
        return Optional.ofNullable(endedAt);
    }

    /**
     * Present once the call is {@link CallState#ENDED}.
     */
    public Optional<EndCause> endCause()
    {
        return Optional.ofNullable(endCause);
    }

    /**
     * Server-supplied cause text (e.g. {@code "Normal Clearing"}), if any.
     */
    public Optional<String> endCauseDetail()
    {
        return Optional.ofNullable(endCauseDetail);
    }

    public boolean isEnded()
    {
        return state == CallState.ENDED;
    }

    /**
     * An ended call that was never answered.
     */
    public boolean missed()
    {
        return state == CallState.ENDED && answeredAt == null;
    }

    /**
     * Time between answer and end, available once both are known.
     */
    public Optional<Duration> talkDuration()
    {
        if (answeredAt == null || endedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(answeredAt, endedAt));
    }

    // ---------------------------------------------------------------------
    // Transition helpers
    // ---------------------------------------------------------------------

    /**
     * Moves the call to {@link CallState#ANSWERED}. The answer time is clamped
     * so it never precedes {@link #startedAt()}.
     *
     * @throws IllegalStateException if the call is not ringing
     */
    public Call answered(Instant at)
    {
        requireAdvance(CallState.ANSWERED);
        Instant clamped = latest(startedAt, at);
        return new Call(callId, linkedId, channel, extension, callerIdName, callerIdNumber,
                direction, CallState.ANSWERED, startedAt, clamped, null, null, null);
    }

    /**
     * Moves the call to {@link CallState#ENDED}. The end time is clamped so it
     * never precedes the start or answer time.
     *
     * @throws IllegalStateException if the call has already ended
     */
    public Call ended(Instant at, EndCause cause, String causeDetail)
    {
        requireAdvance(CallState.ENDED);
        Objects.requireNonNull(cause, "cause");
        Instant floor = answeredAt != null ? answeredAt : startedAt;
        return new Call(callId, linkedId, channel, extension, callerIdName, callerIdNumber,
                direction, CallState.ENDED, startedAt, answeredAt, latest(floor, at), cause, causeDetail);
    }

    /**
     * Applies caller identity values. Blank values leave the existing field
     * untouched.
     */
    public Call withCallerId(String name, String number)
    {
        String newName = isBlank(name) ? callerIdName : name;
        String newNumber = isBlank(number) ? callerIdNumber : number;
        if (Objects.equals(newName, callerIdName) && Objects.equals(newNumber, callerIdNumber)) {
            return this;
        }
        return new Call(callId, linkedId, channel, extension, newName, newNumber,
                direction, state, startedAt, answeredAt, endedAt, endCause, endCauseDetail);
    }

    public Call withChannel(String newChannel)
    {
        Objects.requireNonNull(newChannel, "newChannel");
        if (newChannel.equals(channel)) {
            return this;
        }
        return new Call(callId, linkedId, newChannel, extension, callerIdName, callerIdNumber,
                direction, state, startedAt, answeredAt, endedAt, endCause, endCauseDetail);
    }

    private void requireAdvance(CallState next)
    {
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException("Call " + callId + " cannot move from " + state + " to " + next);
        }
    }

    private static Instant latest(Instant floor, Instant candidate)
    {
        return candidate.isBefore(floor) ? floor : candidate;
    }

    private static boolean isBlank(String s)
    {
        return s == null || s.isBlank();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Call other)) {
            return false;
        }
        return callId.equals(other.callId)
                && Objects.equals(linkedId, other.linkedId)
                && channel.equals(other.channel)
                && extension.equals(other.extension)
                && Objects.equals(callerIdName, other.callerIdName)
                && Objects.equals(callerIdNumber, other.callerIdNumber)
                && direction == other.direction
                && state == other.state
                && startedAt.equals(other.startedAt)
                && Objects.equals(answeredAt, other.answeredAt)
                && Objects.equals(endedAt, other.endedAt)
                && endCause == other.endCause
                && Objects.equals(endCauseDetail, other.endCauseDetail);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(callId, channel, state, startedAt, answeredAt, endedAt);
    }

    @Override
    public String toString()
    {
        return "Call{" + callId
                + ", ext=" + extension
                + ", channel=" + channel
                + ", caller=" + (callerIdName != null ? callerIdName : "unknown")
                + " <" + (callerIdNumber != null ? callerIdNumber : "unknown") + ">"
                + ", " + direction
                + ", " + state
                + (endCause != null ? ", cause=" + endCause : "")
                + '}';
    }
}
