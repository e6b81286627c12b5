package com.questrail.callwatch.protocol.ami.internal.state;

import com.questrail.callwatch.api.Call;
import com.questrail.callwatch.api.CallDirection;
import com.questrail.callwatch.api.CallState;
import com.questrail.callwatch.api.EndCause;
import com.questrail.callwatch.protocol.ami.config.CallTrackingPolicy;
import com.questrail.callwatch.protocol.ami.config.ExtensionFilter;
import com.questrail.callwatch.protocol.ami.internal.events.AmiEventHandler;
import com.questrail.callwatch.protocol.ami.internal.time.MonotonicClock;
import com.questrail.callwatch.protocol.ami.internal.time.WallClock;
import com.questrail.callwatch.protocol.ami.model.AmiMessage;
import com.questrail.callwatch.protocol.ami.observability.AmiErrorEvent;
import com.questrail.callwatch.protocol.ami.observability.AmiObservabilitySink;
import com.questrail.callwatch.protocol.ami.observability.CallTransitionEvent;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * CallStateTracker
 * =============================================================================
 * Reconstructs the lifecycle of calls on monitored extensions from the ordered
 * event stream.
 *
 * <h2>Identity</h2>
 * A call is keyed by the {@code Uniqueid} of the monitored extension's own
 * channel. The extension is the peer part of that channel's name; events on
 * {@code Local/} channels never create calls.
 *
 * <h2>Transitions</h2>
 * <pre>
 *   Newchannel/Newstate  state 5 (Ringing)                  → RINGING  inbound / internal
 *   Newchannel/Newstate  state 4 (Ring), originating context → RINGING  outbound / internal
 *   Newstate             state 6 (Up)                        → ANSWERED
 *   Hangup                                                   → ENDED
 * </pre>
 * Transitions only ever move forward. Events for unknown or already ended calls
 * that cannot start a call (answer, hangup, duplicates) are ignored.
 *
 * <h2>Retention</h2>
 * An ended call is reported first, then leaves the active set and stays
 * queryable through {@link #find(String)} until the grace window elapses and
 * {@link #purgeExpired()} removes it.
 *
 * <h2>Threading</h2>
 * All methods synchronize on this tracker. Listener callbacks run under that
 * lock, on the thread that delivered the event, so per-call order is preserved.
 */
public final class CallStateTracker implements AmiEventHandler
{
    private static final int STATE_RING = 4;
    private static final int STATE_RINGING = 5;
    private static final int STATE_UP = 6;
    private static final String UNKNOWN_MARKER = "<unknown>";

    private record EndedCall(Call call, long purgeAtNanos) {}

    private final CallEventListener listener;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final AmiObservabilitySink sink;

    private final Map<String, Call> active = new LinkedHashMap<>();
    private final Map<String, EndedCall> ended = new LinkedHashMap<>();

    private CallTrackingPolicy policy;
    private HangupCauseTable causes;

    public CallStateTracker(CallEventListener listener,
                            MonotonicClock clock,
                            WallClock wallClock,
                            AmiObservabilitySink sink,
                            CallTrackingPolicy policy)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        applyPolicy(policy);
    }

    // ---------------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------------

    public synchronized void applyPolicy(CallTrackingPolicy policy)
    {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.causes = new HangupCauseTable(policy.causeOverrides());
    }

    /**
     * Changes which extensions may start new calls. Calls already being tracked
     * are followed to their end regardless.
     */
    public synchronized void setExtensionFilter(ExtensionFilter filter)
    {
        this.policy = policy.withExtensions(filter);
    }

    public synchronized CallTrackingPolicy policy()
    {
        return policy;
    }

    // ---------------------------------------------------------------------
    // Event intake
    // ---------------------------------------------------------------------

    @Override
    public synchronized void onEvent(AmiMessage event)
    {
        String name = event.eventName().orElse("").toLowerCase(Locale.ROOT);
        switch (name) {
            case "newchannel", "newstate" -> onChannelState(event);
            case "newcallerid", "newconnectedline" -> onIdentity(event);
            case "rename" -> onRename(event);
            case "hangup" -> onHangup(event);
            default -> {
                // not call related
            }
        }
    }

    private void onChannelState(AmiMessage event)
    {
        String uid = event.get("Uniqueid").orElse(null);
        String channel = event.get("Channel").orElse(null);
        if (uid == null || channel == null) {
            return;
        }

        Call existing = active.get(uid);
        if (existing != null) {
            Call updated = withRemoteParty(existing, event);
            if (isState(event, STATE_UP, "Up") && updated.state() == CallState.RINGING) {
                Call answered = updated.answered(timestampOf(event));
                active.put(uid, answered);
                notify(existing, answered, "Newstate", listener::onCallAnswered);
            }
            else if (updated != existing) {
                active.put(uid, updated);
            }
            return;
        }

        if (ended.containsKey(uid)) {
            return;
        }

        Optional<String> extension = ChannelNames.peer(channel);
        if (extension.isEmpty() || !policy.extensions().accepts(extension.get())) {
            return;
        }
        String ext = extension.get();

        Call created;
        if (isState(event, STATE_RINGING, "Ringing")) {
            String[] remote = remoteParty(event, ext);
            created = Call.ringing(uid, event.get("Linkedid").orElse(null), channel, ext,
                    classify(remote[1]), timestampOf(event))
                .withCallerId(remote[0], remote[1]);
        }
        else if (isState(event, STATE_RING, "Ring") && isOriginatingContext(event)) {
            String dialed = usable(event.get("Exten").orElse(null), ext);
            if ("s".equals(dialed)) {
                dialed = null;
            }
            String[] remote = remoteParty(event, ext);
            String number = dialed != null ? dialed : remote[1];
            created = Call.ringing(uid, event.get("Linkedid").orElse(null), channel, ext,
                    classifyDialed(number), timestampOf(event))
                .withCallerId(dialed != null ? null : remote[0], number);
        }
        else {
            return;
        }

        active.put(uid, created);
        notify(null, created, event.eventName().orElse("?"), listener::onCallStarted);
    }

    private void onIdentity(AmiMessage event)
    {
        String uid = event.get("Uniqueid").orElse(null);
        Call existing = uid == null ? null : active.get(uid);
        if (existing == null) {
            return;
        }
        Call updated = withRemoteParty(existing, event);
        if (updated != existing) {
            active.put(uid, updated);
        }
    }

    private void onRename(AmiMessage event)
    {
        String uid = event.get("Uniqueid").orElse(null);
        String newName = event.get("Newname").orElse(null);
        Call existing = uid == null ? null : active.get(uid);
        if (existing == null || newName == null || newName.isBlank()) {
            return;
        }
        active.put(uid, existing.withChannel(newName));
    }

    private void onHangup(AmiMessage event)
    {
        String uid = event.get("Uniqueid").orElse(null);
        Call existing = uid == null ? null : active.get(uid);
        if (existing == null) {
            return;
        }

        Call updated = withRemoteParty(existing, event);
        EndCause cause = causes.classify(event.get("Cause").orElse(null));
        String detail = event.get("Cause-txt").filter(s -> !s.isBlank()).orElse(null);
        end(existing, updated.ended(timestampOf(event), cause, detail), "Hangup");
    }

    // ---------------------------------------------------------------------
    // Session lifecycle and queries
    // ---------------------------------------------------------------------

    /**
     * Ends every call that has not ended yet with {@link EndCause#CONNECTION_LOST}.
     *
     * @return number of calls ended
     */
    public synchronized int onConnectionLost(Instant now)
    {
        Objects.requireNonNull(now, "now");

        List<Call> open = new ArrayList<>(active.values());
        for (Call call : open) {
            end(call, call.ended(now, EndCause.CONNECTION_LOST, EndCause.CONNECTION_LOST.label()),
                    EndCause.CONNECTION_LOST.label());
        }
        return open.size();
    }

    /**
     * Drops ended calls whose grace window has elapsed.
     *
     * @return number of calls purged
     */
    public synchronized int purgeExpired()
    {
        long now = clock.nowNanos();
        int purged = 0;
        Iterator<EndedCall> it = ended.values().iterator();
        while (it.hasNext()) {
            if (it.next().purgeAtNanos() - now <= 0) {
                it.remove();
                purged++;
            }
        }
        return purged;
    }

    public synchronized List<Call> activeCalls()
    {
        List<Call> out = new ArrayList<>(active.size());
        for (Call call : active.values()) {
            if (!call.isEnded()) {
                out.add(call);
            }
        }
        return List.copyOf(out);
    }

    /**
     * Active call, or an ended call still inside its grace window.
     */
    public synchronized Optional<Call> find(String callId)
    {
        Call call = active.get(callId);
        if (call != null) {
            return Optional.of(call);
        }
        EndedCall e = ended.get(callId);
        return e == null ? Optional.empty() : Optional.of(e.call());
    }

    public synchronized Optional<Call> findActive(String callId)
    {
        Call call = active.get(callId);
        return call == null || call.isEnded() ? Optional.empty() : Optional.of(call);
    }

    public synchronized int retainedEndedCount()
    {
        return ended.size();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void end(Call before, Call after, String trigger)
    {
        String id = after.callId();
        active.put(id, after);
        notify(before, after, trigger, listener::onCallEnded);

        active.remove(id);
        ended.put(id, new EndedCall(after, clock.nowNanos() + policy.endedGrace().toNanos()));
    }

    private void notify(Call before, Call after, String trigger, Consumer<Call> callback)
    {
        sink.onCallTransition(new CallTransitionEvent(wallClock.now(), before, after, trigger));
        try {
            callback.accept(after);
        }
        catch (RuntimeException e) {
            sink.onError(new AmiErrorEvent(wallClock.now(),
                    "Call listener failed for " + after.callId() + " (" + after.state() + ")", e));
        }
    }

    private Call withRemoteParty(Call call, AmiMessage event)
    {
        String[] remote = remoteParty(event, call.extension());
        return call.withCallerId(remote[0], remote[1]);
    }

    /**
     * Picks the remote party's {name, number}: the connected line when it names
     * someone other than the extension itself, else the caller id.
     */
    private static String[] remoteParty(AmiMessage event, String extension)
    {
        String connectedNum = usable(event.get("ConnectedLineNum").orElse(null), extension);
        if (connectedNum != null) {
            return new String[] {
                usable(event.get("ConnectedLineName").orElse(null), extension), connectedNum
            };
        }
        String callerNum = usable(event.get("CallerIDNum").orElse(null), extension);
        if (callerNum != null) {
            return new String[] {
                usable(event.get("CallerIDName").orElse(null), extension), callerNum
            };
        }
        return new String[] { null, null };
    }

    private static String usable(String value, String extension)
    {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        if (v.isEmpty() || v.equalsIgnoreCase(UNKNOWN_MARKER) || v.equals(extension)) {
            return null;
        }
        return v;
    }

    private CallDirection classifyDialed(String number)
    {
        return number != null && policy.internalNumber().matcher(number).matches()
            ? CallDirection.INTERNAL
            : CallDirection.OUTBOUND;
    }

    private CallDirection classify(String remoteNumber)
    {
        if (remoteNumber == null) {
            return CallDirection.UNKNOWN;
        }
        return policy.internalNumber().matcher(remoteNumber).matches()
            ? CallDirection.INTERNAL
            : CallDirection.INBOUND;
    }

    private boolean isOriginatingContext(AmiMessage event)
    {
        return event.get("Context").map(policy.originatingContexts()::contains).orElse(false);
    }

    private static boolean isState(AmiMessage event, int code, String description)
    {
        boolean described = event.get("ChannelStateDesc").map(description::equalsIgnoreCase).orElse(false);
        Optional<String> state = event.get("ChannelState");
        if (state.isEmpty()) {
            return described;
        }
        try {
            return Integer.parseInt(state.get().trim()) == code;
        }
        catch (NumberFormatException e) {
            return described;
        }
    }

    private Instant timestampOf(AmiMessage event)
    {
        Optional<String> ts = event.get("Timestamp");
        if (ts.isPresent()) {
            try {
                BigDecimal seconds = new BigDecimal(ts.get().trim());
                long whole = seconds.longValue();
                long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
                return Instant.ofEpochSecond(whole, nanos);
            }
            catch (NumberFormatException | ArithmeticException | DateTimeException e) {
                return wallClock.now();
            }
        }
        return wallClock.now();
    }
}
