package com.questrail.callwatch.protocol.ami.internal.action;

import com.questrail.callwatch.api.ActionTimeoutException;
import com.questrail.callwatch.api.DisconnectedException;
import com.questrail.callwatch.protocol.ami.internal.time.MonotonicClock;
import com.questrail.callwatch.protocol.ami.internal.time.MonotonicScheduler;
import com.questrail.callwatch.protocol.ami.internal.time.WallClock;
import com.questrail.callwatch.protocol.ami.model.AmiAction;
import com.questrail.callwatch.protocol.ami.model.AmiMessage;
import com.questrail.callwatch.protocol.ami.observability.AmiObservabilitySink;
import com.questrail.callwatch.protocol.ami.observability.AmiProtocolObservabilityEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ActionCorrelator
 * =============================================================================
 * Owns the table of in-flight actions and matches inbound responses to them.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Every submitted action gets a fresh {@code ActionID} of the form
 *       {@code <prefix>-<n>}; {@code n} never repeats for this instance.</li>
 *   <li>The pending entry is registered <em>before</em> the bytes are written,
 *       so a response that arrives immediately is never lost.</li>
 *   <li>A response resolves only the action whose id matches exactly.</li>
 *   <li>Expiry removes the entry and fails the caller with
 *       {@link ActionTimeoutException}. Nothing is retried here.</li>
 *   <li>{@link #failAll(Throwable)} fails every entry at once (session loss).</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Safe for concurrent {@link #submit} from any thread. Futures are completed on
 * the thread that resolves, expires, or fails them; callers that do real work
 * in a continuation should hop to their own executor.
 */
public final class ActionCorrelator
{
    private final ActionSender sender;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final AmiObservabilitySink sink;
    private final String idPrefix;

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, PendingAction> pending = new ConcurrentHashMap<>();

    private volatile Duration defaultTimeout;

    public ActionCorrelator(ActionSender sender,
                            MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            WallClock wallClock,
                            AmiObservabilitySink sink,
                            Duration defaultTimeout,
                            String idPrefix)
    {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.idPrefix = Objects.requireNonNull(idPrefix, "idPrefix");
        setDefaultTimeout(defaultTimeout);
    }

    public void setDefaultTimeout(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.defaultTimeout = timeout;
    }

    public Duration defaultTimeout()
    {
        return defaultTimeout;
    }

    public CompletableFuture<AmiMessage> submit(AmiAction action)
    {
        return submit(action, defaultTimeout);
    }

    /**
     * Tag, register and send one action.
     *
     * @return a future completed with the matching response (which may itself
     *         be {@code Response: Error}; interpreting it is the caller's job)
     */
    public CompletableFuture<AmiMessage> submit(AmiAction action, Duration timeout)
    {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timeout, "timeout");

        String actionId = idPrefix + "-" + sequence.incrementAndGet();
        AmiAction tagged = action.withActionId(actionId);

        long now = clock.nowNanos();
        PendingAction entry = new PendingAction(actionId, action.name(), now, timeout);
        CompletableFuture<AmiMessage> result = entry.result();
        pending.put(actionId, entry);
        entry.attachTimeout(scheduler.scheduleAtNanos(now + timeout.toNanos(), () -> expire(actionId)));

        boolean sent;
        try {
            sent = sender.send(tagged);
        }
        catch (RuntimeException e) {
            fail(entry, new DisconnectedException("Failed to send " + action.name(), e));
            return result;
        }

        if (!sent) {
            fail(entry, new DisconnectedException("Not connected; " + action.name() + " was not sent"));
        }
        return result;
    }

    /**
     * Offer an inbound response.
     *
     * @return {@code true} if it resolved a pending action
     */
    public boolean resolve(AmiMessage response)
    {
        Objects.requireNonNull(response, "response");

        String actionId = response.actionId().orElse(null);
        PendingAction entry = actionId == null ? null : pending.remove(actionId);
        if (entry == null) {
            sink.onProtocolEvent(new AmiProtocolObservabilityEvent.UnmatchedResponse(wallClock.now(), actionId));
            return false;
        }

        entry.cancelTimeout();
        entry.result().complete(response);
        return true;
    }

    /**
     * Fail every pending action with {@code cause}.
     *
     * @return number of actions failed
     */
    public int failAll(Throwable cause)
    {
        Objects.requireNonNull(cause, "cause");

        List<PendingAction> drained = new ArrayList<>(pending.values());
        int failed = 0;
        for (PendingAction entry : drained) {
            if (pending.remove(entry.actionId(), entry)) {
                entry.cancelTimeout();
                entry.result().completeExceptionally(cause);
                failed++;
            }
        }
        return failed;
    }

    public int pendingCount()
    {
        return pending.size();
    }

    public boolean isPending(String actionId)
    {
        return pending.containsKey(actionId);
    }

    private void expire(String actionId)
    {
        PendingAction entry = pending.get(actionId);
        if (entry == null || !pending.remove(actionId, entry)) {
            return;
        }

        sink.onProtocolEvent(new AmiProtocolObservabilityEvent.ActionTimedOut(
                wallClock.now(), entry.action(), actionId, entry.timeout()));
        entry.result().completeExceptionally(
                new ActionTimeoutException(entry.action(), actionId, entry.timeout()));
    }

    private void fail(PendingAction entry, Throwable cause)
    {
        if (pending.remove(entry.actionId(), entry)) {
            entry.cancelTimeout();
            entry.result().completeExceptionally(cause);
        }
    }
}
