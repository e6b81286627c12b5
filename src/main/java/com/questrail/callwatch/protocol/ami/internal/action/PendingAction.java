package com.questrail.callwatch.protocol.ami.internal.action;

import com.questrail.callwatch.protocol.ami.internal.time.Cancellable;
import com.questrail.callwatch.protocol.ami.model.AmiMessage;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * An in-flight action awaiting its response.
 *
 * <p>The expiry timer is attached after registration, so the entry is always
 * in the table before its timer can fire.</p>
 */
final class PendingAction
{
    private final String actionId;
    private final String action;
    private final long submittedAtNanos;
    private final Duration timeout;
    private final CompletableFuture<AmiMessage> result = new CompletableFuture<>();

    private volatile Cancellable timeoutTask;

    PendingAction(String actionId, String action, long submittedAtNanos, Duration timeout)
    {
        this.actionId = actionId;
        this.action = action;
        this.submittedAtNanos = submittedAtNanos;
        this.timeout = timeout;
    }

    String actionId() { return actionId; }

    String action() { return action; }

    long submittedAtNanos() { return submittedAtNanos; }

    Duration timeout() { return timeout; }

    CompletableFuture<AmiMessage> result() { return result; }

    void attachTimeout(Cancellable task)
    {
        this.timeoutTask = task;
    }

    void cancelTimeout()
    {
        Cancellable t = timeoutTask;
        if (t != null) {
            t.cancel();
        }
    }
}
