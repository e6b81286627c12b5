package com.questrail.callwatch.protocol.ami.internal.events;

import com.questrail.callwatch.api.Subscription;
import com.questrail.callwatch.protocol.ami.internal.time.WallClock;
import com.questrail.callwatch.protocol.ami.model.AmiMessage;
import com.questrail.callwatch.protocol.ami.observability.AmiErrorEvent;
import com.questrail.callwatch.protocol.ami.observability.AmiObservabilitySink;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * AmiEventRouter
 * -----------------------------------------------------------------------------
 * Fans every inbound event out to all subscribed {@link AmiEventHandler}s.
 *
 * <ul>
 *   <li>Events are delivered in the order {@link #dispatch} is called, which is
 *       wire order when called from the read loop.</li>
 *   <li>Nothing is filtered, dropped or de-duplicated here.</li>
 *   <li>Responses are not routed; they belong to the correlator.</li>
 *   <li>A throwing handler is reported to the sink; the remaining handlers
 *       still receive the event.</li>
 * </ul>
 *
 * Subscribing and unsubscribing are safe from any thread, including from inside
 * a handler; such changes take effect from the next event.
 */
public final class AmiEventRouter
{
    private final List<AmiEventHandler> handlers = new CopyOnWriteArrayList<>();
    private final AmiObservabilitySink sink;
    private final WallClock wallClock;

    public AmiEventRouter(AmiObservabilitySink sink, WallClock wallClock)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public Subscription subscribe(AmiEventHandler handler)
    {
        Objects.requireNonNull(handler, "handler");
        handlers.add(handler);
        return () -> unsubscribe(handler);
    }

    public boolean unsubscribe(AmiEventHandler handler)
    {
        return handlers.remove(handler);
    }

    public int handlerCount()
    {
        return handlers.size();
    }

    public void dispatch(AmiMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (!message.isEvent()) {
            return;
        }

        for (AmiEventHandler handler : handlers) {
            try {
                handler.onEvent(message);
            }
            catch (RuntimeException e) {
                sink.onError(new AmiErrorEvent(wallClock.now(),
                        "Event handler failed on " + message.eventName().orElse("?"), e));
            }
        }
    }
}
