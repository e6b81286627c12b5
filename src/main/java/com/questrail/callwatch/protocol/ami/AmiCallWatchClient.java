package com.questrail.callwatch.protocol.ami;

import com.questrail.callwatch.api.ActionRejectedException;
import com.questrail.callwatch.api.ActionTimeoutException;
import com.questrail.callwatch.api.Call;
import com.questrail.callwatch.api.CallNotFoundException;
import com.questrail.callwatch.api.CallWatchClient;
import com.questrail.callwatch.api.ConnectionState;
import com.questrail.callwatch.api.ConnectionStateListener;
import com.questrail.callwatch.api.DisconnectedException;
import com.questrail.callwatch.api.Subscription;
import com.questrail.callwatch.protocol.ami.codec.impl.DefaultAmiActionEncoder;
import com.questrail.callwatch.protocol.ami.codec.impl.DefaultAmiFrameDecoder;
import com.questrail.callwatch.protocol.ami.config.AmiClientConfig;
import com.questrail.callwatch.protocol.ami.config.CallTrackingPolicy;
import com.questrail.callwatch.protocol.ami.config.ExtensionFilter;
import com.questrail.callwatch.protocol.ami.internal.decode.AmiMessageParser;
import com.questrail.callwatch.protocol.ami.internal.events.AmiEventRouter;
import com.questrail.callwatch.protocol.ami.internal.session.AmiSession;
import com.questrail.callwatch.protocol.ami.internal.session.SessionListener;
import com.questrail.callwatch.protocol.ami.internal.state.CallEventListener;
import com.questrail.callwatch.protocol.ami.internal.state.CallStateTracker;
import com.questrail.callwatch.protocol.ami.internal.time.Cancellable;
import com.questrail.callwatch.protocol.ami.internal.time.MonotonicClock;
import com.questrail.callwatch.protocol.ami.internal.time.MonotonicScheduler;
import com.questrail.callwatch.protocol.ami.internal.time.ScheduledExecutorScheduler;
import com.questrail.callwatch.protocol.ami.internal.time.SystemMonotonicClock;
import com.questrail.callwatch.protocol.ami.internal.time.SystemWallClock;
import com.questrail.callwatch.protocol.ami.internal.time.WallClock;
import com.questrail.callwatch.protocol.ami.model.AmiAction;
import com.questrail.callwatch.protocol.ami.model.AmiMessage;
import com.questrail.callwatch.protocol.ami.observability.AmiErrorEvent;
import com.questrail.callwatch.protocol.ami.observability.AmiObservabilitySink;
import com.questrail.callwatch.protocol.ami.observability.Slf4jAmiObservabilitySink;
import com.questrail.callwatch.protocol.ami.transport.StreamEndpoint;
import com.questrail.callwatch.protocol.ami.transport.tcp.netty.NettyTcpStreamEndpoint;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;

/**
 * AmiCallWatchClient
 * =============================================================================
 * Composition root and lifecycle owner for the manager-interface call watcher.
 *
 * <pre>
 *   StreamEndpoint → AmiSession → AmiFrameDecoder → AmiMessageParser
 *                                     ├─ responses → ActionCorrelator
 *                                     └─ events    → AmiEventRouter → CallStateTracker → handlers
 *
 *   hangup() → ActionCorrelator → AmiSession → StreamEndpoint
 * </pre>
 *
 * <p>Handlers registered through {@code onCall*} run on the read loop; a
 * throwing handler is reported to the observability sink and does not affect
 * other handlers or the stream.</p>
 */
public final class AmiCallWatchClient implements CallWatchClient
{
    private static final Duration SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final StreamEndpoint endpoint;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final AmiObservabilitySink sink;
    private final ScheduledExecutorService ownedExecutor;

    private final AmiEventRouter router;
    private final CallStateTracker tracker;
    private final AmiSession session;

    private final List<Consumer<Call>> startedHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Call>> answeredHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Call>> endedHandlers = new CopyOnWriteArrayList<>();
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();

    private volatile AmiClientConfig config;
    private volatile boolean closed;
    private Cancellable sweep;

    private AmiCallWatchClient(StreamEndpoint endpoint,
                               MonotonicClock clock,
                               MonotonicScheduler scheduler,
                               WallClock wallClock,
                               AmiObservabilitySink sink,
                               DoubleSupplier jitter,
                               ScheduledExecutorService ownedExecutor)
    {
        this.endpoint = endpoint;
        this.clock = clock;
        this.scheduler = scheduler;
        this.wallClock = wallClock;
        this.sink = sink;
        this.ownedExecutor = ownedExecutor;

        this.router = new AmiEventRouter(sink, wallClock);
        this.tracker = new CallStateTracker(new CallFanOut(), clock, wallClock, sink, CallTrackingPolicy.defaults());
        this.router.subscribe(tracker);
        this.session = new AmiSession(
                endpoint,
                new DefaultAmiFrameDecoder(),
                new AmiMessageParser(),
                new DefaultAmiActionEncoder(),
                router,
                clock,
                scheduler,
                wallClock,
                jitter,
                new SessionEvents(),
                sink);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Connection lifecycle
    // ---------------------------------------------------------------------

    /**
     * Connect and log in.
     *
     * <p>Network failures never fail the returned future; they show up as
     * {@link ConnectionState#RECONNECTING} while the session retries.</p>
     *
     * @return completes on first successful login; fails with
     *         {@link com.questrail.callwatch.api.AuthenticationException},
     *         {@link com.questrail.callwatch.api.ReconnectExhaustedException},
     *         or {@link DisconnectedException} if {@link #disconnect()} comes first
     * @throws IllegalStateException if already connecting or connected, or closed
     */
    public synchronized CompletableFuture<Void> connect(AmiClientConfig config)
    {
        Objects.requireNonNull(config, "config");
        if (closed) {
            throw new IllegalStateException("Client has been closed");
        }
        ConnectionState current = session.state();
        if (current != ConnectionState.DISCONNECTED) {
            throw new IllegalStateException("Client is already " + current);
        }

        this.config = config;
        tracker.applyPolicy(config.callTrackingPolicy());
        startSweep();
        return session.connect(config);
    }

    @Override
    public void disconnect()
    {
        session.disconnect();
    }

    @Override
    public void close()
    {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (sweep != null) {
                sweep.cancel();
                sweep = null;
            }
        }

        session.disconnect();
        endpoint.shutdown();

        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public ConnectionState connectionState()
    {
        return session.state();
    }

    /**
     * Server banner from the current connection, once received.
     */
    public Optional<String> greeting()
    {
        return Optional.ofNullable(session.greeting());
    }

    // ---------------------------------------------------------------------
    // Subscriptions
    // ---------------------------------------------------------------------

    @Override
    public Subscription onCallStarted(Consumer<Call> handler)
    {
        return register(startedHandlers, handler);
    }

    @Override
    public Subscription onCallAnswered(Consumer<Call> handler)
    {
        return register(answeredHandlers, handler);
    }

    @Override
    public Subscription onCallEnded(Consumer<Call> handler)
    {
        return register(endedHandlers, handler);
    }

    @Override
    public Subscription onConnectionStateChanged(ConnectionStateListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        stateListeners.add(listener);
        return () -> stateListeners.remove(listener);
    }

    private static Subscription register(List<Consumer<Call>> handlers, Consumer<Call> handler)
    {
        Objects.requireNonNull(handler, "handler");
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    // ---------------------------------------------------------------------
    // Queries and commands
    // ---------------------------------------------------------------------

    @Override
    public List<Call> listActiveCalls()
    {
        return tracker.activeCalls();
    }

    @Override
    public Optional<Call> findCall(String callId)
    {
        Objects.requireNonNull(callId, "callId");
        return tracker.find(callId);
    }

    /**
     * Replace the set of monitored extensions. Calls already in progress are
     * followed to their end.
     */
    public void updateMonitoredExtensions(ExtensionFilter filter)
    {
        tracker.setExtensionFilter(Objects.requireNonNull(filter, "filter"));
    }

    @Override
    public CompletableFuture<Void> hangup(String callId)
    {
        Objects.requireNonNull(callId, "callId");

        Optional<Call> call = tracker.findActive(callId);
        if (call.isEmpty()) {
            return CompletableFuture.failedFuture(new CallNotFoundException(callId));
        }
        if (session.state() != ConnectionState.CONNECTED) {
            return CompletableFuture.failedFuture(
                    new DisconnectedException("Cannot hang up " + callId + " while " + session.state()));
        }

        AmiClientConfig cfg = config;
        int retries = cfg == null || cfg.retryHangupOnTimeout() ? 1 : 0;
        return sendHangup(callId, call.get().channel(), retries);
    }

    private CompletableFuture<Void> sendHangup(String callId, String channel, int retriesLeft)
    {
        CompletableFuture<Void> result = new CompletableFuture<>();
        AmiAction action = AmiAction.named("Hangup").field("Channel", channel).build();

        session.submit(action).whenComplete((response, error) -> {
            if (error == null) {
                completeHangup(result, response);
                return;
            }

            Throwable cause = unwrap(error);
            if (!(cause instanceof ActionTimeoutException) || retriesLeft <= 0) {
                result.completeExceptionally(cause);
                return;
            }

            // Re-resolve: the channel may have been renamed, or the call may be gone.
            Optional<Call> again = tracker.findActive(callId);
            if (again.isEmpty()) {
                result.complete(null);
                return;
            }
            sendHangup(callId, again.get().channel(), retriesLeft - 1).whenComplete((v, retryError) -> {
                if (retryError == null) {
                    result.complete(null);
                } else {
                    result.completeExceptionally(unwrap(retryError));
                }
            });
        });
        return result;
    }

    private static void completeHangup(CompletableFuture<Void> result, AmiMessage response)
    {
        if (response.isSuccess()) {
            result.complete(null);
        } else {
            result.completeExceptionally(
                    new ActionRejectedException("Hangup", response.message().orElse("no reason given")));
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void startSweep()
    {
        if (sweep == null) {
            sweep = scheduler.scheduleAfter(SWEEP_INTERVAL, clock, this::runSweep);
        }
    }

    private void runSweep()
    {
        tracker.purgeExpired();
        synchronized (this) {
            if (!closed) {
                sweep = scheduler.scheduleAfter(SWEEP_INTERVAL, clock, this::runSweep);
            }
        }
    }

    private void deliver(List<Consumer<Call>> handlers, Call call)
    {
        for (Consumer<Call> handler : handlers) {
            try {
                handler.accept(call);
            }
            catch (RuntimeException e) {
                sink.onError(new AmiErrorEvent(wallClock.now(), "Call handler failed for " + call.callId(), e));
            }
        }
    }

    private static Throwable unwrap(Throwable t)
    {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private final class CallFanOut implements CallEventListener
    {
        @Override
        public void onCallStarted(Call call)
        {
            deliver(startedHandlers, call);
        }

        @Override
        public void onCallAnswered(Call call)
        {
            deliver(answeredHandlers, call);
        }

        @Override
        public void onCallEnded(Call call)
        {
            deliver(endedHandlers, call);
        }
    }

    private final class SessionEvents implements SessionListener
    {
        @Override
        public void onStateChanged(ConnectionState oldState, ConnectionState newState)
        {
            for (ConnectionStateListener l : stateListeners) {
                try {
                    l.onConnectionStateChanged(oldState, newState);
                }
                catch (RuntimeException e) {
                    sink.onError(new AmiErrorEvent(wallClock.now(), "Connection state listener failed", e));
                }
            }
        }

        @Override
        public void onConnectionLost()
        {
            tracker.onConnectionLost(wallClock.now());
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder
    {
        private StreamEndpoint endpoint;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private AmiObservabilitySink observabilitySink = new Slf4jAmiObservabilitySink();
        private DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();

        /**
         * Transport to use; defaults to {@link NettyTcpStreamEndpoint}.
         */
        public Builder withEndpoint(StreamEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Scheduler for timeouts, keep-alive, backoff and purging. When absent
         * the client creates (and on {@link #close()} shuts down) its own
         * single-thread executor.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withObservabilitySink(AmiObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Source of uniform samples in [0, 1) for backoff jitter.
         */
        public Builder withJitterSource(DoubleSupplier jitterSource) {
            this.jitterSource = jitterSource;
            return this;
        }

        public AmiCallWatchClient build() {
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(jitterSource, "jitterSource");

            ScheduledExecutorService owned = null;
            MonotonicScheduler sched = scheduler;
            if (sched == null) {
                owned = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "callwatch-scheduler");
                    t.setDaemon(true);
                    return t;
                });
                sched = new ScheduledExecutorScheduler(owned, clock);
            }

            StreamEndpoint ep = endpoint != null ? endpoint : new NettyTcpStreamEndpoint();
            return new AmiCallWatchClient(ep, clock, sched, wallClock, observabilitySink, jitterSource, owned);
        }
    }
}
