package com.questrail.callwatch.protocol.ami.internal.session;

import com.questrail.callwatch.api.ActionTimeoutException;
import com.questrail.callwatch.api.AuthenticationException;
import com.questrail.callwatch.api.ConnectionState;
import com.questrail.callwatch.api.DisconnectedException;
import com.questrail.callwatch.api.ReconnectExhaustedException;
import com.questrail.callwatch.protocol.ami.codec.AmiActionEncoder;
import com.questrail.callwatch.protocol.ami.codec.AmiFrameDecoder;
import com.questrail.callwatch.protocol.ami.config.AmiClientConfig;
import com.questrail.callwatch.protocol.ami.config.KeepAlivePolicy;
import com.questrail.callwatch.protocol.ami.config.ReconnectPolicy;
import com.questrail.callwatch.protocol.ami.internal.action.ActionCorrelator;
import com.questrail.callwatch.protocol.ami.internal.decode.AmiMessageParser;
import com.questrail.callwatch.protocol.ami.internal.events.AmiEventRouter;
import com.questrail.callwatch.protocol.ami.internal.time.Cancellable;
import com.questrail.callwatch.protocol.ami.internal.time.MonotonicClock;
import com.questrail.callwatch.protocol.ami.internal.time.MonotonicScheduler;
import com.questrail.callwatch.protocol.ami.internal.time.WallClock;
import com.questrail.callwatch.protocol.ami.model.AmiAction;
import com.questrail.callwatch.protocol.ami.model.AmiMessage;
import com.questrail.callwatch.protocol.ami.observability.AmiErrorEvent;
import com.questrail.callwatch.protocol.ami.observability.AmiObservabilitySink;
import com.questrail.callwatch.protocol.ami.observability.AmiProtocolObservabilityEvent;
import com.questrail.callwatch.protocol.ami.observability.ConnectionStateTransitionEvent;
import com.questrail.callwatch.protocol.ami.transport.StreamEndpoint;
import com.questrail.callwatch.protocol.ami.transport.StreamEndpointListener;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.DoubleSupplier;

/**
 * AmiSession
 * =============================================================================
 * Owns one logical connection to the manager interface: connect, log in, keep
 * alive, detect loss, back off and reconnect.
 *
 * <h2>State machine</h2>
 * <pre>
 *   DISCONNECTED ─connect()─▶ CONNECTING ─transport up─▶ AUTHENTICATING ─login ok─▶ CONNECTED
 *        ▲                        │                            │                        │
 *        │                        └──── network failure ───────┴────────────────────────┤
 *        │                                                                              ▼
 *        ├──────── login rejected / attempts exhausted / disconnect() ─────────── RECONNECTING
 *        │                                                                              │
 *        └────────────────────────────────────────── backoff elapsed ─▶ CONNECTING ◀────┘
 * </pre>
 *
 * <h2>Failure classes</h2>
 * <ul>
 *   <li><b>Network</b> (refused, timeout, mid-session loss, keep-alive
 *       silence, login unanswered): retried with exponential backoff until
 *       {@link ReconnectPolicy#maxAttempts()} is exceeded.</li>
 *   <li><b>Authentication</b> ({@code Response: Error} to {@code Login}):
 *       terminal, never retried, surfaced as {@link AuthenticationException}.</li>
 * </ul>
 *
 * On every loss all pending actions fail with {@link DisconnectedException} and
 * the {@link SessionListener} is told so it can end open calls.
 *
 * <h2>Threading</h2>
 * Every state change happens under this object's monitor. Transport callbacks
 * arrive on the endpoint's I/O thread (the read loop); timers fire on the
 * scheduler's thread. Callbacks scheduled for an earlier connection are
 * recognized by a generation number and ignored.
 */
public final class AmiSession implements StreamEndpointListener
{
    private final StreamEndpoint endpoint;
    private final AmiFrameDecoder decoder;
    private final AmiMessageParser parser;
    private final AmiActionEncoder encoder;
    private final AmiEventRouter router;
    private final ActionCorrelator correlator;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final DoubleSupplier jitter;
    private final SessionListener listener;
    private final AmiObservabilitySink sink;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile String greeting;

    // Guarded by this.
    private AmiClientConfig config;
    private CompletableFuture<Void> connectFuture;
    private long generation;
    private int attempt;
    private boolean stopRequested;
    private Cancellable reconnectTimer;
    private Cancellable keepAliveTimer;
    private long lastActivityNanos;
    private long droppedReported;
    private Throwable lastFailure;

    public AmiSession(StreamEndpoint endpoint,
                      AmiFrameDecoder decoder,
                      AmiMessageParser parser,
                      AmiActionEncoder encoder,
                      AmiEventRouter router,
                      MonotonicClock clock,
                      MonotonicScheduler scheduler,
                      WallClock wallClock,
                      DoubleSupplier jitter,
                      SessionListener listener,
                      AmiObservabilitySink sink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.router = Objects.requireNonNull(router, "router");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.jitter = Objects.requireNonNull(jitter, "jitter");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.correlator = new ActionCorrelator(this::write, scheduler, clock, wallClock, sink,
                Duration.ofSeconds(5), "callwatch");
        endpoint.setListener(this);
    }

    // ---------------------------------------------------------------------
    // Public operations
    // ---------------------------------------------------------------------

    /**
     * Start connecting with {@code config}.
     *
     * @return completes when the session first reaches
     *         {@link ConnectionState#CONNECTED}; fails with
     *         {@link AuthenticationException}, {@link ReconnectExhaustedException},
     *         or {@link DisconnectedException} if {@link #disconnect()} comes first
     * @throws IllegalStateException if the session is not disconnected
     */
    public synchronized CompletableFuture<Void> connect(AmiClientConfig config)
    {
        Objects.requireNonNull(config, "config");
        if (state != ConnectionState.DISCONNECTED) {
            throw new IllegalStateException("Session is already " + state);
        }

        this.config = config;
        this.correlator.setDefaultTimeout(config.actionTimeout());
        this.stopRequested = false;
        this.attempt = 0;
        this.lastFailure = null;
        this.connectFuture = new CompletableFuture<>();

        CompletableFuture<Void> result = connectFuture;
        beginConnect("connect requested");
        return result;
    }

    /**
     * Graceful close. Sends {@code Logoff} when logged in, cancels any pending
     * reconnection and fails all pending actions. Safe to call in any state and
     * more than once.
     */
    public synchronized void disconnect()
    {
        stopRequested = true;
        cancelTimers();

        ConnectionState prior = state;
        if (prior == ConnectionState.DISCONNECTED) {
            return;
        }
        if (prior == ConnectionState.CONNECTED) {
            write(AmiAction.named("Logoff").build());
        }

        generation++;
        transition(ConnectionState.DISCONNECTED, "disconnect requested");
        endpoint.close();
        correlator.failAll(new DisconnectedException("Disconnected by request"));
        notifyConnectionLost();
        failConnectFuture(new DisconnectedException("Disconnected before the connection was established"));
    }

    /**
     * Submit an action through the correlator with the configured default timeout.
     */
    public CompletableFuture<AmiMessage> submit(AmiAction action)
    {
        return correlator.submit(action);
    }

    public CompletableFuture<AmiMessage> submit(AmiAction action, Duration timeout)
    {
        return correlator.submit(action, timeout);
    }

    public ConnectionState state()
    {
        return state;
    }

    /**
     * Banner the server sent when the current (or last) connection opened.
     */
    public String greeting()
    {
        return greeting;
    }

    public synchronized int reconnectAttempts()
    {
        return attempt;
    }

    public ActionCorrelator correlator()
    {
        return correlator;
    }

    // ---------------------------------------------------------------------
    // Transport callbacks (read loop)
    // ---------------------------------------------------------------------

    @Override
    public synchronized void onTransportUp()
    {
        if (state != ConnectionState.CONNECTING) {
            return;
        }

        lastActivityNanos = clock.nowNanos();
        transition(ConnectionState.AUTHENTICATING, "transport up");

        long gen = generation;
        AmiAction login = AmiAction.named("Login")
                .field("Username", config.username())
                .field("Secret", config.secret())
                .build();
        correlator.submit(login).whenComplete((response, error) -> onLoginResult(gen, response, error));
    }

    @Override
    public synchronized void onTransportDown(Throwable cause)
    {
        if (state == ConnectionState.DISCONNECTED || state == ConnectionState.RECONNECTING) {
            return;
        }
        String reason = cause == null
                ? "connection closed by server"
                : "transport failure: " + cause.getMessage();
        connectionLost(cause, reason);
    }

    @Override
    public synchronized void onBytes(byte[] chunk)
    {
        if (state == ConnectionState.DISCONNECTED || state == ConnectionState.RECONNECTING) {
            return;
        }
        lastActivityNanos = clock.nowNanos();

        List<List<String>> blocks = decoder.decode(chunk);

        long dropped = decoder.droppedBlocks();
        if (dropped > droppedReported) {
            droppedReported = dropped;
            sink.onProtocolEvent(new AmiProtocolObservabilityEvent.MalformedBlockDropped(wallClock.now(), dropped));
        }

        for (List<String> block : blocks) {
            try {
                handle(parser.parse(block));
            }
            catch (RuntimeException e) {
                sink.onError(new AmiErrorEvent(wallClock.now(), "Failed to process block " + block, e));
            }
        }
    }

    private void handle(AmiMessage message)
    {
        switch (message.kind()) {
            case RESPONSE -> correlator.resolve(message);
            case EVENT -> {
                if (message.isEvent("FullyBooted")) {
                    sink.onProtocolEvent(new AmiProtocolObservabilityEvent.ServerFullyBooted(
                            wallClock.now(), message.get("Status").orElse("")));
                }
                router.dispatch(message);
            }
            case UNKNOWN -> {
                if (!message.payload().isEmpty() && message.fields().isEmpty()) {
                    greeting = message.payload().get(0);
                    sink.onProtocolEvent(new AmiProtocolObservabilityEvent.GreetingReceived(wallClock.now(), greeting));
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Login
    // ---------------------------------------------------------------------

    private synchronized void onLoginResult(long gen, AmiMessage response, Throwable error)
    {
        if (gen != generation || state != ConnectionState.AUTHENTICATING) {
            return;
        }

        if (error != null) {
            Throwable cause = unwrap(error);
            connectionLost(cause, "login failed: " + cause.getMessage());
            return;
        }

        if (response.isSuccess()) {
            attempt = 0;
            lastFailure = null;
            transition(ConnectionState.CONNECTED, "login accepted");
            armKeepAlive(gen, config.keepAlivePolicy().idleThreshold());
            if (connectFuture != null) {
                connectFuture.complete(null);
            }
            return;
        }

        AuthenticationException rejected = new AuthenticationException(
                "Login rejected for " + config.username() + ": " + response.message().orElse("no reason given"));

        stopRequested = true;
        generation++;
        cancelTimers();
        endpoint.close();
        correlator.failAll(new DisconnectedException("Authentication failed", rejected));
        transition(ConnectionState.DISCONNECTED, "authentication failed");
        sink.onError(new AmiErrorEvent(wallClock.now(), rejected.getMessage(), rejected));
        failConnectFuture(rejected);
    }

    // ---------------------------------------------------------------------
    // Loss and reconnection
    // ---------------------------------------------------------------------

    private void connectionLost(Throwable cause, String reason)
    {
        generation++;
        cancelTimers();
        endpoint.close();
        lastFailure = cause;

        correlator.failAll(new DisconnectedException("Connection lost: " + reason, cause));
        notifyConnectionLost();

        if (stopRequested) {
            transition(ConnectionState.DISCONNECTED, reason);
            return;
        }
        scheduleReconnect(reason);
    }

    private void scheduleReconnect(String reason)
    {
        ReconnectPolicy policy = config.reconnectPolicy();
        attempt++;

        if (!policy.isUnlimited() && attempt > policy.maxAttempts()) {
            ReconnectExhaustedException exhausted = new ReconnectExhaustedException(attempt - 1, lastFailure);
            transition(ConnectionState.DISCONNECTED, "reconnect attempts exhausted");
            sink.onError(new AmiErrorEvent(wallClock.now(), exhausted.getMessage(), exhausted));
            failConnectFuture(exhausted);
            return;
        }

        Duration delay = policy.delayFor(attempt, jitter.getAsDouble());
        transition(ConnectionState.RECONNECTING, reason);
        sink.onProtocolEvent(new AmiProtocolObservabilityEvent.ReconnectScheduled(wallClock.now(), attempt, delay));

        long gen = generation;
        reconnectTimer = scheduler.scheduleAfter(delay, clock, () -> onReconnectTimer(gen));
    }

    private synchronized void onReconnectTimer(long gen)
    {
        if (gen != generation || state != ConnectionState.RECONNECTING || stopRequested) {
            return;
        }
        reconnectTimer = null;
        beginConnect("reconnect attempt " + attempt);
    }

    private void beginConnect(String reason)
    {
        generation++;
        transition(ConnectionState.CONNECTING, reason);
        decoder.reset();
        greeting = null;
        endpoint.connect(config.host(), config.port(), config.connectTimeout());
    }

    // ---------------------------------------------------------------------
    // Keep-alive
    // ---------------------------------------------------------------------

    private void armKeepAlive(long gen, Duration after)
    {
        keepAliveTimer = scheduler.scheduleAfter(after, clock, () -> onKeepAliveTimer(gen));
    }

    private synchronized void onKeepAliveTimer(long gen)
    {
        if (gen != generation || state != ConnectionState.CONNECTED) {
            return;
        }
        keepAliveTimer = null;

        KeepAlivePolicy policy = config.keepAlivePolicy();
        long idle = clock.nowNanos() - lastActivityNanos;
        long threshold = policy.idleThreshold().toNanos();
        if (idle < threshold) {
            armKeepAlive(gen, Duration.ofNanos(threshold - idle));
            return;
        }

        sink.onProtocolEvent(new AmiProtocolObservabilityEvent.KeepAlivePing(wallClock.now(), Duration.ofNanos(idle)));
        correlator.submit(AmiAction.named("Ping").build(), policy.responseGrace())
                .whenComplete((response, error) -> onPingResult(gen, error));
    }

    private synchronized void onPingResult(long gen, Throwable error)
    {
        if (gen != generation || state != ConnectionState.CONNECTED) {
            return;
        }
        if (error == null) {
            armKeepAlive(gen, config.keepAlivePolicy().idleThreshold());
            return;
        }

        Throwable cause = unwrap(error);
        String reason = cause instanceof ActionTimeoutException
                ? "keep-alive unanswered"
                : "keep-alive failed: " + cause.getMessage();
        connectionLost(cause, reason);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private synchronized boolean write(AmiAction action)
    {
        if (state != ConnectionState.AUTHENTICATING && state != ConnectionState.CONNECTED) {
            return false;
        }
        return endpoint.send(encoder.encode(action));
    }

    private void transition(ConnectionState next, String reason)
    {
        ConnectionState prior = state;
        if (prior == next) {
            return;
        }
        state = next;

        sink.onConnectionStateTransition(new ConnectionStateTransitionEvent(wallClock.now(), prior, next, reason));
        try {
            listener.onStateChanged(prior, next);
        }
        catch (RuntimeException e) {
            sink.onError(new AmiErrorEvent(wallClock.now(), "Session listener failed on " + prior + " -> " + next, e));
        }
    }

    private void notifyConnectionLost()
    {
        try {
            listener.onConnectionLost();
        }
        catch (RuntimeException e) {
            sink.onError(new AmiErrorEvent(wallClock.now(), "Session listener failed on connection loss", e));
        }
    }

    private void cancelTimers()
    {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
        if (keepAliveTimer != null) {
            keepAliveTimer.cancel();
            keepAliveTimer = null;
        }
    }

    private void failConnectFuture(Throwable cause)
    {
        if (connectFuture != null && !connectFuture.isDone()) {
            connectFuture.completeExceptionally(cause);
        }
    }

    static Throwable unwrap(Throwable t)
    {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
