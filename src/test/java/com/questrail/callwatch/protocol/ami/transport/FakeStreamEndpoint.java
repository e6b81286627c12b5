package com.questrail.callwatch.protocol.ami.transport;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeStreamEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamEndpoint} implementation.
 *
 * <p>Connection attempts are recorded and left pending until the test decides
 * their outcome with {@link #acceptConnection()} or {@link #refuse(Throwable)}.
 * Outbound writes are stored as text; inbound bytes are injected with
 * {@link #inject(String)}. Like a real endpoint, {@link #close()} never calls
 * back into the listener.</p>
 */
public final class FakeStreamEndpoint implements StreamEndpoint {

    public record ConnectAttempt(String host, int port, Duration timeout) {}

    private StreamEndpointListener listener;
    private final List<ConnectAttempt> attempts = new ArrayList<>();
    private final List<String> sent = new ArrayList<>();
    private boolean pending;
    private boolean open;
    private boolean shutdown;
    private int closeCount;

    @Override
    public void setListener(StreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void connect(String host, int port, Duration timeout) {
        if (shutdown) {
            throw new IllegalStateException("shut down");
        }
        attempts.add(new ConnectAttempt(host, port, timeout));
        pending = true;
        open = false;
    }

    @Override
    public synchronized boolean send(byte[] payload) {
        if (!open) {
            return false;
        }
        sent.add(new String(payload, StandardCharsets.UTF_8));
        return true;
    }

    @Override
    public synchronized void close() {
        pending = false;
        open = false;
        closeCount++;
    }

    @Override
    public synchronized void shutdown() {
        close();
        shutdown = true;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /** Completes the pending connect attempt successfully. */
    public void acceptConnection() {
        synchronized (this) {
            if (!pending) {
                throw new IllegalStateException("No pending connect attempt");
            }
            pending = false;
            open = true;
        }
        listener.onTransportUp();
    }

    /** Fails the pending connect attempt. */
    public void refuse(Throwable cause) {
        synchronized (this) {
            if (!pending) {
                throw new IllegalStateException("No pending connect attempt");
            }
            pending = false;
        }
        listener.onTransportDown(cause);
    }

    /** Simulates the server dropping an open connection. */
    public void drop(Throwable cause) {
        synchronized (this) {
            if (!open) {
                throw new IllegalStateException("No open connection");
            }
            open = false;
        }
        listener.onTransportDown(cause);
    }

    public void inject(String text) {
        inject(text.getBytes(StandardCharsets.UTF_8));
    }

    public void inject(byte[] bytes) {
        listener.onBytes(bytes);
    }

    public synchronized List<ConnectAttempt> attempts() {
        return Collections.unmodifiableList(new ArrayList<>(attempts));
    }

    public synchronized List<String> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized String lastSent() {
        if (sent.isEmpty()) {
            throw new IllegalStateException("Nothing sent");
        }
        return sent.get(sent.size() - 1);
    }

    public synchronized boolean isOpen() {
        return open;
    }

    public synchronized boolean hasPendingConnect() {
        return pending;
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    public synchronized int closeCount() {
        return closeCount;
    }

    public synchronized void clearSent() {
        sent.clear();
    }

    /**
     * Extracts the {@code ActionID} value from an encoded action block.
     */
    public static String actionIdOf(String encoded) {
        for (String line : encoded.split("\r\n")) {
            if (line.startsWith("ActionID: ")) {
                return line.substring("ActionID: ".length());
            }
        }
        throw new IllegalArgumentException("No ActionID in " + encoded);
    }
}
