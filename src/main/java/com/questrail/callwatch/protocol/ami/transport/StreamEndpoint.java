package com.questrail.callwatch.protocol.ami.transport;

import java.time.Duration;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a connection-oriented byte stream (TCP-style).
 *
 * <p>The endpoint holds at most one connection at a time. Higher layers are
 * responsible for:</p>
 * <ul>
 *   <li>feeding inbound bytes into the framer</li>
 *   <li>deciding when to connect, reconnect and give up</li>
 *   <li>all protocol timing (login, keep-alive, action timeouts)</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, plain sockets, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Register the listener that receives inbound bytes and lifecycle events.
     *
     * <p>This must be called before {@link #connect}.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * Begin opening a connection. Returns immediately.
     *
     * <p>The outcome is reported exactly once: {@link StreamEndpointListener#onTransportUp()}
     * on success, or {@link StreamEndpointListener#onTransportDown(Throwable)} if
     * the attempt fails or times out.</p>
     */
    void connect(String host, int port, Duration timeout);

    /**
     * Write bytes to the current connection.
     *
     * @return {@code false} if there is no open connection; nothing was written
     */
    boolean send(byte[] payload);

    /**
     * Close the current connection, or abandon a pending connect.
     *
     * <p>A connection closed through this method MUST NOT be reported through
     * {@link StreamEndpointListener#onTransportDown(Throwable)}; only losses the
     * caller did not ask for are reported.</p>
     */
    void close();

    /**
     * Close any connection and release all resources. The endpoint cannot be
     * used afterwards.
     */
    void shutdown();
}
