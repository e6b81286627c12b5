package com.questrail.callwatch.api;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * CallWatchClient
 * -----------------------------------------------------------------------------
 * Protocol-neutral surface through which a desktop application observes calls
 * on monitored extensions and issues hang-up commands.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Deliver call lifecycle notifications (started, answered, ended)</li>
 *   <li>Expose the current set of active calls as immutable snapshots</li>
 *   <li>Expose connection health through {@link ConnectionState}</li>
 *   <li>Accept hang-up commands for a specific call</li>
 * </ul>
 *
 * Connecting is protocol specific (credentials, endpoints) and therefore lives
 * on the implementation, not on this interface.
 *
 * <h2>Delivery guarantees</h2>
 * Notifications for a single call arrive in the order the server reported the
 * underlying events. No ordering is implied across different calls.
 * Handlers run on the client's read thread and must hand long work off to
 * another thread.
 *
 * <h2>Threading</h2>
 * All methods may be called from any thread.
 */
public interface CallWatchClient extends AutoCloseable
{
    Subscription onCallStarted(Consumer<Call> handler);

    Subscription onCallAnswered(Consumer<Call> handler);

    Subscription onCallEnded(Consumer<Call> handler);

    Subscription onConnectionStateChanged(ConnectionStateListener listener);

    /**
     * Requests that the server hang up the given call.
     * <p>
     * The returned future fails with {@link CallNotFoundException} if the call
     * is unknown or has already ended (nothing is sent in that case), with
     * {@link DisconnectedException} if the client is not connected, with
     * {@link ActionTimeoutException} if the server did not answer in time, or
     * with {@link ActionRejectedException} if the server refused.
     *
     * @param callId identifier from {@link Call#callId()}
     */
    CompletableFuture<Void> hangup(String callId);

    /**
     * Returns a copy of all calls that have not ended, in no guaranteed order.
     */
    List<Call> listActiveCalls();

    /**
     * Looks up a call, including calls that ended within the retention window.
     */
    Optional<Call> findCall(String callId);

    ConnectionState connectionState();

    /**
     * Gracefully closes the connection and cancels any pending reconnection.
     */
    void disconnect();

    /**
     * Disconnects and releases every thread and transport resource owned by the
     * client. The client cannot be reused afterwards.
     */
    @Override
    void close();
}
