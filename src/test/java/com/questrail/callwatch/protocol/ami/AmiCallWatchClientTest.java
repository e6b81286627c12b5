package com.questrail.callwatch.protocol.ami;

import com.questrail.callwatch.api.ActionRejectedException;
import com.questrail.callwatch.api.ActionTimeoutException;
import com.questrail.callwatch.api.Call;
import com.questrail.callwatch.api.CallNotFoundException;
import com.questrail.callwatch.api.CallState;
import com.questrail.callwatch.api.ConnectionState;
import com.questrail.callwatch.api.EndCause;
import com.questrail.callwatch.api.Subscription;
import com.questrail.callwatch.protocol.ami.config.AmiClientConfig;
import com.questrail.callwatch.protocol.ami.config.ExtensionFilter;
import com.questrail.callwatch.protocol.ami.observability.RecordingObservabilitySink;
import com.questrail.callwatch.protocol.ami.time.DeterministicScheduler;
import com.questrail.callwatch.protocol.ami.time.ManualMonotonicClock;
import com.questrail.callwatch.protocol.ami.time.ManualWallClock;
import com.questrail.callwatch.protocol.ami.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AmiCallWatchClientTest
 * -----------------------------------------------------------------------------
 * End-to-end through the composed client: bytes in from a scripted endpoint,
 * call notifications out, hang-up commands back over the wire.
 */
final class AmiCallWatchClientTest {

    private static final String UID = "1714554000.42";
    private static final String CHANNEL = "PJSIP/101-0000002a";

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private FakeStreamEndpoint endpoint;
    private AmiCallWatchClient client;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        endpoint = new FakeStreamEndpoint();
        client = AmiCallWatchClient.builder()
                .withEndpoint(endpoint)
                .withClock(clock)
                .withWallClock(new ManualWallClock(Instant.parse("2024-05-01T09:00:00Z")))
                .withScheduler(scheduler)
                .withObservabilitySink(sink)
                .withJitterSource(() -> 0.5)
                .build();
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private static AmiClientConfig.Builder config() {
        return AmiClientConfig.builder()
                .withHost("pbx.example.net")
                .withUsername("callwatch")
                .withSecret("s3cret")
                .withExtensions(ExtensionFilter.of("101"));
    }

    private void connect(AmiClientConfig config) {
        CompletableFuture<Void> f = client.connect(config);
        endpoint.acceptConnection();
        endpoint.inject("Asterisk Call Manager/5.0.1\r\n");
        reply("Success", "Authentication accepted");
        assertTrue(f.isDone());
        endpoint.clearSent();
    }

    private void reply(String response, String message) {
        String id = FakeStreamEndpoint.actionIdOf(endpoint.lastSent());
        endpoint.inject("Response: " + response + "\r\nActionID: " + id + "\r\nMessage: " + message + "\r\n\r\n");
    }

    private void advance(Duration d) {
        clock.advance(d);
        scheduler.runDueTasks();
    }

    private void ring() {
        endpoint.inject("Event: Newchannel\r\nChannel: " + CHANNEL + "\r\nChannelState: 5\r\n"
                + "ChannelStateDesc: Ringing\r\nCallerIDNum: 101\r\nConnectedLineNum: 0612345678\r\n"
                + "ConnectedLineName: Dana\r\nUniqueid: " + UID + "\r\nLinkedid: " + UID + "\r\n\r\n");
    }

    private void answer() {
        endpoint.inject("Event: Newstate\r\nChannel: " + CHANNEL + "\r\nChannelState: 6\r\n"
                + "ChannelStateDesc: Up\r\nUniqueid: " + UID + "\r\n\r\n");
    }

    private void hangupEvent(String cause) {
        endpoint.inject("Event: Hangup\r\nChannel: " + CHANNEL + "\r\nUniqueid: " + UID
                + "\r\nCause: " + cause + "\r\nCause-txt: Normal Clearing\r\n\r\n");
    }

    // ---------------------------------------------------------------------
    // Notifications
    // ---------------------------------------------------------------------

    @Test
    void callLifecycleReachesSubscribers() {
        List<String> seen = new ArrayList<>();
        client.onCallStarted(c -> seen.add("started " + c.callerIdNumber().orElse("?")));
        client.onCallAnswered(c -> seen.add("answered"));
        client.onCallEnded(c -> seen.add("ended " + c.endCause().orElseThrow()));
        connect(config().build());

        ring();
        assertEquals(1, client.listActiveCalls().size());
        answer();
        hangupEvent("16");

        assertEquals(List.of("started 0612345678", "answered", "ended normal clearing"), seen);
        assertTrue(client.listActiveCalls().isEmpty());
        assertEquals(CallState.ENDED, client.findCall(UID).orElseThrow().state());
    }

    @Test
    void throwingSubscriberDoesNotAffectOthers() {
        List<Call> seen = new ArrayList<>();
        client.onCallStarted(c -> { throw new IllegalStateException("ui thread gone"); });
        client.onCallStarted(seen::add);
        connect(config().build());

        ring();

        assertEquals(1, seen.size());
        assertEquals(1, sink.errors().size());
        assertEquals(ConnectionState.CONNECTED, client.connectionState());
    }

    @Test
    void unsubscribedHandlerIsNotCalled() {
        List<Call> seen = new ArrayList<>();
        Subscription sub = client.onCallStarted(seen::add);
        connect(config().build());

        sub.unsubscribe();
        ring();

        assertTrue(seen.isEmpty());
    }

    @Test
    void connectionStateChangesAreReported() {
        List<ConnectionState> states = new ArrayList<>();
        client.onConnectionStateChanged((from, to) -> states.add(to));

        connect(config().build());
        endpoint.drop(null);

        assertEquals(List.of(ConnectionState.CONNECTING, ConnectionState.AUTHENTICATING,
                ConnectionState.CONNECTED, ConnectionState.RECONNECTING), states);
        assertEquals("Asterisk Call Manager/5.0.1", client.greeting().orElse(null));
    }

    @Test
    void connectionLossEndsOpenCalls() {
        List<Call> ended = new ArrayList<>();
        client.onCallEnded(ended::add);
        connect(config().build());
        ring();

        endpoint.drop(null);

        assertEquals(1, ended.size());
        assertEquals(EndCause.CONNECTION_LOST, ended.get(0).endCause().orElseThrow());
        assertTrue(client.listActiveCalls().isEmpty());
    }

    @Test
    void monitoredExtensionsCanChangeAtRuntime() {
        List<Call> seen = new ArrayList<>();
        client.onCallStarted(seen::add);
        connect(config().build());

        client.updateMonitoredExtensions(ExtensionFilter.of("202"));
        ring();

        assertTrue(seen.isEmpty());
    }

    @Test
    void endedCallsArePurgedBySweep() {
        connect(config().build());
        ring();
        hangupEvent("16");

        advance(Duration.ofSeconds(6));

        assertTrue(client.findCall(UID).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Hang-up
    // ---------------------------------------------------------------------

    @Test
    void hangupOfUnknownCallFailsWithoutSending() {
        connect(config().build());

        CompletableFuture<Void> f = client.hangup("nonexistent");

        ExecutionException ex = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(CallNotFoundException.class, ex.getCause());
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void hangupOfEndedCallFailsWithoutSending() {
        connect(config().build());
        ring();
        hangupEvent("16");

        CompletableFuture<Void> f = client.hangup(UID);

        ExecutionException ex = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(CallNotFoundException.class, ex.getCause());
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void hangupSendsTheCurrentChannelAndCompletesOnSuccess() throws Exception {
        connect(config().build());
        ring();
        answer();

        CompletableFuture<Void> f = client.hangup(UID);

        String sent = endpoint.lastSent();
        assertTrue(sent.startsWith("Action: Hangup\r\n"));
        assertTrue(sent.contains("Channel: " + CHANNEL + "\r\n"));
        assertFalse(f.isDone());

        reply("Success", "Channel Hungup");
        assertNull(f.get());
    }

    @Test
    void rejectedHangupCarriesTheServerMessage() {
        connect(config().build());
        ring();

        CompletableFuture<Void> f = client.hangup(UID);
        reply("Error", "No such channel");

        ExecutionException ex = assertThrows(ExecutionException.class, f::get);
        ActionRejectedException rejected = assertInstanceOf(ActionRejectedException.class, ex.getCause());
        assertEquals("No such channel", rejected.serverMessage());
    }

    @Test
    void timedOutHangupIsRetriedOnce() throws Exception {
        connect(config().build());
        ring();

        CompletableFuture<Void> f = client.hangup(UID);
        advance(Duration.ofSeconds(5));

        assertEquals(2, endpoint.sent().size());
        assertFalse(f.isDone());
        reply("Success", "Channel Hungup");
        assertNull(f.get());
    }

    @Test
    void hangupTimesOutAfterTheRetry() {
        connect(config().build());
        ring();

        CompletableFuture<Void> f = client.hangup(UID);
        advance(Duration.ofSeconds(5));
        advance(Duration.ofSeconds(5));

        ExecutionException ex = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(ActionTimeoutException.class, ex.getCause());
        assertEquals(2, endpoint.sent().size());
    }

    @Test
    void callEndingDuringTimeoutCountsAsSuccess() throws Exception {
        connect(config().build());
        ring();

        CompletableFuture<Void> f = client.hangup(UID);
        hangupEvent("16");
        advance(Duration.ofSeconds(5));

        assertNull(f.get());
        assertEquals(1, endpoint.sent().size());
    }

    @Test
    void retryCanBeDisabled() {
        connect(config().withRetryHangupOnTimeout(false).build());
        ring();

        CompletableFuture<Void> f = client.hangup(UID);
        advance(Duration.ofSeconds(5));

        ExecutionException ex = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(ActionTimeoutException.class, ex.getCause());
        assertEquals(1, endpoint.sent().size());
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Test
    void secondConnectIsRejectedWithoutTouchingTheLiveSettings() {
        List<Call> seen = new ArrayList<>();
        client.onCallStarted(seen::add);
        connect(config().withRetryHangupOnTimeout(false).build());

        AmiClientConfig other = config()
                .withExtensions(ExtensionFilter.all())
                .withRetryHangupOnTimeout(true)
                .build();
        assertThrows(IllegalStateException.class, () -> client.connect(other));
        assertEquals(ConnectionState.CONNECTED, client.connectionState());

        endpoint.inject("Event: Newchannel\r\nChannel: PJSIP/200-00000031\r\nChannelState: 5\r\n"
                + "ChannelStateDesc: Ringing\r\nCallerIDNum: 200\r\nConnectedLineNum: 0612345678\r\n"
                + "Uniqueid: x1\r\nLinkedid: x1\r\n\r\n");
        assertTrue(seen.isEmpty());

        ring();
        CompletableFuture<Void> f = client.hangup(UID);
        advance(Duration.ofSeconds(5));

        ExecutionException ex = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(ActionTimeoutException.class, ex.getCause());
        assertEquals(1, endpoint.sent().size());
    }

    @Test
    void closeShutsDownTheEndpointAndRejectsReuse() {
        connect(config().build());

        client.close();

        assertEquals(ConnectionState.DISCONNECTED, client.connectionState());
        assertTrue(endpoint.isShutdown());
        assertTrue(endpoint.lastSent().startsWith("Action: Logoff\r\n"));
        assertThrows(IllegalStateException.class, () -> client.connect(config().build()));
    }
}
