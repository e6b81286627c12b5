package com.questrail.callwatch.protocol.ami.internal.action;

import com.questrail.callwatch.api.ActionTimeoutException;
import com.questrail.callwatch.api.DisconnectedException;
import com.questrail.callwatch.protocol.ami.model.AmiAction;
import com.questrail.callwatch.protocol.ami.model.AmiFields;
import com.questrail.callwatch.protocol.ami.model.AmiMessage;
import com.questrail.callwatch.protocol.ami.observability.AmiProtocolObservabilityEvent;
import com.questrail.callwatch.protocol.ami.observability.RecordingObservabilitySink;
import com.questrail.callwatch.protocol.ami.time.DeterministicScheduler;
import com.questrail.callwatch.protocol.ami.time.ManualMonotonicClock;
import com.questrail.callwatch.protocol.ami.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ActionCorrelatorTest
 * -----------------------------------------------------------------------------
 * Correlation table behavior: id generation, exact matching, timeout expiry,
 * bulk failure and send failure.
 */
class ActionCorrelatorTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private List<AmiAction> sent;
    private boolean connected;
    private ActionCorrelator correlator;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        sent = Collections.synchronizedList(new ArrayList<>());
        connected = true;
        correlator = new ActionCorrelator(
                action -> connected && sent.add(action),
                scheduler,
                clock,
                new ManualWallClock(Instant.parse("2024-01-01T00:00:00Z")),
                sink,
                Duration.ofSeconds(5),
                "t");
    }

    @Test
    void tagsEachActionWithAFreshId() {
        correlator.submit(ping());
        correlator.submit(ping());

        assertEquals("t-1", sent.get(0).get("ActionID").orElseThrow());
        assertEquals("t-2", sent.get(1).get("ActionID").orElseThrow());
        assertEquals(2, correlator.pendingCount());
    }

    @Test
    void responseResolvesOnlyTheMatchingAction() throws Exception {
        CompletableFuture<AmiMessage> first = correlator.submit(ping());
        CompletableFuture<AmiMessage> second = correlator.submit(ping());

        assertTrue(correlator.resolve(response("t-2", "Success")));

        assertFalse(first.isDone());
        assertEquals("t-2", second.get().actionId().orElseThrow());
        assertTrue(correlator.isPending("t-1"));
        assertFalse(correlator.isPending("t-2"));
    }

    @Test
    void prefixOfAnotherIdDoesNotMatch() {
        CompletableFuture<AmiMessage> f = correlator.submit(ping());

        assertFalse(correlator.resolve(response("t-10", "Success")));
        assertFalse(correlator.resolve(response("t", "Success")));
        assertFalse(f.isDone());
    }

    @Test
    void unmatchedResponseIsReportedAndIgnored() {
        assertFalse(correlator.resolve(response("nobody", "Success")));

        var events = sink.eventsOfType(AmiProtocolObservabilityEvent.UnmatchedResponse.class);
        assertEquals(1, events.size());
        assertEquals("nobody", events.get(0).actionId());
    }

    @Test
    void errorResponseStillCompletesNormally() throws Exception {
        CompletableFuture<AmiMessage> f = correlator.submit(ping());

        correlator.resolve(response("t-1", "Error"));

        assertFalse(f.get().isSuccess());
    }

    @Test
    void expiresAfterTimeoutAndLateResponseIsDiscarded() {
        CompletableFuture<AmiMessage> f = correlator.submit(hangup(), Duration.ofSeconds(5));

        clock.advanceMillis(4_999);
        scheduler.runDueTasks();
        assertFalse(f.isDone());

        clock.advanceMillis(1);
        scheduler.runDueTasks();

        ExecutionException ex = assertThrows(ExecutionException.class, f::get);
        ActionTimeoutException timeout = assertInstanceOf(ActionTimeoutException.class, ex.getCause());
        assertEquals("Hangup", timeout.action());
        assertEquals("t-1", timeout.actionId());
        assertEquals(0, correlator.pendingCount());
        assertTrue(sink.hasEventOfType(AmiProtocolObservabilityEvent.ActionTimedOut.class));

        assertFalse(correlator.resolve(response("t-1", "Success")));
    }

    @Test
    void defaultTimeoutApplies() {
        correlator.setDefaultTimeout(Duration.ofSeconds(2));
        CompletableFuture<AmiMessage> f = correlator.submit(ping());

        clock.advanceMillis(2_000);
        scheduler.runDueTasks();

        assertTrue(f.isCompletedExceptionally());
    }

    @Test
    void resolutionCancelsTheTimer() {
        CompletableFuture<AmiMessage> f = correlator.submit(ping());
        correlator.resolve(response("t-1", "Success"));

        clock.advanceMillis(10_000);
        scheduler.runDueTasks();

        assertFalse(f.isCompletedExceptionally());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void failAllFailsEveryPendingAction() {
        CompletableFuture<AmiMessage> a = correlator.submit(ping());
        CompletableFuture<AmiMessage> b = correlator.submit(hangup());

        int failed = correlator.failAll(new DisconnectedException("gone"));

        assertEquals(2, failed);
        assertEquals(0, correlator.pendingCount());
        for (CompletableFuture<AmiMessage> f : List.of(a, b)) {
            ExecutionException ex = assertThrows(ExecutionException.class, f::get);
            assertInstanceOf(DisconnectedException.class, ex.getCause());
        }
    }

    @Test
    void sendFailureFailsImmediately() {
        connected = false;

        CompletableFuture<AmiMessage> f = correlator.submit(ping());

        ExecutionException ex = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(DisconnectedException.class, ex.getCause());
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void concurrentSubmissionsGetDistinctIds() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        correlator.submit(ping());
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        Set<String> ids = new HashSet<>();
        synchronized (sent) {
            for (AmiAction a : sent) {
                ids.add(a.get("ActionID").orElseThrow());
            }
        }
        assertEquals(threads * perThread, ids.size());
        assertEquals(threads * perThread, correlator.pendingCount());
    }

    @Test
    void concurrentSubmissionsEachResolveWithTheirOwnResponse() throws Exception {
        int threads = 6;
        int perThread = 200;
        int total = threads * perThread;

        BlockingQueue<AmiAction> wire = new LinkedBlockingQueue<>();
        ThreadLocal<String> lastId = new ThreadLocal<>();
        ActionCorrelator shared = new ActionCorrelator(
                action -> {
                    lastId.set(action.get("ActionID").orElseThrow());
                    return wire.add(action);
                },
                scheduler,
                clock,
                new ManualWallClock(Instant.parse("2024-01-01T00:00:00Z")),
                sink,
                Duration.ofSeconds(5),
                "c");

        Map<String, CompletableFuture<AmiMessage>> byId = new ConcurrentHashMap<>();
        AtomicInteger resolved = new AtomicInteger();
        AtomicInteger misses = new AtomicInteger();

        Thread reader = new Thread(() -> {
            Random random = new Random(42);
            List<AmiAction> batch = new ArrayList<>();
            try {
                while (resolved.get() + misses.get() < total) {
                    AmiAction first = wire.poll(5, TimeUnit.SECONDS);
                    if (first == null) {
                        return;
                    }
                    batch.add(first);
                    wire.drainTo(batch);
                    Collections.shuffle(batch, random);
                    for (AmiAction a : batch) {
                        String id = a.get("ActionID").orElseThrow();
                        AmiMessage reply = AmiMessage.of(AmiFields.builder()
                                .add("Response", "Success")
                                .add("ActionID", id)
                                .add("Message", "pong " + id)
                                .build());
                        if (shared.resolve(reply)) {
                            resolved.incrementAndGet();
                        } else {
                            misses.incrementAndGet();
                        }
                    }
                    batch.clear();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "ami-reader");
        reader.start();

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        CompletableFuture<AmiMessage> f = shared.submit(ping());
                        byId.put(lastId.get(), f);
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        reader.join(10_000);
        assertFalse(reader.isAlive());

        assertEquals(total, byId.size());
        assertEquals(total, resolved.get());
        assertEquals(0, misses.get());
        for (Map.Entry<String, CompletableFuture<AmiMessage>> e : byId.entrySet()) {
            AmiMessage reply = e.getValue().get(1, TimeUnit.SECONDS);
            assertEquals(e.getKey(), reply.actionId().orElseThrow());
            assertEquals("pong " + e.getKey(), reply.get("Message").orElseThrow());
        }
        assertEquals(0, shared.pendingCount());
        assertEquals(0, scheduler.pendingCount());
    }

    private static AmiAction ping() {
        return AmiAction.named("Ping").build();
    }

    private static AmiAction hangup() {
        return AmiAction.named("Hangup").field("Channel", "PJSIP/101-00000001").build();
    }

    private static AmiMessage response(String actionId, String response) {
        return AmiMessage.of(AmiFields.builder()
                .add("Response", response)
                .add("ActionID", actionId)
                .build());
    }
}
