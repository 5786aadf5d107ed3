package express.mvp.mcpr.transport.connection;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.mcpr.transport.ScriptedTransport;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.codec.JsonMessageCodec;
import express.mvp.mcpr.transport.config.EndpointConfig;
import express.mvp.mcpr.transport.config.HeartbeatConfig;
import express.mvp.mcpr.transport.config.TransportConfig;
import express.mvp.mcpr.transport.error.CallTimeoutException;
import express.mvp.mcpr.transport.error.ConnectionClosedException;
import express.mvp.mcpr.transport.error.ConnectionResetException;
import express.mvp.mcpr.transport.error.FrameRejectedException;
import express.mvp.mcpr.transport.error.ReconnectExhaustedException;
import express.mvp.mcpr.transport.error.ReconnectPolicy;
import express.mvp.mcpr.transport.lifecycle.ConnectionState;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.Notification;
import express.mvp.mcpr.transport.message.Request;
import express.mvp.mcpr.transport.message.RequestId;
import express.mvp.mcpr.transport.message.Response;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Lifecycle tests for {@link ConnectionManager} over a scripted transport. */
@DisplayName("ConnectionManager")
class ConnectionManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final ScriptedTransport transport = new ScriptedTransport();
    private final List<String> transitions = new CopyOnWriteArrayList<>();
    private final BlockingQueue<Message> inbound = new LinkedBlockingQueue<>();
    private ConnectionManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.shutdown();
        }
    }

    private ConnectionManager start(ReconnectPolicy policy) {
        return start(policy, HeartbeatConfig.disabled());
    }

    private ConnectionManager start(ReconnectPolicy policy, HeartbeatConfig heartbeat) {
        TransportConfig config =
                TransportConfig.builder()
                        .endpoint("test", EndpointConfig.socket("localhost", 1).build())
                        .reconnectPolicy(policy)
                        .heartbeat(heartbeat)
                        .sweepInterval(Duration.ofMillis(10))
                        .build();
        manager = new ConnectionManager("test", transport, new JsonMessageCodec(), config);
        manager.addStateListener(
                (previous, current, cause) -> transitions.add(previous + ">" + current));
        manager.setMessageHandler(
                (connection, message) -> {
                    if (!connection.correlations().complete(message)) {
                        inbound.add(message);
                    }
                });
        manager.start();
        return manager;
    }

    private ConnectionManager startActive() throws InterruptedException {
        start(ReconnectPolicy.fixedDelay(5, Duration.ofMillis(20)));
        awaitState(ConnectionState.ACTIVE);
        return manager;
    }

    private void awaitState(ConnectionState expected) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (manager.state() != expected) {
            if (System.nanoTime() - deadline > 0) {
                fail("state " + manager.state() + " never became " + expected + ": " + transitions);
            }
            Thread.sleep(5);
        }
    }

    private void awaitTransition(String transition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!transitions.contains(transition)) {
            if (System.nanoTime() - deadline > 0) {
                fail(transition + " never happened: " + transitions);
            }
            Thread.sleep(5);
        }
    }

    private static long deadline() {
        return System.nanoTime() + WAIT.toNanos();
    }

    private CompletableFuture<Message> sendCall(long id, String method) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        CorrelationTable.Entry entry =
                manager.correlations().register(RequestId.of(id), method, deadline);
        ObjectNode params = JsonNodeFactory.instance.objectNode().put("a", 2).put("b", 3);
        manager.send(new Request(RequestId.of(id), method, params), deadline);
        return entry.reply();
    }

    @Nested
    @DisplayName("Opening")
    class OpeningTests {

        @Test
        @DisplayName("Becomes ACTIVE after a successful open")
        void becomesActive() throws Exception {
            startActive();
            assertEquals(List.of("Initializing>Active"), transitions);
            assertTrue(manager.health().isHealthy());
        }

        @Test
        @DisplayName("Sends issued while opening wait for the connection")
        void sendWaitsForOpen() throws Exception {
            transport.failNextOpens(2);
            start(ReconnectPolicy.fixedDelay(5, Duration.ofMillis(30)));

            manager.send(new Notification("initialized", null), System.nanoTime() + WAIT.toNanos());

            assertEquals(new Notification("initialized", null), transport.nextSent(WAIT));
            assertEquals(3, transport.opens());
            assertEquals(
                    List.of("Initializing>Reconnecting", "Reconnecting>Active"), transitions);
        }

        @Test
        @DisplayName("Send gives up at its deadline while still opening")
        void sendTimesOutWhileOpening() {
            transport.failAllOpens();
            start(ReconnectPolicy.fixedDelay(100, Duration.ofMillis(50)));

            assertThrows(
                    CallTimeoutException.class,
                    () ->
                            manager.send(
                                    new Notification("initialized", null),
                                    System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(100)));
        }

        @Test
        @DisplayName("Exhausted retry budget ends in FAILED")
        void exhaustedBudget() throws Exception {
            transport.failAllOpens();
            start(ReconnectPolicy.fixedDelay(3, Duration.ofMillis(10)));

            awaitState(ConnectionState.FAILED);

            assertEquals(3, transport.opens());
            ReconnectExhaustedException e =
                    assertThrows(
                            ReconnectExhaustedException.class,
                            () -> manager.send(new Notification("x", null), System.nanoTime()));
            assertEquals(3, e.attempts());
            assertEquals("scripted open failure", e.getCause().getMessage());

            ReconnectExhaustedException again =
                    assertThrows(
                            ReconnectExhaustedException.class,
                            () -> manager.send(new Notification("y", null), System.nanoTime()));
            assertNotSame(e, again);
            assertEquals(3, again.attempts());
            assertSame(e.getCause(), again.getCause());
        }
    }

    @Nested
    @DisplayName("Faults")
    class FaultTests {

        @Test
        @DisplayName("Fault walks ACTIVE to DEGRADED to RECONNECTING and resets pending calls")
        void faultResetsPendingCalls() throws Exception {
            startActive();
            CompletableFuture<Message> pending = sendCall(1, "add");
            transport.nextSent(WAIT);

            transport.breakChannel();

            ExecutionException e =
                    assertThrows(
                            ExecutionException.class,
                            () -> pending.get(WAIT.toMillis(), TimeUnit.MILLISECONDS));
            assertInstanceOf(ConnectionResetException.class, e.getCause());
            awaitTransition("Reconnecting>Active");
            assertEquals(
                    List.of(
                            "Initializing>Active",
                            "Active>Degraded",
                            "Degraded>Reconnecting",
                            "Reconnecting>Active"),
                    transitions);
            assertEquals(2, transport.opens());
            assertEquals(0, manager.correlations().size());
            assertEquals(1, manager.health().getReconnects());
        }

        @Test
        @DisplayName("Calls work again on the new channel after a reconnect")
        void callsAfterReconnect() throws Exception {
            startActive();
            transport.breakChannel();
            awaitTransition("Reconnecting>Active");

            CompletableFuture<Message> reply = sendCall(2, "get");
            transport.nextSent(WAIT);
            transport.deliver(
                    new Response(RequestId.of(2), JsonNodeFactory.instance.textNode("ok")));

            Response response = (Response) reply.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
            assertEquals("ok", response.result().asText());
        }

        @Test
        @DisplayName("A read failure reconnects without probing")
        void readFailureSkipsProbes() throws Exception {
            startActive();
            transport.breakChannel();
            awaitTransition("Reconnecting>Active");
            assertEquals(0, transport.probes());
        }

        @Test
        @DisplayName("A missed heartbeat answered by a confirmation probe recovers in place")
        void heartbeatMissRecoversInPlace() throws Exception {
            transport.scriptProbes(false, true);
            start(
                    ReconnectPolicy.fixedDelay(5, Duration.ofMillis(20)),
                    HeartbeatConfig.builder()
                            .interval(Duration.ofMillis(50))
                            .deadline(Duration.ofMillis(50))
                            .confirmationProbes(2)
                            .build());
            awaitState(ConnectionState.ACTIVE);
            CompletableFuture<Message> pending = sendCall(1, "add");

            awaitTransition("Degraded>Active");

            assertEquals(
                    List.of("Initializing>Active", "Active>Degraded", "Degraded>Active"),
                    transitions.subList(0, Math.min(3, transitions.size())));
            assertFalse(pending.isDone());
            assertEquals(1, transport.opens());
        }

        @Test
        @DisplayName("Missed heartbeat and failed confirmations reconnect")
        void heartbeatMissReconnects() throws Exception {
            start(
                    ReconnectPolicy.fixedDelay(5, Duration.ofMillis(20)),
                    HeartbeatConfig.builder()
                            .interval(Duration.ofMillis(50))
                            .deadline(Duration.ofMillis(50))
                            .confirmationProbes(2)
                            .build());
            awaitState(ConnectionState.ACTIVE);
            transport.scriptProbes(false, false, false);

            awaitTransition("Reconnecting>Active");

            assertTrue(transitions.contains("Degraded>Reconnecting"), transitions.toString());
            assertEquals(2, transport.opens());
        }

        @Test
        @DisplayName("A failed write is surfaced to the sender and reconnects")
        void failedWrite() throws Exception {
            startActive();
            transport.failSends(true);

            assertThrows(
                    TransportException.class,
                    () -> manager.send(new Notification("x", null), System.nanoTime()));

            transport.failSends(false);
            awaitTransition("Degraded>Reconnecting");
            awaitTransition("Reconnecting>Active");
        }

        @Test
        @DisplayName("A frame the transport refuses fails its sender and leaves other calls alone")
        void rejectedFrameIsNotAFault() throws Exception {
            startActive();
            CompletableFuture<Message> pending = sendCall(1, "add");
            transport.nextSent(WAIT);
            transport.rejectPayloadsLargerThan(256);

            ObjectNode huge =
                    JsonNodeFactory.instance.objectNode().put("blob", "x".repeat(1024));
            assertThrows(
                    FrameRejectedException.class,
                    () -> manager.send(new Request(RequestId.of(2), "upload", huge), deadline()));

            Thread.sleep(100);
            assertEquals(ConnectionState.ACTIVE, manager.state());
            assertEquals(List.of("Initializing>Active"), transitions);
            assertFalse(pending.isDone());
            assertEquals(1, transport.opens());

            transport.deliver(
                    new Response(RequestId.of(1), JsonNodeFactory.instance.numberNode(5)));
            Response response = (Response) pending.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
            assertEquals(5, response.result().asInt());
        }
    }

    @Nested
    @DisplayName("Inbound")
    class InboundTests {

        @Test
        @DisplayName("Without a handler inbound messages are dropped and the connection stays up")
        void noHandler() throws Exception {
            TransportConfig config =
                    TransportConfig.builder()
                            .endpoint("bare", EndpointConfig.socket("localhost", 1).build())
                            .heartbeat(HeartbeatConfig.disabled())
                            .build();
            manager = new ConnectionManager("bare", transport, new JsonMessageCodec(), config);
            manager.start();
            awaitState(ConnectionState.ACTIVE);

            transport.deliver(new Notification("tick", null));
            transport.deliver(
                    new Response(RequestId.of(9), JsonNodeFactory.instance.textNode("late")));

            Thread.sleep(100);
            assertEquals(ConnectionState.ACTIVE, manager.state());
            assertEquals(1, transport.opens());
            assertEquals(2, manager.health().getMessagesReceived());
        }

        @Test
        @DisplayName("Undecodable payloads are dropped without tearing the connection down")
        void undecodableDropped() throws Exception {
            startActive();
            transport.deliver("this is not json".getBytes(StandardCharsets.UTF_8));
            transport.deliver(new Notification("tick", null));

            Message next = inbound.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS);
            assertEquals(new Notification("tick", null), next);
            assertEquals(ConnectionState.ACTIVE, manager.state());
        }

        @Test
        @DisplayName("A call past its deadline times out and leaves no entry behind")
        void deadlineSweep() throws Exception {
            startActive();
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(50);
            CorrelationTable.Entry entry =
                    manager.correlations().register(RequestId.of(5), "slow", deadline);
            manager.send(new Request(RequestId.of(5), "slow", null), deadline);

            ExecutionException e =
                    assertThrows(
                            ExecutionException.class,
                            () -> entry.reply().get(WAIT.toMillis(), TimeUnit.MILLISECONDS));
            assertInstanceOf(CallTimeoutException.class, e.getCause());
            assertEquals(0, manager.correlations().size());
            assertEquals(ConnectionState.ACTIVE, manager.state());
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class ShutdownTests {

        @Test
        @DisplayName("Shutdown fails pending calls and rejects new sends")
        void shutdownFailsPending() throws Exception {
            startActive();
            CompletableFuture<Message> pending = sendCall(1, "add");

            manager.shutdown();

            ExecutionException e = assertThrows(ExecutionException.class, pending::get);
            assertInstanceOf(ConnectionClosedException.class, e.getCause());
            assertEquals(ConnectionState.CLOSED, manager.state());
            assertThrows(
                    ConnectionClosedException.class,
                    () -> manager.send(new Notification("x", null), System.nanoTime()));
            assertFalse(transport.isOpen());
        }

        @Test
        @DisplayName("Shutdown is idempotent")
        void idempotent() throws Exception {
            startActive();
            manager.shutdown();
            assertDoesNotThrow(manager::shutdown);
        }

        @Test
        @DisplayName("Start twice is rejected")
        void startTwice() throws Exception {
            startActive();
            assertThrows(IllegalStateException.class, manager::start);
        }
    }
}
