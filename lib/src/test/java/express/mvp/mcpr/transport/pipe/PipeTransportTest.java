package express.mvp.mcpr.transport.pipe;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.codec.JsonMessageCodec;
import express.mvp.mcpr.transport.config.EndpointConfig;
import express.mvp.mcpr.transport.config.HeartbeatConfig;
import express.mvp.mcpr.transport.config.TransportConfig;
import express.mvp.mcpr.transport.dispatch.MessageDispatcher;
import express.mvp.mcpr.transport.dispatch.PendingCall;
import express.mvp.mcpr.transport.error.FrameRejectedException;
import express.mvp.mcpr.transport.error.ReconnectPolicy;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.Request;
import express.mvp.mcpr.transport.message.RequestId;
import express.mvp.mcpr.transport.message.Response;
import express.mvp.mcpr.transport.routing.CapabilityKind;
import express.mvp.mcpr.transport.routing.TransportRouter;
import java.io.ByteArrayOutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link PipeTransport} against a real subordinate JVM. */
@DisplayName("PipeTransport")
class PipeTransportTest {

    private final JsonMessageCodec codec = new JsonMessageCodec();
    private PipeTransport transport;

    @AfterEach
    void tearDown() {
        if (transport != null) {
            transport.close();
        }
    }

    static EndpointConfig peer(String... args) {
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        List<String> command = new ArrayList<>();
        command.add(java);
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(ArithmeticPeer.class.getName());
        command.addAll(List.of(args));
        return EndpointConfig.pipe(command).closeGrace(Duration.ofSeconds(2)).build();
    }

    private Message call(Request request) {
        transport.send(codec.encode(request));
        return codec.decode(transport.receive());
    }

    @Nested
    @DisplayName("Spawned process")
    class SpawnedTests {

        @Test
        @DisplayName("Exchanges newline-delimited messages with the process")
        void exchange() {
            transport = new PipeTransport(peer());
            transport.open();

            Response reply =
                    (Response)
                            call(
                                    new Request(
                                            RequestId.of(1),
                                            "add",
                                            JsonNodeFactory.instance
                                                    .objectNode()
                                                    .put("a", 2)
                                                    .put("b", 3)));

            assertEquals(5, reply.result().get("sum").asInt());
            assertTrue(transport.probe(Duration.ofSeconds(1)));
            assertTrue(transport.pid() > 0);
            assertEquals(1, transport.health().getMessagesSent());
            assertEquals(1, transport.health().getMessagesReceived());
        }

        @Test
        @DisplayName("Process exit surfaces as a receive failure with the exit code")
        void processExit() {
            transport = new PipeTransport(peer("crash-on-add"));
            transport.open();
            transport.send(
                    codec.encode(
                            new Request(
                                    RequestId.of(1),
                                    "add",
                                    JsonNodeFactory.instance.objectNode().put("a", 2).put("b", 3))));

            TransportException e = assertThrows(TransportException.class, transport::receive);

            assertTrue(
                    e.getMessage().contains("exited with code " + ArithmeticPeer.CRASH_EXIT_CODE),
                    e.getMessage());
            assertFalse(transport.isOpen());
            assertFalse(transport.probe(Duration.ofMillis(100)));
        }

        @Test
        @DisplayName("A payload that cannot be framed is refused and the pipe stays usable")
        void unframeablePayload() {
            transport = new PipeTransport(peer());
            transport.open();

            byte[] twoLines = "{\"a\":1}\n{\"b\":2}".getBytes(StandardCharsets.UTF_8);
            assertThrows(FrameRejectedException.class, () -> transport.send(twoLines));
            assertTrue(transport.isOpen());

            Response reply =
                    (Response)
                            call(
                                    new Request(
                                            RequestId.of(2),
                                            "add",
                                            JsonNodeFactory.instance
                                                    .objectNode()
                                                    .put("a", 1)
                                                    .put("b", 1)));
            assertEquals(2, reply.result().get("sum").asInt());
        }

        @Test
        @DisplayName("Close stops the process and may be repeated")
        void closeStopsProcess() {
            transport = new PipeTransport(peer());
            transport.open();
            ProcessHandle handle = ProcessHandle.of(transport.pid()).orElseThrow();

            transport.close();
            transport.close();

            assertFalse(handle.isAlive());
            assertEquals(-1, transport.pid());
            assertThrows(TransportException.class, () -> transport.send(new byte[] {'{', '}'}));
        }

        @Test
        @DisplayName("A program that cannot start fails the open")
        void missingProgram() {
            transport =
                    new PipeTransport(EndpointConfig.pipe("/definitely/not/a/program").build());
            TransportException e = assertThrows(TransportException.class, transport::open);
            assertTrue(e.getMessage().startsWith("Cannot run program"));
        }
    }

    @Nested
    @DisplayName("Attached streams")
    class AttachedTests {

        @Test
        @DisplayName("Reads and writes caller-supplied streams and cannot re-open them")
        void attached() throws Exception {
            PipedOutputStream feed = new PipedOutputStream();
            PipedInputStream in = new PipedInputStream(feed);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            transport = new PipeTransport(in, out);
            transport.open();

            transport.send("{\"method\":\"tick\"}".getBytes(StandardCharsets.UTF_8));
            feed.write("{\"method\":\"tock\"}\n".getBytes(StandardCharsets.UTF_8));
            feed.flush();

            assertEquals("{\"method\":\"tick\"}\n", out.toString(StandardCharsets.UTF_8));
            assertEquals(
                    "{\"method\":\"tock\"}",
                    new String(transport.receive(), StandardCharsets.UTF_8));

            transport.close();
            assertThrows(TransportException.class, transport::open);
        }
    }

    @Nested
    @DisplayName("Behind a dispatcher")
    class DispatchedTests {

        private TransportRouter router;

        @AfterEach
        void shutdown() {
            if (router != null) {
                router.shutdown();
            }
        }

        private MessageDispatcher dispatcher(EndpointConfig endpoint) {
            TransportConfig config =
                    TransportConfig.builder()
                            .endpoint("local", endpoint)
                            .heartbeat(HeartbeatConfig.disabled())
                            .reconnectPolicy(ReconnectPolicy.fixedDelay(2, Duration.ofMillis(50)))
                            .build();
            router = new TransportRouter(config);
            return new MessageDispatcher(router);
        }

        @Test
        @DisplayName("A call completes end to end")
        void callCompletes() {
            MessageDispatcher dispatcher = dispatcher(peer());
            JsonNode result =
                    dispatcher.call(
                            CapabilityKind.TOOL,
                            "add",
                            Map.of("a", 2, "b", 3),
                            Duration.ofSeconds(10));
            assertEquals(5, result.get("sum").asInt());
        }

        @Test
        @DisplayName("A pending call fails, not hangs, when the process exits")
        void processExitFailsPendingCall() {
            MessageDispatcher dispatcher = dispatcher(peer("crash-on-add"));

            PendingCall call =
                    dispatcher.callAsync(
                            CapabilityKind.TOOL,
                            "add",
                            Map.of("a", 2, "b", 3),
                            Duration.ofSeconds(30));

            ExecutionException e =
                    assertThrows(
                            ExecutionException.class,
                            () -> call.result().get(15, TimeUnit.SECONDS));
            assertInstanceOf(TransportException.class, e.getCause());
        }
    }
}
