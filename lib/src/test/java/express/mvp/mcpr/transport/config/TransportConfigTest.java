package express.mvp.mcpr.transport.config;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.mcpr.transport.TransportKind;
import express.mvp.mcpr.transport.routing.CapabilityKind;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link TransportConfig} and {@link EndpointConfig}. */
@DisplayName("TransportConfig")
class TransportConfigTest {

    private static EndpointConfig socket() {
        return EndpointConfig.socket("localhost", 7070).build();
    }

    private static EndpointConfig pipe() {
        return EndpointConfig.pipe("resource-server", "--stdio").build();
    }

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("Bound kinds resolve to their endpoint, others to the default")
        void boundAndDefault() {
            TransportConfig config =
                    TransportConfig.builder()
                            .endpoint("tools", socket())
                            .endpoint("local", pipe())
                            .bind(CapabilityKind.TOOL, "tools")
                            .bind(CapabilityKind.DEFAULT, "local")
                            .build();
            config.validate();

            assertEquals(Optional.of("tools"), config.endpointFor(CapabilityKind.TOOL));
            assertEquals(Optional.of("local"), config.endpointFor(CapabilityKind.RESOURCE));
            assertEquals(Optional.of("local"), config.endpointFor(CapabilityKind.DEFAULT));
            assertEquals("local", config.defaultEndpoint());
        }

        @Test
        @DisplayName("A single endpoint becomes the default")
        void soleEndpointIsDefault() {
            TransportConfig config = TransportConfig.builder().endpoint("only", pipe()).build();
            assertEquals("only", config.defaultEndpoint());
            assertEquals(Optional.of("only"), config.endpointFor(CapabilityKind.PROMPT));
        }

        @Test
        @DisplayName("Unreferenced endpoints are not part of the referenced set")
        void referencedEndpoints() {
            TransportConfig config =
                    TransportConfig.builder()
                            .endpoint("tools", socket())
                            .endpoint("spare", pipe())
                            .defaultEndpoint("tools")
                            .build();
            assertEquals(Set.of("tools"), config.referencedEndpoints());
        }

        @Test
        @DisplayName("Defaults match the documented values")
        void defaults() {
            TransportConfig config = TransportConfig.builder().endpoint("only", pipe()).build();
            assertEquals(Duration.ofSeconds(30), config.callTimeout());
            assertEquals(Duration.ofMillis(100), config.sweepInterval());
            assertEquals(5, config.reconnectPolicy().getMaxAttempts());
            assertTrue(config.heartbeat().isEnabled());
            assertTrue(config.authTokenProvider().isEmpty());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("No endpoints")
        void noEndpoints() {
            assertThrows(ConfigException.class, () -> TransportConfig.builder().build().validate());
        }

        @Test
        @DisplayName("Binding to an undefined endpoint")
        void undefinedBinding() {
            TransportConfig config =
                    TransportConfig.builder()
                            .endpoint("tools", socket())
                            .bind(CapabilityKind.RESOURCE, "missing")
                            .build();
            ConfigException e = assertThrows(ConfigException.class, config::validate);
            assertTrue(e.getMessage().contains("missing"));
        }

        @Test
        @DisplayName("Unbound kinds without a default are accepted and resolve to nothing")
        void unboundWithoutDefault() {
            TransportConfig config =
                    TransportConfig.builder()
                            .endpoint("a", socket())
                            .endpoint("b", pipe())
                            .bind(CapabilityKind.TOOL, "a")
                            .build();
            assertDoesNotThrow(config::validate);
            assertEquals(Optional.of("a"), config.endpointFor(CapabilityKind.TOOL));
            assertEquals(Optional.empty(), config.endpointFor(CapabilityKind.PROMPT));
        }

        @Test
        @DisplayName("Socket endpoint without a port")
        void socketWithoutPort() {
            EndpointConfig noPort = EndpointConfig.builder(TransportKind.SOCKET).host("h").build();
            TransportConfig config = TransportConfig.builder().endpoint("tools", noPort).build();
            ConfigException e = assertThrows(ConfigException.class, config::validate);
            assertTrue(e.getMessage().contains("port"), e.getMessage());
        }

        @Test
        @DisplayName("Pipe endpoint without a command")
        void pipeWithoutCommand() {
            EndpointConfig empty = EndpointConfig.builder(TransportKind.PIPE).build();
            TransportConfig config = TransportConfig.builder().endpoint("local", empty).build();
            assertThrows(ConfigException.class, config::validate);
        }

        @Test
        @DisplayName("Event stream with a non-HTTP URI")
        void eventStreamScheme() {
            EndpointConfig ftp = EndpointConfig.eventStream(URI.create("ftp://host/")).build();
            TransportConfig config = TransportConfig.builder().endpoint("events", ftp).build();
            assertThrows(ConfigException.class, config::validate);
        }

        @Test
        @DisplayName("Incomplete endpoints nobody references are ignored")
        void unreferencedIncompleteIgnored() {
            EndpointConfig noPort = EndpointConfig.builder(TransportKind.SOCKET).host("h").build();
            TransportConfig config =
                    TransportConfig.builder()
                            .endpoint("good", pipe())
                            .endpoint("broken", noPort)
                            .defaultEndpoint("good")
                            .build();
            assertDoesNotThrow(config::validate);
        }

        @Test
        @DisplayName("Builders reject out-of-range values immediately")
        void builderRanges() {
            assertThrows(ConfigException.class, () -> EndpointConfig.socket("h", 70000));
            assertThrows(
                    ConfigException.class,
                    () -> TransportConfig.builder().endpoint("a", pipe()).endpoint("a", pipe()));
            assertThrows(
                    ConfigException.class,
                    () -> TransportConfig.builder().callTimeout(Duration.ZERO));
            assertThrows(
                    ConfigException.class,
                    () -> HeartbeatConfig.builder().confirmationProbes(0));
        }
    }

    @Test
    @DisplayName("Disabled heartbeat")
    void disabledHeartbeat() {
        assertFalse(HeartbeatConfig.disabled().isEnabled());
    }

    @Test
    @DisplayName("Fixed token provider")
    void fixedToken() {
        assertEquals(Optional.of("s3cret"), AuthTokenProvider.fixed("s3cret").currentToken());
    }
}
