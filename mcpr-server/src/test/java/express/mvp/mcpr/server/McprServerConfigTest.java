package express.mvp.mcpr.server;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link McprServerConfig}. */
@DisplayName("McprServerConfig")
class McprServerConfigTest {

    @Test
    @DisplayName("Defaults bind an ephemeral socket and no event stream")
    void defaults() {
        McprServerConfig config = McprServerConfig.builder().build();
        assertEquals("127.0.0.1", config.getHost());
        assertEquals(0, config.getPort());
        assertEquals(McprServerConfig.DISABLED, config.getEventStreamPort());
        assertTrue(config.getAuthGate().admit(null));
        assertTrue(config.getMethods().contains(MethodTable.PING));
        assertNull(config.getNotificationListener());
        assertEquals(256, config.getReplayBacklog());
    }

    @Test
    @DisplayName("Out-of-range ports are rejected")
    void portRange() {
        McprServerConfig.Builder builder = McprServerConfig.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.port(70000));
        assertThrows(IllegalArgumentException.class, () -> builder.eventStreamPort(-2));
        assertDoesNotThrow(() -> builder.port(McprServerConfig.DISABLED));
    }

    @Test
    @DisplayName("Durations must be positive")
    void durations() {
        McprServerConfig.Builder builder = McprServerConfig.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.handshakeTimeout(Duration.ZERO));
        assertThrows(
                IllegalArgumentException.class,
                () -> builder.keepAliveInterval(Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> builder.handshakeTimeout(null));
    }

    @Test
    @DisplayName("Token gates admit only the expected token")
    void tokenGate() {
        AuthGate gate = AuthGate.requireToken("abc");
        assertTrue(gate.admit("abc"));
        assertFalse(gate.admit("abd"));
        assertFalse(gate.admit(null));
    }

    @Test
    @DisplayName("Negative sizes are rejected")
    void sizes() {
        McprServerConfig.Builder builder = McprServerConfig.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.replayBacklog(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.maxFrameSize(0));
    }
}
