package express.mvp.mcpr.transport.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ConnectionState}. */
@DisplayName("ConnectionState")
class ConnectionStateTest {

    @Test
    @DisplayName("Only ACTIVE and DEGRADED accept traffic")
    void usableStates() {
        for (ConnectionState state : ConnectionState.values()) {
            boolean expected = state == ConnectionState.ACTIVE || state == ConnectionState.DEGRADED;
            assertEquals(expected, state.isUsable(), state.name());
        }
    }

    @Test
    @DisplayName("INITIALIZING and RECONNECTING are transitional")
    void transitionalStates() {
        assertTrue(ConnectionState.INITIALIZING.isTransitional());
        assertTrue(ConnectionState.RECONNECTING.isTransitional());
        assertFalse(ConnectionState.DEGRADED.isTransitional());
    }

    @Test
    @DisplayName("CLOSED and FAILED are terminal")
    void terminalStates() {
        assertTrue(ConnectionState.CLOSED.isTerminal());
        assertTrue(ConnectionState.FAILED.isTerminal());
        assertFalse(ConnectionState.RECONNECTING.isTerminal());
    }

    @Test
    @DisplayName("toString is the display name")
    void displayName() {
        assertEquals("Reconnecting", ConnectionState.RECONNECTING.toString());
        assertEquals(ConnectionState.RECONNECTING.displayName(),
                ConnectionState.RECONNECTING.toString());
    }
}
