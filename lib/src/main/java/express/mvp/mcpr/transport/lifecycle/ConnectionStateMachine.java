package express.mvp.mcpr.transport.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for managing connection lifecycle.
 *
 * <p>This class enforces valid state transitions and notifies listeners of state changes.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * INITIALIZING → ACTIVE, RECONNECTING, FAILED, CLOSED
 * ACTIVE       → DEGRADED, CLOSED
 * DEGRADED     → ACTIVE, RECONNECTING, CLOSED
 * RECONNECTING → ACTIVE, FAILED, CLOSED
 * CLOSED       → (terminal)
 * FAILED       → (terminal)
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. State transitions use atomic operations. Waiters blocked in
 * {@link #awaitSettled(long)} are woken on every transition.
 *
 * @see ConnectionState
 * @see ConnectionStateListener
 */
public final class ConnectionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(ConnectionStateMachine.class.getName());

    private static final Set<ConnectionState> FROM_INITIALIZING =
            EnumSet.of(
                    ConnectionState.ACTIVE,
                    ConnectionState.RECONNECTING,
                    ConnectionState.FAILED,
                    ConnectionState.CLOSED);

    private static final Set<ConnectionState> FROM_ACTIVE =
            EnumSet.of(ConnectionState.DEGRADED, ConnectionState.CLOSED);

    private static final Set<ConnectionState> FROM_DEGRADED =
            EnumSet.of(ConnectionState.ACTIVE, ConnectionState.RECONNECTING, ConnectionState.CLOSED);

    private static final Set<ConnectionState> FROM_RECONNECTING =
            EnumSet.of(ConnectionState.ACTIVE, ConnectionState.FAILED, ConnectionState.CLOSED);

    private static final Set<ConnectionState> TERMINAL = EnumSet.noneOf(ConnectionState.class);

    /** Current connection state. */
    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.INITIALIZING);

    /** Registered state change listeners. */
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    private final Object monitor = new Object();

    /** Identifier for log messages. */
    private final String connectionId;

    /**
     * Creates a new state machine in {@link ConnectionState#INITIALIZING}.
     *
     * @param connectionId identifier for this connection
     */
    public ConnectionStateMachine(String connectionId) {
        this.connectionId = connectionId;
    }

    /**
     * Returns the current state.
     *
     * @return the current connection state
     */
    public ConnectionState getState() {
        return state.get();
    }

    /**
     * Returns the connection identifier.
     *
     * @return the connection ID
     */
    public String getConnectionId() {
        return connectionId;
    }

    /**
     * Registers a listener for state change events.
     *
     * @param listener the listener to register
     */
    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(ConnectionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state.
     *
     * @param newState the desired new state
     * @param cause the reason for the transition (may be null)
     * @return true if the transition was successful
     */
    public boolean transitionTo(ConnectionState newState, Throwable cause) {
        while (true) {
            ConnectionState current = state.get();
            if (!isValidTransition(current, newState)) {
                return false;
            }
            if (state.compareAndSet(current, newState)) {
                onTransition(current, newState, cause);
                return true;
            }
        }
    }

    /**
     * Attempts to transition from a specific expected state.
     *
     * @param expectedState the expected current state
     * @param newState the desired new state
     * @param cause the reason for the transition (may be null)
     * @return true if transition successful, false if current state doesn't match
     */
    public boolean transitionFrom(
            ConnectionState expectedState, ConnectionState newState, Throwable cause) {
        if (!isValidTransition(expectedState, newState)) {
            return false;
        }
        if (state.compareAndSet(expectedState, newState)) {
            onTransition(expectedState, newState, cause);
            return true;
        }
        return false;
    }

    /**
     * Blocks while the state is transitional ({@link ConnectionState#isTransitional()}).
     *
     * @param deadlineNanos absolute {@link System#nanoTime()} deadline
     * @return the state observed when waiting stopped; may still be transitional on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public ConnectionState awaitSettled(long deadlineNanos) throws InterruptedException {
        synchronized (monitor) {
            while (true) {
                ConnectionState current = state.get();
                if (!current.isTransitional()) {
                    return current;
                }
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    return current;
                }
                long millis = Math.max(1, remaining / 1_000_000L);
                monitor.wait(millis);
            }
        }
    }

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(ConnectionState from, ConnectionState to) {
        if (from == to) {
            return false;
        }
        return getAllowed(from).contains(to);
    }

    /**
     * Returns the set of valid target states from a given state.
     *
     * @param from the source state
     * @return set of valid target states
     */
    public static Set<ConnectionState> getValidTransitions(ConnectionState from) {
        Set<ConnectionState> allowed = getAllowed(from);
        return allowed.isEmpty()
                ? EnumSet.noneOf(ConnectionState.class)
                : EnumSet.copyOf(allowed);
    }

    private static Set<ConnectionState> getAllowed(ConnectionState from) {
        return switch (from) {
            case INITIALIZING -> FROM_INITIALIZING;
            case ACTIVE -> FROM_ACTIVE;
            case DEGRADED -> FROM_DEGRADED;
            case RECONNECTING -> FROM_RECONNECTING;
            case CLOSED, FAILED -> TERMINAL;
        };
    }

    private void onTransition(ConnectionState previous, ConnectionState current, Throwable cause) {
        if (cause != null && (current == ConnectionState.DEGRADED || current.isTerminal())) {
            LOGGER.log(
                    Level.INFO,
                    "[{0}] {1} -> {2}: {3}",
                    new Object[] {connectionId, previous, current, cause.toString()});
        } else {
            LOGGER.log(Level.INFO, "[{0}] {1} -> {2}", new Object[] {connectionId, previous, current});
        }
        synchronized (monitor) {
            monitor.notifyAll();
        }
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Connection state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return "ConnectionStateMachine[" + connectionId + ":" + state.get() + "]";
    }
}
