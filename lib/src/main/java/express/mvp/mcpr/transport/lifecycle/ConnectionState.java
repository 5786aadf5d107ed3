package express.mvp.mcpr.transport.lifecycle;

/**
 * Represents the states of a managed connection.
 *
 * <p>The connection state machine tracks the lifecycle of one transport from the first open
 * through faults and re-attachment until shutdown or permanent failure.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌──────────────┐  open ok   ┌────────┐  fault   ┌──────────┐
 * │ INITIALIZING │───────────▶│ ACTIVE │─────────▶│ DEGRADED │
 * └──────────────┘            └────────┘◀─────────└──────────┘
 *        │                        ▲      probe ok      │
 *        │ open failed            │ open ok            │ probes failed
 *        ▼                        │                    ▼
 *        │                 ┌──────────────┐            │
 *        └────────────────▶│ RECONNECTING │◀───────────┘
 *                          └──────────────┘
 *                                 │ budget exhausted
 *                                 ▼
 *                          ┌──────────────┐
 *                          │    FAILED    │
 *                          └──────────────┘
 *
 *   any non-terminal state ── shutdown() ──▶ CLOSED
 * </pre>
 *
 * <h2>State Descriptions</h2>
 *
 * <ul>
 *   <li>{@link #INITIALIZING}: first open in progress
 *   <li>{@link #ACTIVE}: normal send and receive
 *   <li>{@link #DEGRADED}: one fault observed, confirmation probes running
 *   <li>{@link #RECONNECTING}: transport closed, re-open pending after backoff
 *   <li>{@link #CLOSED}: terminal, explicit shutdown
 *   <li>{@link #FAILED}: terminal, reconnect budget exhausted
 * </ul>
 *
 * @see ConnectionStateMachine
 */
public enum ConnectionState {

    /**
     * Initial state while the transport is opened for the first time.
     *
     * <p>Sends issued in this state wait for the outcome.
     */
    INITIALIZING("Initializing", false, false),

    /** Transport open and healthy. Sends and receives proceed. */
    ACTIVE("Active", true, false),

    /**
     * A heartbeat miss or an I/O failure was observed but the connection is not yet confirmed
     * dead. Sends are still attempted.
     */
    DEGRADED("Degraded", true, false),

    /**
     * The transport has been closed and is being re-opened with backoff.
     *
     * <p>Sends issued in this state wait for the outcome.
     */
    RECONNECTING("Reconnecting", false, false),

    /** Terminal: shut down on request. Pending calls fail with a connection-closed error. */
    CLOSED("Closed", false, true),

    /** Terminal: reconnect budget exhausted. The connection must be re-created. */
    FAILED("Failed", false, true);

    private final String displayName;
    private final boolean usable;
    private final boolean terminal;

    ConnectionState(String displayName, boolean usable, boolean terminal) {
        this.displayName = displayName;
        this.usable = usable;
        this.terminal = terminal;
    }

    /**
     * Returns a human-readable name for this state.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if the transport may be written to in this state.
     *
     * @return true in {@link #ACTIVE} and {@link #DEGRADED}
     */
    public boolean isUsable() {
        return usable;
    }

    /**
     * Checks if a send issued now should wait for an open to finish.
     *
     * @return true in {@link #INITIALIZING} and {@link #RECONNECTING}
     */
    public boolean isTransitional() {
        return this == INITIALIZING || this == RECONNECTING;
    }

    /**
     * Checks if this is a terminal state.
     *
     * @return true in {@link #CLOSED} and {@link #FAILED}
     */
    public boolean isTerminal() {
        return terminal;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
