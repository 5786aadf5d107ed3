package express.mvp.mcpr.transport.lifecycle;

/**
 * Callback interface for connection state change events.
 *
 * <p>Implementations receive notifications when a connection transitions between states. The
 * router uses one to surface {@link ConnectionState#FAILED} connections to its owner.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * manager.addStateListener((previous, current, cause) -> {
 *     if (current == ConnectionState.DEGRADED) {
 *         LOGGER.warning("Connection degraded: " + cause);
 *     }
 * });
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Callbacks are invoked synchronously on whichever thread performs the transition, usually the
 * connection's control thread. Implementations should be quick and must not block on the
 * connection they observe.
 *
 * @see ConnectionStateMachine
 */
@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * Called when the connection state changes.
     *
     * @param previousState the state before the transition
     * @param currentState the new state after the transition
     * @param cause the reason for the transition (may be null for normal transitions)
     */
    void onStateChanged(
            ConnectionState previousState, ConnectionState currentState, Throwable cause);
}
