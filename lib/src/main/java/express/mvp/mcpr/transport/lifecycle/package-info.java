/**
 * Connection lifecycle states and the state machine that guards their transitions.
 *
 * <pre>
 * INITIALIZING ──► ACTIVE ◄──► DEGRADED ──► RECONNECTING ──► ACTIVE
 *       │                                        │
 *       └──────────────► FAILED ◄────────────────┘
 *
 * any non-terminal state ──► CLOSED
 * </pre>
 */
package express.mvp.mcpr.transport.lifecycle;
