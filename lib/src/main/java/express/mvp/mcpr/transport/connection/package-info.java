/**
 * Per-connection lifecycle management and pending-call bookkeeping.
 *
 * <p>Each {@link express.mvp.mcpr.transport.connection.ConnectionManager} runs one reader thread
 * (the only caller of {@code receive}), one control thread (opens, probes, state changes) and one
 * sweeper thread (expires call deadlines). Writes are serialized by a lock.
 */
package express.mvp.mcpr.transport.connection;
