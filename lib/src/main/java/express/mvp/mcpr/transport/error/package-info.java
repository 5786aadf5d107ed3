/**
 * Error types, classification, and reconnect backoff.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.mcpr.transport.error.ErrorCategory} - Classification of error types
 *   <li>{@link express.mvp.mcpr.transport.error.ErrorClassifier} - Classifies exceptions by
 *       category
 *   <li>{@link express.mvp.mcpr.transport.error.ReconnectPolicy} - Backoff schedule and retry
 *       budget for reopening a transport
 *   <li>{@link express.mvp.mcpr.transport.error.RetryContext} - Tracks attempts of one reconnect
 *       episode
 * </ul>
 *
 * <h2>Call Outcomes</h2>
 *
 * <p>A failed call surfaces exactly one of {@link
 * express.mvp.mcpr.transport.error.CallTimeoutException}, {@link
 * express.mvp.mcpr.transport.error.CallCancelledException}, {@link
 * express.mvp.mcpr.transport.error.ConnectionResetException}, {@link
 * express.mvp.mcpr.transport.error.ConnectionClosedException} or {@link
 * express.mvp.mcpr.transport.error.ReconnectExhaustedException}.
 *
 * @see express.mvp.mcpr.transport.lifecycle.ConnectionStateMachine
 */
package express.mvp.mcpr.transport.error;
