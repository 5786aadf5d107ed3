package express.mvp.mcpr.transport;

/**
 * Unchecked exception thrown when transport operations fail.
 *
 * <p>This exception wraps I/O errors, connection failures and protocol violations that occur
 * while opening a transport or moving bytes through it. A {@code TransportException} raised by
 * {@code send} or {@code receive} drives the connection lifecycle; it is never swallowed.
 *
 * <h2>Common Causes</h2>
 *
 * <ul>
 *   <li>Connection failures (refused, timeout, reset)
 *   <li>Subordinate process exit
 *   <li>Event stream ended or answered with a non-success status
 *   <li>Invalid framing on the wire
 * </ul>
 *
 * <p>Subclasses in {@link express.mvp.mcpr.transport.error} are used to complete pending calls
 * when their connection is reset, closed or permanently failed.
 *
 * @see express.mvp.mcpr.transport.error.ErrorClassifier
 */
public class TransportException extends RuntimeException {

    /**
     * Constructs a new transport exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public TransportException(String message) {
        super(message);
    }

    /**
     * Constructs a new transport exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
