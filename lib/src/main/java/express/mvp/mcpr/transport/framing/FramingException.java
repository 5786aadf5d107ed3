package express.mvp.mcpr.transport.framing;

/**
 * Exception thrown when message framing or deframing fails.
 *
 * <p>This exception indicates protocol-level errors in the framing layer, such as:
 *
 * <ul>
 *   <li><b>Oversized messages:</b> Payload exceeds the configured maximum size
 *   <li><b>Invalid length prefix:</b> The length field is negative
 *   <li><b>Embedded delimiter:</b> A payload for newline framing contains a line break
 * </ul>
 *
 * <p>After a framing failure on read the stream position is unknown, so the transport treats it
 * as a receive failure of the whole channel rather than of a single message.
 *
 * @see FramingHandler
 */
public class FramingException extends RuntimeException {

    /**
     * Constructs a new framing exception with the specified detail message.
     *
     * @param message the detail message describing the framing error
     */
    public FramingException(String message) {
        super(message);
    }

    /**
     * Constructs a new framing exception with the specified detail message and cause.
     *
     * @param message the detail message describing the framing error
     * @param cause the underlying cause of the framing error
     */
    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
