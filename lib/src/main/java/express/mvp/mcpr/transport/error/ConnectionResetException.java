package express.mvp.mcpr.transport.error;

import express.mvp.mcpr.transport.TransportException;

/**
 * Completes calls that were in flight when their connection faulted and was re-attached.
 *
 * <p>Such calls are not replayed: the peer may or may not have executed them, and request
 * semantics are not assumed to be idempotent.
 */
public class ConnectionResetException extends TransportException {

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause the fault that triggered the reset (may be null)
     */
    public ConnectionResetException(String message, Throwable cause) {
        super(message, cause);
    }
}
