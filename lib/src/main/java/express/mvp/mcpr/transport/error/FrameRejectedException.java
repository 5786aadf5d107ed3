package express.mvp.mcpr.transport.error;

import express.mvp.mcpr.transport.TransportException;

/**
 * Signals that a transport refused an outbound message before writing any of it, for example
 * because the frame would exceed the configured size limit. The channel is still usable; only the
 * call that produced the message fails.
 */
public class FrameRejectedException extends TransportException {

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause the framing failure
     */
    public FrameRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
