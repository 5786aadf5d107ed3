package express.mvp.mcpr.transport.error;

import express.mvp.mcpr.transport.TransportException;

/** Completes calls on a connection that was shut down explicitly. */
public class ConnectionClosedException extends TransportException {

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public ConnectionClosedException(String message) {
        super(message);
    }
}
