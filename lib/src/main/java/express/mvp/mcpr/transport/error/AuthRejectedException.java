package express.mvp.mcpr.transport.error;

import express.mvp.mcpr.transport.TransportException;

/** Raised on open when the peer refuses the presented credentials. Never retried. */
public class AuthRejectedException extends TransportException {

    /**
     * Creates the exception.
     *
     * @param message detail message, usually the peer's reason
     */
    public AuthRejectedException(String message) {
        super(message);
    }
}
