package express.mvp.mcpr.transport.error;

import express.mvp.mcpr.transport.TransportException;

/**
 * Signals that a connection used up its reconnect budget and is now failed.
 *
 * <p>A failed connection never recovers on its own; the owner has to build a new one.
 */
public class ReconnectExhaustedException extends TransportException {

    private final int attempts;

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param attempts number of open attempts made
     * @param cause the last open failure (may be null)
     */
    public ReconnectExhaustedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * Returns how many open attempts were made before giving up.
     *
     * @return the attempt count
     */
    public int attempts() {
        return attempts;
    }
}
