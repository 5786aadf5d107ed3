package express.mvp.mcpr.transport.error;

/**
 * Completes a call whose deadline passed before a reply arrived.
 *
 * <p>Only the call is affected; the connection it was sent on stays as it is.
 */
public class CallTimeoutException extends RuntimeException {

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public CallTimeoutException(String message) {
        super(message);
    }
}
