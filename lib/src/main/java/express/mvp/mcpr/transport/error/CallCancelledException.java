package express.mvp.mcpr.transport.error;

import java.util.concurrent.CancellationException;

/**
 * Completes a call its caller cancelled.
 *
 * <p>Cancellation is local: the correlation entry is dropped and the caller released, but the
 * peer is not told and may still process the request. A late reply is handed to the inbound sink
 * as unmatched.
 */
public class CallCancelledException extends CancellationException {

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public CallCancelledException(String message) {
        super(message);
    }
}
