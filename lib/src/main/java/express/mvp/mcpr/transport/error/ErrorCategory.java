package express.mvp.mcpr.transport.error;

/**
 * What kind of failure ended an {@code open()}, a read, or a write.
 *
 * <p>The connection manager consults the category of an open failure: PROTOCOL and FATAL
 * failures fail the connection at once, every other category spends the reconnect budget.
 *
 * <table border="1">
 *   <caption>Categories and typical causes</caption>
 *   <tr><th>Category</th><th>Retryable</th><th>Typical cause</th></tr>
 *   <tr><td>TRANSIENT</td><td>yes</td><td>timeout, interrupted read, busy peer</td></tr>
 *   <tr><td>NETWORK</td><td>yes</td><td>refused or reset socket, dropped stream, process exit
 *   </td></tr>
 *   <tr><td>PROTOCOL</td><td>no</td><td>bad framing, wrong content type, rejected credentials
 *   </td></tr>
 *   <tr><td>RESOURCE</td><td>yes</td><td>out of memory, file or process limits</td></tr>
 *   <tr><td>FATAL</td><td>no</td><td>linkage errors, security violations, missing program</td></tr>
 *   <tr><td>UNKNOWN</td><td>yes</td><td>anything else</td></tr>
 * </table>
 *
 * @see ErrorClassifier
 * @see ReconnectPolicy
 */
public enum ErrorCategory {
    TRANSIENT(true),
    NETWORK(true),
    PROTOCOL(false),
    RESOURCE(true),
    FATAL(false),
    /** Unclassified failures are retried. */
    UNKNOWN(true);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Returns whether another open attempt may succeed after a failure of this kind.
     *
     * @return true if reconnecting is worthwhile
     */
    public boolean isRetryable() {
        return retryable;
    }
}
