package express.mvp.mcpr.transport.error;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Open attempts made by one connection since it was last {@code ACTIVE}.
 *
 * <p>{@link ReconnectPolicy} reads the attempt count and the category of the latest failure to
 * decide whether to keep trying, and stores the delay it hands out so the next one never comes
 * out smaller. A successful open calls {@link #reset()}.
 *
 * <p>Not thread-safe; owned by the connection's control thread.
 */
public final class RetryContext {

    private final String connection;
    private final int maxAttempts;
    private int attempts;
    private Throwable lastError;
    private ErrorCategory lastErrorCategory;
    private long lastDelayMillis;
    private long waitedMillis;

    /**
     * Creates an empty context.
     *
     * @param connection connection name, used in {@link #toString()}
     * @param maxAttempts open attempts allowed before the connection fails
     */
    public RetryContext(String connection, int maxAttempts) {
        this.connection = connection;
        this.maxAttempts = maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Returns how many opens were started in this sequence.
     *
     * @return attempts so far, 0 right after a reset
     */
    public int getAttemptCount() {
        return attempts;
    }

    public boolean hasAttemptsRemaining() {
        return attempts < maxAttempts;
    }

    /**
     * Counts a new open attempt.
     *
     * @return the 1-based number of this attempt
     */
    public int startAttempt() {
        attempts++;
        return attempts;
    }

    /**
     * Records why the latest attempt failed.
     *
     * @param error the open failure
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The failure becomes the cause of ReconnectExhaustedException.")
    public void recordFailure(Throwable error) {
        lastError = error;
        lastErrorCategory = ErrorClassifier.classify(error);
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "The failure becomes the cause of ReconnectExhaustedException.")
    public Throwable getLastError() {
        return lastError;
    }

    /**
     * Returns the classification of the latest failure.
     *
     * @return the category, or null before the first failure
     */
    public ErrorCategory getLastErrorCategory() {
        return lastErrorCategory;
    }

    /**
     * Returns the delay the policy handed out last.
     *
     * @return milliseconds, 0 at the start of a sequence
     */
    public long getNextDelayMillis() {
        return lastDelayMillis;
    }

    void setNextDelay(long delayMillis) {
        lastDelayMillis = delayMillis;
    }

    /**
     * Adds a scheduled backoff to the time spent waiting in this sequence.
     *
     * @param delayMillis the delay that was scheduled
     */
    public void recordDelay(long delayMillis) {
        waitedMillis += delayMillis;
    }

    /** Starts a new sequence after a successful open. */
    public void reset() {
        attempts = 0;
        lastError = null;
        lastErrorCategory = null;
        lastDelayMillis = 0;
        waitedMillis = 0;
    }

    @Override
    public String toString() {
        return connection
                + ": attempt "
                + attempts
                + "/"
                + maxAttempts
                + ", waited "
                + waitedMillis
                + " ms, last failure "
                + lastErrorCategory;
    }
}
