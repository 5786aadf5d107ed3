package express.mvp.mcpr.transport;

import java.time.Instant;

/**
 * Health status and counters for a transport or a managed connection.
 *
 * <p>This immutable class provides a snapshot of health including whether the channel is open,
 * throughput counters and the most recent error.
 *
 * <h2>Health Metrics</h2>
 *
 * <ul>
 *   <li><b>healthy:</b> open and no error since the last successful open
 *   <li><b>open:</b> the underlying channel is open
 *   <li><b>messagesSent/Received:</b> frames moved since creation
 *   <li><b>totalBytesSent/Received:</b> payload bytes moved since creation
 *   <li><b>pendingCalls:</b> correlation entries awaiting a reply (connections only)
 *   <li><b>reconnects:</b> successful re-opens after a fault (connections only)
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * TransportHealth health = router.resolve(CapabilityKind.TOOL).health();
 * if (!health.isHealthy()) {
 *     LOGGER.warning("tools unhealthy: " + health.getErrorMessage());
 * }
 * }</pre>
 *
 * @see Transport#health()
 */
public final class TransportHealth {

    private final boolean healthy;
    private final boolean open;
    private final long messagesSent;
    private final long messagesReceived;
    private final long totalBytesSent;
    private final long totalBytesReceived;
    private final int pendingCalls;
    private final long reconnects;
    private final Instant lastError;
    private final String errorMessage;

    private TransportHealth(Builder builder) {
        this.healthy = builder.healthy;
        this.open = builder.open;
        this.messagesSent = builder.messagesSent;
        this.messagesReceived = builder.messagesReceived;
        this.totalBytesSent = builder.totalBytesSent;
        this.totalBytesReceived = builder.totalBytesReceived;
        this.pendingCalls = builder.pendingCalls;
        this.reconnects = builder.reconnects;
        this.lastError = builder.lastError;
        this.errorMessage = builder.errorMessage;
    }

    /**
     * Creates a new builder for constructing health snapshots.
     *
     * @return a new builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled from this snapshot.
     *
     * @return a builder carrying every value of this snapshot
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.healthy = healthy;
        builder.open = open;
        builder.messagesSent = messagesSent;
        builder.messagesReceived = messagesReceived;
        builder.totalBytesSent = totalBytesSent;
        builder.totalBytesReceived = totalBytesReceived;
        builder.pendingCalls = pendingCalls;
        builder.reconnects = reconnects;
        builder.lastError = lastError;
        builder.errorMessage = errorMessage;
        return builder;
    }

    /**
     * Returns whether the channel is open and error-free.
     *
     * @return {@code true} if healthy
     */
    public boolean isHealthy() {
        return healthy;
    }

    /**
     * Returns whether the underlying channel is open.
     *
     * @return {@code true} if open
     */
    public boolean isOpen() {
        return open;
    }

    /**
     * Returns the number of messages sent.
     *
     * @return messages sent
     */
    public long getMessagesSent() {
        return messagesSent;
    }

    /**
     * Returns the number of messages received.
     *
     * @return messages received
     */
    public long getMessagesReceived() {
        return messagesReceived;
    }

    /**
     * Returns the total payload bytes sent.
     *
     * @return cumulative bytes sent
     */
    public long getTotalBytesSent() {
        return totalBytesSent;
    }

    /**
     * Returns the total payload bytes received.
     *
     * @return cumulative bytes received
     */
    public long getTotalBytesReceived() {
        return totalBytesReceived;
    }

    /**
     * Returns the number of calls awaiting a reply.
     *
     * @return pending call count; 0 for bare transports
     */
    public int getPendingCalls() {
        return pendingCalls;
    }

    /**
     * Returns the number of successful re-opens after a fault.
     *
     * @return reconnect count; 0 for bare transports
     */
    public long getReconnects() {
        return reconnects;
    }

    /**
     * Returns the timestamp of the most recent error.
     *
     * @return the error timestamp, or {@code null} if no errors
     */
    public Instant getLastError() {
        return lastError;
    }

    /**
     * Returns the message describing the most recent error.
     *
     * @return the error message, or {@code null} if no errors
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "TransportHealth[healthy="
                + healthy
                + ", open="
                + open
                + ", sent="
                + messagesSent
                + "/"
                + totalBytesSent
                + "B, received="
                + messagesReceived
                + "/"
                + totalBytesReceived
                + "B, pending="
                + pendingCalls
                + ", reconnects="
                + reconnects
                + (errorMessage != null ? ", error=" + errorMessage : "")
                + "]";
    }

    /** Builder for constructing {@link TransportHealth} instances. */
    public static final class Builder {
        private boolean healthy = true;
        private boolean open;
        private long messagesSent;
        private long messagesReceived;
        private long totalBytesSent;
        private long totalBytesReceived;
        private int pendingCalls;
        private long reconnects;
        private Instant lastError;
        private String errorMessage;

        /**
         * Sets the overall health status.
         *
         * @param healthy true if healthy
         * @return this builder for chaining
         */
        public Builder healthy(boolean healthy) {
            this.healthy = healthy;
            return this;
        }

        /**
         * Sets whether the channel is open.
         *
         * @param open true if open
         * @return this builder for chaining
         */
        public Builder open(boolean open) {
            this.open = open;
            return this;
        }

        /**
         * Sets the message counters.
         *
         * @param sent messages sent
         * @param received messages received
         * @return this builder for chaining
         */
        public Builder messages(long sent, long received) {
            this.messagesSent = sent;
            this.messagesReceived = received;
            return this;
        }

        /**
         * Sets the byte counters.
         *
         * @param sent bytes sent
         * @param received bytes received
         * @return this builder for chaining
         */
        public Builder bytes(long sent, long received) {
            this.totalBytesSent = sent;
            this.totalBytesReceived = received;
            return this;
        }

        /**
         * Sets the pending call count.
         *
         * @param count pending calls
         * @return this builder for chaining
         */
        public Builder pendingCalls(int count) {
            this.pendingCalls = count;
            return this;
        }

        /**
         * Sets the reconnect count.
         *
         * @param count successful reconnects
         * @return this builder for chaining
         */
        public Builder reconnects(long count) {
            this.reconnects = count;
            return this;
        }

        /**
         * Records an error, which also sets healthy to false.
         *
         * @param timestamp when the error occurred
         * @param message description of the error
         * @return this builder for chaining
         */
        public Builder lastError(Instant timestamp, String message) {
            this.lastError = timestamp;
            this.errorMessage = message;
            this.healthy = false;
            return this;
        }

        /**
         * Builds the health snapshot.
         *
         * @return a new immutable TransportHealth
         */
        public TransportHealth build() {
            return new TransportHealth(this);
        }
    }
}
