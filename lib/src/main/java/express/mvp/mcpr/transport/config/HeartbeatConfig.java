package express.mvp.mcpr.transport.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Liveness probing parameters for a connection.
 *
 * <p>Every {@code interval} the connection manager probes an {@code ACTIVE} transport and waits
 * up to {@code deadline} for the answer. A miss moves the connection to {@code DEGRADED}, where up
 * to {@code confirmationProbes} further probes decide between recovery and reconnect. An
 * interval of zero disables periodic probing; faults are then only detected by I/O failures.
 */
public final class HeartbeatConfig {

    private final Duration interval;
    private final Duration deadline;
    private final int confirmationProbes;

    private HeartbeatConfig(Builder builder) {
        this.interval = builder.interval;
        this.deadline = builder.deadline;
        this.confirmationProbes = builder.confirmationProbes;
    }

    /**
     * Returns the default heartbeat: every 15 s, 5 s deadline, 3 confirmation probes.
     *
     * @return default configuration
     */
    public static HeartbeatConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a configuration with periodic probing turned off.
     *
     * @return disabled heartbeat
     */
    public static HeartbeatConfig disabled() {
        return builder().interval(Duration.ZERO).build();
    }

    /**
     * Creates a new builder.
     *
     * @return a builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the probe interval.
     *
     * @return interval; zero when disabled
     */
    public Duration interval() {
        return interval;
    }

    /**
     * Returns how long one probe may take.
     *
     * @return probe deadline
     */
    public Duration deadline() {
        return deadline;
    }

    /**
     * Returns how many probes are attempted in {@code DEGRADED} before reconnecting.
     *
     * @return confirmation probe count, at least 1
     */
    public int confirmationProbes() {
        return confirmationProbes;
    }

    /**
     * Checks if periodic probing is on.
     *
     * @return true when the interval is positive
     */
    public boolean isEnabled() {
        return !interval.isZero();
    }

    @Override
    public String toString() {
        return "HeartbeatConfig[interval="
                + interval
                + ", deadline="
                + deadline
                + ", probes="
                + confirmationProbes
                + "]";
    }

    /** Builder for {@link HeartbeatConfig}. */
    public static final class Builder {
        private Duration interval = Duration.ofSeconds(15);
        private Duration deadline = Duration.ofSeconds(5);
        private int confirmationProbes = 3;

        private Builder() {}

        /**
         * Sets the probe interval.
         *
         * @param interval interval, zero to disable
         * @return this builder
         * @throws ConfigException if negative
         */
        public Builder interval(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative()) {
                throw new ConfigException("heartbeat interval must not be negative");
            }
            this.interval = interval;
            return this;
        }

        /**
         * Sets the per-probe deadline.
         *
         * @param deadline deadline
         * @return this builder
         * @throws ConfigException if not positive
         */
        public Builder deadline(Duration deadline) {
            Objects.requireNonNull(deadline, "deadline");
            if (deadline.isNegative() || deadline.isZero()) {
                throw new ConfigException("heartbeat deadline must be positive");
            }
            this.deadline = deadline;
            return this;
        }

        /**
         * Sets the number of confirmation probes.
         *
         * @param probes probe count
         * @return this builder
         * @throws ConfigException if below 1
         */
        public Builder confirmationProbes(int probes) {
            if (probes < 1) {
                throw new ConfigException("confirmationProbes must be >= 1");
            }
            this.confirmationProbes = probes;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return new heartbeat configuration
         */
        public HeartbeatConfig build() {
            return new HeartbeatConfig(this);
        }
    }
}
