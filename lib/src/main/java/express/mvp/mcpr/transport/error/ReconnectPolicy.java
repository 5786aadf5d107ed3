package express.mvp.mcpr.transport.error;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Defines how a faulted connection is re-opened.
 *
 * <p>This class encapsulates the reconnect budget and the delay before each open attempt. Delays
 * follow exponential backoff with jitter and a cap. Within one reconnect sequence the delay never
 * decreases: a jittered value lower than the previous delay is raised to it. A fresh
 * {@link RetryContext} (or {@link RetryContext#reset()}) starts again from the base delay.
 *
 * <h2>Defaults</h2>
 *
 * <ul>
 *   <li>5 attempts
 *   <li>200 ms base delay, doubling, capped at 10 s
 *   <li>±20% jitter
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ReconnectPolicy policy = ReconnectPolicy.builder()
 *     .maxAttempts(5)
 *     .initialDelay(Duration.ofMillis(200))
 *     .maxDelay(Duration.ofSeconds(10))
 *     .jitterFactor(0.2)
 *     .build();
 *
 * RetryContext context = new RetryContext("reconnect tools", policy.getMaxAttempts());
 * while (true) {
 *     Thread.sleep(policy.calculateDelay(context));
 *     context.startAttempt();
 *     try {
 *         transport.open();
 *         break;
 *     } catch (TransportException e) {
 *         context.recordFailure(e);
 *         if (!policy.shouldRetry(context)) {
 *             throw new ReconnectExhaustedException("gave up", context.getAttemptCount(), e);
 *         }
 *     }
 * }
 * }</pre>
 *
 * @see RetryContext
 * @see ErrorCategory
 */
public final class ReconnectPolicy {

    /** Maximum number of open attempts per reconnect sequence. */
    private final int maxAttempts;

    /** Delay before the first attempt. */
    private final long initialDelayMillis;

    /** Maximum delay cap. */
    private final long maxDelayMillis;

    /** Backoff multiplier (1.0 = fixed delay). */
    private final double backoffMultiplier;

    /** Jitter factor (0.0-1.0). */
    private final double jitterFactor;

    private ReconnectPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelayMillis = builder.initialDelayMillis;
        this.maxDelayMillis = builder.maxDelayMillis;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.jitterFactor = builder.jitterFactor;
    }

    /**
     * Returns the maximum number of open attempts.
     *
     * @return max attempts
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Returns the base delay.
     *
     * @return delay before the first attempt
     */
    public Duration getInitialDelay() {
        return Duration.ofMillis(initialDelayMillis);
    }

    /**
     * Returns the delay cap.
     *
     * @return maximum delay
     */
    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMillis);
    }

    /**
     * Determines whether another open attempt should be made.
     *
     * @param context the retry context
     * @return true if the budget allows another attempt and the last failure is retryable
     */
    public boolean shouldRetry(RetryContext context) {
        if (!context.hasAttemptsRemaining()) {
            return false;
        }
        ErrorCategory category = context.getLastErrorCategory();
        if (category == null) {
            return true;
        }
        return category.isRetryable();
    }

    /**
     * Calculates the delay before the next attempt and stores it in the context.
     *
     * @param context the retry context; its attempt count selects the backoff step
     * @return delay in milliseconds
     */
    public long calculateDelay(RetryContext context) {
        int step = context.getAttemptCount();

        long delay;
        if (backoffMultiplier <= 1.0) {
            delay = initialDelayMillis;
        } else {
            double raw = initialDelayMillis * Math.pow(backoffMultiplier, step);
            delay = raw >= maxDelayMillis ? maxDelayMillis : (long) raw;
        }
        delay = Math.min(delay, maxDelayMillis);

        if (jitterFactor > 0 && delay > 0) {
            double jitter = ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
            delay = Math.min(maxDelayMillis, Math.max(0, (long) (delay * (1 + jitter))));
        }

        // Non-decreasing within one sequence
        if (step > 0) {
            delay = Math.max(delay, context.getNextDelayMillis());
        }

        context.setNextDelay(delay);
        return delay;
    }

    /**
     * Returns the default policy.
     *
     * @return default policy
     */
    public static ReconnectPolicy defaults() {
        return new Builder().build();
    }

    /**
     * Returns a policy that makes a single attempt.
     *
     * @return no-retry policy
     */
    public static ReconnectPolicy noRetry() {
        return new Builder().maxAttempts(1).initialDelay(Duration.ZERO).build();
    }

    /**
     * Returns a policy with fixed delay between attempts.
     *
     * @param maxAttempts maximum attempts
     * @param delay delay between attempts
     * @return fixed delay policy
     */
    public static ReconnectPolicy fixedDelay(int maxAttempts, Duration delay) {
        return new Builder()
                .maxAttempts(maxAttempts)
                .initialDelay(delay)
                .maxDelay(delay)
                .backoffMultiplier(1.0)
                .jitterFactor(0.0)
                .build();
    }

    /**
     * Returns a builder for custom policy configuration.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ReconnectPolicy[attempts="
                + maxAttempts
                + ", base="
                + initialDelayMillis
                + "ms, cap="
                + maxDelayMillis
                + "ms, x"
                + backoffMultiplier
                + ", jitter="
                + jitterFactor
                + "]";
    }

    /** Builder for {@link ReconnectPolicy}. */
    public static final class Builder {
        private int maxAttempts = 5;
        private long initialDelayMillis = 200;
        private long maxDelayMillis = 10_000;
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.2;

        /**
         * Sets the maximum number of open attempts.
         *
         * @param maxAttempts max attempts (must be >= 1)
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the base delay.
         *
         * @param delay initial delay
         * @return this builder
         */
        public Builder initialDelay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("initialDelay must not be negative");
            }
            this.initialDelayMillis = delay.toMillis();
            return this;
        }

        /**
         * Sets the maximum delay cap.
         *
         * @param maxDelay maximum delay
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelayMillis = maxDelay.toMillis();
            return this;
        }

        /**
         * Sets the backoff multiplier.
         *
         * @param multiplier multiplier (1.0 = fixed delay, 2.0 = double each time)
         * @return this builder
         */
        public Builder backoffMultiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
            }
            this.backoffMultiplier = multiplier;
            return this;
        }

        /**
         * Sets the jitter factor.
         *
         * @param jitter jitter factor (0.0-1.0)
         * @return this builder
         */
        public Builder jitterFactor(double jitter) {
            if (jitter < 0 || jitter > 1.0) {
                throw new IllegalArgumentException("jitterFactor must be 0.0-1.0");
            }
            this.jitterFactor = jitter;
            return this;
        }

        /**
         * Builds the policy.
         *
         * @return new policy
         * @throws IllegalArgumentException if the cap is below the base delay
         */
        public ReconnectPolicy build() {
            if (maxDelayMillis < initialDelayMillis) {
                throw new IllegalArgumentException("maxDelay must be >= initialDelay");
            }
            return new ReconnectPolicy(this);
        }
    }
}
