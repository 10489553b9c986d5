package in.signalbridge.infrastructure.common;

import java.time.Duration;

/**
 * Attempt cap plus delay schedule for retried operations.
 *
 * Immutable; callers track their own attempt counter so one policy can be
 * shared by concurrent executions.
 *
 * <pre>
 * LINEAR       delay(n) = initialDelay * n
 * EXPONENTIAL  delay(n) = initialDelay * multiplier^(n-1)
 * </pre>
 * where {@code n} is the number of attempts that have failed so far. Delays are
 * capped at {@code maxDelay}.
 *
 * Usage:
 * <pre>
 * BackoffPolicy policy = BackoffPolicy.forOrderPlacement();
 * for (int attempt = 1; ; attempt++) {
 *     try {
 *         return placeOrder();
 *     } catch (TransientException e) {
 *         if (!policy.shouldRetry(attempt)) throw e;
 *         Thread.sleep(policy.delayAfter(attempt).toMillis());
 *     }
 * }
 * </pre>
 */
public final class BackoffPolicy {

    public enum Mode {
        LINEAR,
        EXPONENTIAL
    }

    private final Mode mode;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private BackoffPolicy(Mode mode, Duration initialDelay, Duration maxDelay,
                          double multiplier, int maxAttempts) {
        this.mode = mode;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param failedAttempts attempts made so far, all of which failed
     * @return true if another attempt is allowed
     */
    public boolean shouldRetry(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    /**
     * Delay to wait after the given number of failed attempts.
     */
    public Duration delayAfter(int failedAttempts) {
        if (failedAttempts < 1) {
            return Duration.ZERO;
        }
        double factor = mode == Mode.LINEAR
            ? failedAttempts
            : Math.pow(multiplier, failedAttempts - 1);
        long millis = (long) (initialDelay.toMillis() * factor);
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    public Mode getMode() {
        return mode;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Market-data connection attempts: 3 tries, 2s then 4s.
     */
    public static BackoffPolicy forQuoteConnection() {
        return builder()
            .mode(Mode.LINEAR)
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(30))
            .maxAttempts(3)
            .build();
    }

    /**
     * Order placement attempts inside one execution: 3 tries, 2s then 4s.
     */
    public static BackoffPolicy forOrderPlacement() {
        return builder()
            .mode(Mode.LINEAR)
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(30))
            .maxAttempts(3)
            .build();
    }

    /**
     * Queue-level re-delivery of transiently failed jobs: 3 retries at 2s, 4s, 8s.
     */
    public static BackoffPolicy forQueueRetry() {
        return builder()
            .mode(Mode.EXPONENTIAL)
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofMinutes(1))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    /**
     * Builder for BackoffPolicy.
     */
    public static class Builder {
        private Mode mode = Mode.EXPONENTIAL;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

        public Builder mode(Mode mode) {
            if (mode == null) {
                throw new IllegalArgumentException("Mode cannot be null");
            }
            this.mode = mode;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public BackoffPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new BackoffPolicy(mode, initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
