package io.liquidenergy.infrastructure.common;

import java.time.Duration;

/**
 * Retry budget and backoff schedule for repeated connection attempts.
 *
 * Immutable: callers count their own failures and ask the policy whether
 * another attempt is allowed and how long to wait before it. Retry {@code n}
 * (1-based) waits {@code initialDelay * multiplier^(n-1)}, capped at
 * {@code maxDelay}.
 *
 * <pre>
 * int failures = 0;
 * while (true) {
 *     try {
 *         client.connect();
 *         return;
 *     } catch (HummingbotConnectionException e) {
 *         failures++;
 *         if (!policy.allowsRetry(failures)) throw e;
 *         Thread.sleep(policy.delayBeforeRetry(failures).toMillis());
 *     }
 * }
 * </pre>
 */
public final class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxRetries;

    private ReconnectionPolicy(Builder b) {
        this.initialDelay = b.initialDelay;
        this.maxDelay = b.maxDelay;
        this.multiplier = b.multiplier;
        this.maxRetries = b.maxRetries;
    }

    /**
     * Whether another attempt may follow {@code failedAttempts} consecutive
     * failures.
     */
    public boolean allowsRetry(int failedAttempts) {
        return failedAttempts <= maxRetries;
    }

    /**
     * Wait before retry number {@code retry}, counting from 1.
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("Retry number must be at least 1, got " + retry);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxRetries = 3;

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

        /**
         * Attempts allowed after the first one; 0 disables retrying.
         */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries cannot be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(this);
        }
    }
}
