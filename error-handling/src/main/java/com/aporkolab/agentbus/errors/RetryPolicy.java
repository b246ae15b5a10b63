package com.aporkolab.agentbus.errors;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable retry configuration.
 * 
 * Defaults: 3 retries, exponential backoff from 1s doubling up to 5 minutes, with jitter.
 * When a kind is in both {@code retryOn} and {@code noRetryOn} the deny-list wins.
 */
public class RetryPolicy {

    private static final RetryPolicy DEFAULT = builder().build();

    private final int maxRetries;
    private final RetryStrategy strategy;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double backoffFactor;
    private final boolean jitter;
    private final Set<ErrorKind> retryOn;
    private final Set<ErrorKind> noRetryOn;

    private RetryPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.strategy = builder.strategy;
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.backoffFactor = builder.backoffFactor;
        this.jitter = builder.jitter;
        this.retryOn = builder.retryOn == null ? null : Set.copyOf(builder.retryOn);
        this.noRetryOn = builder.noRetryOn == null ? null : Set.copyOf(builder.noRetryOn);
    }

    public static RetryPolicy defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxRetries() { return maxRetries; }
    public RetryStrategy getStrategy() { return strategy; }
    public Duration getInitialDelay() { return initialDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getBackoffFactor() { return backoffFactor; }
    public boolean isJitter() { return jitter; }
    public Optional<Set<ErrorKind>> getRetryOn() { return Optional.ofNullable(retryOn); }
    public Optional<Set<ErrorKind>> getNoRetryOn() { return Optional.ofNullable(noRetryOn); }

    /**
     * Whether a failure of {@code kind} after {@code retryCount} retries may be retried again.
     */
    public boolean allowsRetry(ErrorKind kind, int retryCount) {
        if (retryCount >= maxRetries) {
            return false;
        }
        if (noRetryOn != null && noRetryOn.contains(kind)) {
            return false;
        }
        if (retryOn != null && !retryOn.contains(kind)) {
            return false;
        }
        return !kind.isTerminal();
    }

    public Builder toBuilder() {
        Builder builder = builder()
                .maxRetries(maxRetries)
                .strategy(strategy)
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .backoffFactor(backoffFactor)
                .jitter(jitter);
        builder.retryOn = retryOn;
        builder.noRetryOn = noRetryOn;
        return builder;
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy{maxRetries=%d, strategy=%s, initialDelay=%s, maxDelay=%s, "
                        + "backoffFactor=%.2f, jitter=%s, retryOn=%s, noRetryOn=%s}",
                maxRetries, strategy, initialDelay, maxDelay, backoffFactor, jitter, retryOn, noRetryOn);
    }

    public static class Builder {
        private int maxRetries = 3;
        private RetryStrategy strategy = RetryStrategy.EXPONENTIAL;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double backoffFactor = 2.0;
        private boolean jitter = true;
        private Set<ErrorKind> retryOn;
        private Set<ErrorKind> noRetryOn;

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder strategy(RetryStrategy strategy) {
            if (strategy == null) {
                throw new IllegalArgumentException("strategy must not be null");
            }
            this.strategy = strategy;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("initialDelay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay == null || maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffFactor(double backoffFactor) {
            if (backoffFactor <= 1.0) {
                throw new IllegalArgumentException("backoffFactor must be greater than 1");
            }
            this.backoffFactor = backoffFactor;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * Allow-list; only these kinds are retried. {@code null} or empty allows every kind.
         */
        public Builder retryOn(Collection<ErrorKind> kinds) {
            this.retryOn = copy(kinds);
            return this;
        }

        public Builder retryOn(ErrorKind first, ErrorKind... rest) {
            this.retryOn = EnumSet.of(first, rest);
            return this;
        }

        /**
         * Deny-list; these kinds are never retried. {@code null} or empty denies nothing.
         */
        public Builder noRetryOn(Collection<ErrorKind> kinds) {
            this.noRetryOn = copy(kinds);
            return this;
        }

        public Builder noRetryOn(ErrorKind first, ErrorKind... rest) {
            this.noRetryOn = EnumSet.of(first, rest);
            return this;
        }

        private static Set<ErrorKind> copy(Collection<ErrorKind> kinds) {
            return kinds == null || kinds.isEmpty() ? null : EnumSet.copyOf(kinds);
        }

        public RetryPolicy build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
            }
            return new RetryPolicy(this);
        }
    }
}
