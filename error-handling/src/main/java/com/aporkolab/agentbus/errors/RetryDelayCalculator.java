package com.aporkolab.agentbus.errors;

import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the wait before a retry from the record's retry count and the policy's strategy.
 * 
 * Jitter multiplies the computed delay by a uniform factor in [0.8, 1.2); the result is
 * clamped to [0, maxDelay]. Custom handlers go through the same jitter and clamp.
 */
public class RetryDelayCalculator {

    private static final Logger log = LoggerFactory.getLogger(RetryDelayCalculator.class);

    private static final double JITTER_MIN = 0.8;
    private static final double JITTER_SPREAD = 0.4;
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final Random random;
    private final Map<String, CustomRetryHandler> customHandlers = new ConcurrentHashMap<>();

    public RetryDelayCalculator() {
        this(new Random());
    }

    public RetryDelayCalculator(Random random) {
        this.random = random;
    }

    /**
     * Register a handler under {@code "<originId>_<kind>"}, e.g. {@code "worker_1_network"}.
     */
    public void registerCustomHandler(String name, CustomRetryHandler handler) {
        customHandlers.put(name, handler);
        log.debug("Registered custom retry handler {}", name);
    }

    public static String customHandlerKey(String originId, ErrorKind kind) {
        return originId + "_" + kind.value();
    }

    public Duration calculate(ErrorRecord record, RetryPolicy policy) {
        double seconds;
        switch (policy.getStrategy()) {
            case NONE:
            case IMMEDIATE:
                return Duration.ZERO;
            case LINEAR:
                seconds = toSeconds(policy.getInitialDelay()) * (record.getRetryCount() + 1);
                break;
            case CUSTOM:
                seconds = customDelay(record, policy);
                break;
            case EXPONENTIAL:
            default:
                seconds = exponential(record, policy);
                break;
        }

        if (policy.isJitter()) {
            seconds *= JITTER_MIN + random.nextDouble() * JITTER_SPREAD;
        }

        double bounded = Math.min(Math.max(seconds, 0.0), toSeconds(policy.getMaxDelay()));
        return Duration.ofNanos(Math.round(bounded * NANOS_PER_SECOND));
    }

    private double customDelay(ErrorRecord record, RetryPolicy policy) {
        CustomRetryHandler handler = customHandlers.get(customHandlerKey(record.getOriginId(), record.getKind()));
        if (handler == null) {
            return exponential(record, policy);
        }
        Duration delay = handler.computeDelay(record, policy);
        return delay == null ? 0.0 : toSeconds(delay);
    }

    private static double exponential(ErrorRecord record, RetryPolicy policy) {
        return toSeconds(policy.getInitialDelay()) * Math.pow(policy.getBackoffFactor(), record.getRetryCount());
    }

    static double toSeconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / NANOS_PER_SECOND;
    }
}
