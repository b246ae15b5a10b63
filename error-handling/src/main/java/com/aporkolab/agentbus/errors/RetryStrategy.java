package com.aporkolab.agentbus.errors;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the delay before a retry grows with the retry count.
 */
public enum RetryStrategy {

    /** No wait */
    NONE,

    /** No wait */
    IMMEDIATE,

    /** initialDelay * (n + 1) */
    LINEAR,

    /** initialDelay * backoffFactor^n */
    EXPONENTIAL,

    /** Registered {@link CustomRetryHandler}, exponential when none matches */
    CUSTOM;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
