package com.aporkolab.agentbus.errors;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categorizes why processing of a message failed.
 */
public enum ErrorKind {

    /** Message content was rejected; never retried */
    VALIDATION,

    /** Operation did not complete in time */
    TIMEOUT,

    /** Generic failure while processing */
    PROCESSING,

    /** Broker or peer unreachable */
    NETWORK,

    /** Credentials or permissions rejected; never retried */
    AUTHENTICATION,

    /** Throttled by a downstream service */
    RATE_LIMIT,

    /** Memory or other resource exhaustion */
    RESOURCE,

    /** Unknown/unexpected error */
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Terminal kinds are dead-lettered on first failure whatever the retry policy says.
     */
    public boolean isTerminal() {
        return this == VALIDATION || this == AUTHENTICATION;
    }

    @JsonCreator
    public static ErrorKind fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (ErrorKind kind : values()) {
            if (kind.value().equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
