package com.aporkolab.agentbus.routing;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Broker exchange kinds.
 */
public enum ExchangeType {

    DIRECT,
    TOPIC,
    FANOUT,
    HEADERS;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExchangeType fromValue(String value) {
        for (ExchangeType type : values()) {
            if (type.value().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown exchange type: " + value);
    }
}
