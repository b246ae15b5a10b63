package com.aporkolab.agentbus.exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for all agent bus exceptions.
 * 
 * Provides:
 * - Error code for programmatic handling
 * - Structured context for debugging
 * - Timestamp for correlation with DLQ entries and logs
 */
public abstract class MessagingException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected MessagingException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    protected MessagingException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Fluent API for chaining.
     */
    public MessagingException with(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
