package com.aporkolab.agentbus.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Metadata keys shared between the transport and the retry machinery, with typed accessors.
 */
public final class MessageMetadata {

    public static final String RETRY_COUNT = "retry_count";
    public static final String RETRY_DELAY = "retry_delay";
    public static final String ERROR_HISTORY = "error_history";
    public static final String ROUTING_KEY = "routing_key";
    public static final String PUBLISHED_AT = "published_at";

    private MessageMetadata() {
    }

    /**
     * Retries already performed for this message; 0 when never retried.
     */
    public static int retryCount(AgentMessage message) {
        Object value = message.getMetadata().get(RETRY_COUNT);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Integer.parseInt(text.trim());
        }
        return 0;
    }

    public static String routingKey(AgentMessage message) {
        Object value = message.getMetadata().get(ROUTING_KEY);
        return value != null ? value.toString() : null;
    }

    /**
     * Mutable error history list stored in the metadata, created on first access.
     * A list read from the wire is replaced by a string-keyed copy; entries that are not maps are dropped.
     */
    public static List<Map<String, Object>> errorHistory(AgentMessage message) {
        List<Map<String, Object>> history = new ArrayList<>();
        Object value = message.getMetadata().get(ERROR_HISTORY);
        if (value instanceof List<?> list) {
            for (Object entry : list) {
                if (entry instanceof Map<?, ?> map) {
                    history.add(AgentMessage.deepCopyMap(map));
                }
            }
        }
        message.getMetadata().put(ERROR_HISTORY, history);
        return history;
    }
}
