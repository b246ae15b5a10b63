package com.aporkolab.agentbus.logging;

import java.util.Map;

import org.slf4j.MDC;

/**
 * Scopes the identity of the message being handled into the MDC, so every log line
 * written while handling, retrying or dead-lettering it can be traced back to it.
 * 
 * Usage:
 * <pre>
 * try (var ctx = MessageContext.open(messageId).withOrigin(agentId).withRoutingKey(key)) {
 *     log.error("Processing failed"); // Logs include messageId, originId, routingKey
 * }
 * </pre>
 * 
 * Closing restores whatever MDC content was present before the scope was opened.
 */
public class MessageContext implements AutoCloseable {

    public static final String MESSAGE_ID_KEY = "messageId";
    public static final String ORIGIN_ID_KEY = "originId";
    public static final String ROUTING_KEY_KEY = "routingKey";
    public static final String ERROR_KIND_KEY = "errorKind";

    static final String UNKNOWN_MESSAGE_ID = "unknown";

    private final Map<String, String> previousContext;

    private MessageContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    /**
     * Opens a scope for the given message id. A missing id is logged as {@code unknown}.
     */
    public static MessageContext open(String messageId) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        MDC.put(MESSAGE_ID_KEY, messageId == null || messageId.isBlank() ? UNKNOWN_MESSAGE_ID : messageId);
        return new MessageContext(previous);
    }

    public static String getCurrentMessageId() {
        return MDC.get(MESSAGE_ID_KEY);
    }

    public static String getCurrentOriginId() {
        return MDC.get(ORIGIN_ID_KEY);
    }

    public static String getCurrentRoutingKey() {
        return MDC.get(ROUTING_KEY_KEY);
    }

    /**
     * Sets an additional context value. Null values are ignored.
     */
    public MessageContext with(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
        return this;
    }

    public MessageContext withOrigin(String originId) {
        return with(ORIGIN_ID_KEY, originId);
    }

    public MessageContext withRoutingKey(String routingKey) {
        return with(ROUTING_KEY_KEY, routingKey);
    }

    public MessageContext withErrorKind(String errorKind) {
        return with(ERROR_KIND_KEY, errorKind);
    }

    /**
     * Wraps a Runnable so it runs with the MDC captured at wrap time,
     * e.g. a retry publish that fires later on a scheduler thread.
     */
    public static Runnable wrap(Runnable runnable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                } else {
                    MDC.clear();
                }
                runnable.run();
            } finally {
                restore(previous);
            }
        };
    }

    @Override
    public void close() {
        restore(previousContext);
    }

    private static void restore(Map<String, String> context) {
        if (context != null) {
            MDC.setContextMap(context);
        } else {
            MDC.clear();
        }
    }
}
