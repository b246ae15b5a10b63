package com.aporkolab.agentbus.transport;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a {@link MessageTransport} needs to publish one message.
 * Metadata given here travels with the message, which is how retry provenance
 * ({@code retry_count}, {@code error_history}) survives a re-publish.
 */
public class PublishRequest {

    public static final String DEFAULT_RECIPIENT = "*";
    public static final String DEFAULT_MESSAGE_TYPE = "general";
    public static final int DEFAULT_PRIORITY = 5;

    private final String routingKey;
    private final Map<String, Object> payload;
    private final String senderId;
    private final String recipientId;
    private final String messageType;
    private final int priority;
    private final String correlationId;
    private final String replyTo;
    private final Map<String, Object> metadata;

    private PublishRequest(Builder builder) {
        this.routingKey = builder.routingKey;
        this.payload = builder.payload;
        this.senderId = builder.senderId;
        this.recipientId = builder.recipientId;
        this.messageType = builder.messageType;
        this.priority = builder.priority;
        this.correlationId = builder.correlationId;
        this.replyTo = builder.replyTo;
        this.metadata = builder.metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRoutingKey() { return routingKey; }
    public Map<String, Object> getPayload() { return payload; }
    public String getSenderId() { return senderId; }
    public String getRecipientId() { return recipientId; }
    public String getMessageType() { return messageType; }
    public int getPriority() { return priority; }
    public String getCorrelationId() { return correlationId; }
    public String getReplyTo() { return replyTo; }
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public String toString() {
        return "PublishRequest{routingKey=" + routingKey + ", sender=" + senderId + ", recipient=" + recipientId
                + ", type=" + messageType + ", priority=" + priority + "}";
    }

    public static class Builder {
        private String routingKey;
        private Map<String, Object> payload = new LinkedHashMap<>();
        private String senderId;
        private String recipientId = DEFAULT_RECIPIENT;
        private String messageType = DEFAULT_MESSAGE_TYPE;
        private int priority = DEFAULT_PRIORITY;
        private String correlationId;
        private String replyTo;
        private Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
            return this;
        }

        public Builder senderId(String senderId) {
            this.senderId = senderId;
            return this;
        }

        public Builder recipientId(String recipientId) {
            this.recipientId = recipientId;
            return this;
        }

        public Builder messageType(String messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder replyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
            return this;
        }

        public PublishRequest build() {
            Objects.requireNonNull(routingKey, "routingKey");
            Objects.requireNonNull(senderId, "senderId");
            return new PublishRequest(this);
        }
    }
}
