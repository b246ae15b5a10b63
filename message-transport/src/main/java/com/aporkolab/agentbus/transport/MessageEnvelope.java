package com.aporkolab.agentbus.transport;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Addressing and identity of an {@link AgentMessage}.
 * Fields other than {@code id} may be absent on messages reconstructed from foreign producers,
 * so consumers apply their own defaults.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageEnvelope {

    @JsonProperty("id")
    private String id;
    @JsonProperty("sender_id")
    private String senderId;
    @JsonProperty("recipient_id")
    private String recipientId;
    @JsonProperty("message_type")
    private String messageType;
    @JsonProperty("priority")
    private Integer priority;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("expires_at")
    private Instant expiresAt;
    @JsonProperty("correlation_id")
    private String correlationId;
    @JsonProperty("reply_to")
    private String replyTo;

    private MessageEnvelope() {}

    public static Builder builder() {
        return new Builder();
    }

    public String getId() { return id; }
    public String getSenderId() { return senderId; }
    public String getRecipientId() { return recipientId; }
    public String getMessageType() { return messageType; }
    public Integer getPriority() { return priority; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public String getCorrelationId() { return correlationId; }
    public String getReplyTo() { return replyTo; }

    public String getSenderIdOrDefault(String fallback) {
        return senderId != null ? senderId : fallback;
    }

    public String getRecipientIdOrDefault(String fallback) {
        return recipientId != null ? recipientId : fallback;
    }

    public String getMessageTypeOrDefault(String fallback) {
        return messageType != null ? messageType : fallback;
    }

    public int getPriorityOrDefault(int fallback) {
        return priority != null ? priority : fallback;
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .senderId(senderId)
                .recipientId(recipientId)
                .messageType(messageType)
                .priority(priority)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .correlationId(correlationId)
                .replyTo(replyTo);
    }

    @Override
    public String toString() {
        return "MessageEnvelope{id=" + id + ", sender=" + senderId + ", recipient=" + recipientId
                + ", type=" + messageType + ", priority=" + priority + "}";
    }

    public static class Builder {
        private final MessageEnvelope envelope = new MessageEnvelope();

        public Builder id(String id) {
            envelope.id = id;
            return this;
        }

        public Builder senderId(String senderId) {
            envelope.senderId = senderId;
            return this;
        }

        public Builder recipientId(String recipientId) {
            envelope.recipientId = recipientId;
            return this;
        }

        public Builder messageType(String messageType) {
            envelope.messageType = messageType;
            return this;
        }

        public Builder priority(Integer priority) {
            envelope.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            envelope.createdAt = createdAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            envelope.expiresAt = expiresAt;
            return this;
        }

        public Builder correlationId(String correlationId) {
            envelope.correlationId = correlationId;
            return this;
        }

        public Builder replyTo(String replyTo) {
            envelope.replyTo = replyTo;
            return this;
        }

        public MessageEnvelope build() {
            return envelope;
        }
    }
}
