package com.aporkolab.agentbus.errors;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.aporkolab.agentbus.transport.AgentMessage;

/**
 * One failure event: what went wrong, who was processing, and where the message stood in its retry budget.
 */
public class ErrorRecord {

    private final ErrorKind kind;
    private final String messageText;
    private final Instant occurredAt;
    private final String originId;
    private final AgentMessage originalMessage;
    private final int retryCount;
    private final int maxRetries;
    private final RetryStrategy strategy;
    private final String trace;

    private ErrorRecord(Builder builder) {
        this.kind = builder.kind;
        this.messageText = builder.messageText;
        this.occurredAt = builder.occurredAt;
        this.originId = builder.originId;
        this.originalMessage = builder.originalMessage;
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.strategy = builder.strategy;
        this.trace = builder.trace;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ErrorKind getKind() { return kind; }
    public String getMessageText() { return messageText; }
    public Instant getOccurredAt() { return occurredAt; }
    public String getOriginId() { return originId; }
    public AgentMessage getOriginalMessage() { return originalMessage; }
    public int getRetryCount() { return retryCount; }
    public int getMaxRetries() { return maxRetries; }
    public RetryStrategy getStrategy() { return strategy; }
    public Optional<String> getTrace() { return Optional.ofNullable(trace); }

    /**
     * Summary appended to the message's {@code error_history}.
     */
    public Map<String, Object> toHistoryEntry() {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("error_type", kind.value());
        entry.put("error_message", messageText);
        entry.put("timestamp", occurredAt.toString());
        entry.put("retry_count", retryCount);
        return entry;
    }

    @Override
    public String toString() {
        return String.format("ErrorRecord{kind=%s, origin=%s, retry=%d/%d, message='%s'}",
                kind.value(), originId, retryCount, maxRetries, messageText);
    }

    public static class Builder {
        private ErrorKind kind = ErrorKind.UNKNOWN;
        private String messageText = "";
        private Instant occurredAt = Instant.now();
        private String originId;
        private AgentMessage originalMessage;
        private int retryCount;
        private int maxRetries;
        private RetryStrategy strategy = RetryStrategy.EXPONENTIAL;
        private String trace;

        public Builder kind(ErrorKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder messageText(String messageText) {
            this.messageText = messageText != null ? messageText : "";
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder originId(String originId) {
            this.originId = originId;
            return this;
        }

        public Builder originalMessage(AgentMessage originalMessage) {
            this.originalMessage = originalMessage;
            return this;
        }

        public Builder retryCount(int retryCount) {
            if (retryCount < 0) {
                throw new IllegalArgumentException("retryCount must not be negative");
            }
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder strategy(RetryStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder trace(String trace) {
            this.trace = trace;
            return this;
        }

        public ErrorRecord build() {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(occurredAt, "occurredAt");
            Objects.requireNonNull(originId, "originId");
            Objects.requireNonNull(originalMessage, "originalMessage");
            return new ErrorRecord(this);
        }
    }
}
