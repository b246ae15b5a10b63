package com.aporkolab.agentbus.routing;

import java.util.Objects;
import java.util.Optional;

/**
 * Parameterized queue naming plus its retention and dead-letter policy.
 * {@code nameTemplate} and {@code deadLetterRoutingKey} use {@code {placeholder}} segments.
 */
public class QueueConfig {

    private final String name;
    private final String nameTemplate;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final Integer maxLength;
    private final Long messageTtlMs;
    private final String deadLetterExchange;
    private final String deadLetterRoutingKey;

    private QueueConfig(Builder builder) {
        this.name = builder.name;
        this.nameTemplate = builder.nameTemplate;
        this.durable = builder.durable;
        this.exclusive = builder.exclusive;
        this.autoDelete = builder.autoDelete;
        this.maxLength = builder.maxLength;
        this.messageTtlMs = builder.messageTtlMs;
        this.deadLetterExchange = builder.deadLetterExchange;
        this.deadLetterRoutingKey = builder.deadLetterRoutingKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Key of this config in the topology table. */
    public String getName() { return name; }
    public String getNameTemplate() { return nameTemplate; }
    public boolean isDurable() { return durable; }
    public boolean isExclusive() { return exclusive; }
    public boolean isAutoDelete() { return autoDelete; }
    public Optional<Integer> getMaxLength() { return Optional.ofNullable(maxLength); }
    public Optional<Long> getMessageTtlMs() { return Optional.ofNullable(messageTtlMs); }
    public Optional<String> getDeadLetterExchange() { return Optional.ofNullable(deadLetterExchange); }
    public Optional<String> getDeadLetterRoutingKey() { return Optional.ofNullable(deadLetterRoutingKey); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueueConfig that)) return false;
        return durable == that.durable && exclusive == that.exclusive && autoDelete == that.autoDelete
                && Objects.equals(name, that.name) && nameTemplate.equals(that.nameTemplate)
                && Objects.equals(maxLength, that.maxLength) && Objects.equals(messageTtlMs, that.messageTtlMs)
                && Objects.equals(deadLetterExchange, that.deadLetterExchange)
                && Objects.equals(deadLetterRoutingKey, that.deadLetterRoutingKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, nameTemplate, durable, exclusive, autoDelete, maxLength, messageTtlMs,
                deadLetterExchange, deadLetterRoutingKey);
    }

    @Override
    public String toString() {
        return "QueueConfig{name=" + name + ", template=" + nameTemplate + "}";
    }

    public static class Builder {
        private String name;
        private String nameTemplate;
        private boolean durable = true;
        private boolean exclusive = false;
        private boolean autoDelete = false;
        private Integer maxLength;
        private Long messageTtlMs;
        private String deadLetterExchange;
        private String deadLetterRoutingKey;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder nameTemplate(String nameTemplate) {
            this.nameTemplate = nameTemplate;
            return this;
        }

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder autoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
            return this;
        }

        public Builder maxLength(Integer maxLength) {
            if (maxLength != null && maxLength < 0) {
                throw new IllegalArgumentException("maxLength must not be negative");
            }
            this.maxLength = maxLength;
            return this;
        }

        public Builder messageTtlMs(Long messageTtlMs) {
            if (messageTtlMs != null && messageTtlMs < 0) {
                throw new IllegalArgumentException("messageTtlMs must not be negative");
            }
            this.messageTtlMs = messageTtlMs;
            return this;
        }

        public Builder deadLetterExchange(String deadLetterExchange) {
            this.deadLetterExchange = deadLetterExchange;
            return this;
        }

        public Builder deadLetterRoutingKey(String deadLetterRoutingKey) {
            this.deadLetterRoutingKey = deadLetterRoutingKey;
            return this;
        }

        public QueueConfig build() {
            Objects.requireNonNull(nameTemplate, "nameTemplate");
            return new QueueConfig(this);
        }
    }
}
