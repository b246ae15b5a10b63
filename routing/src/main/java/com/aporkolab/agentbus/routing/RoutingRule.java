package com.aporkolab.agentbus.routing;

import java.util.Objects;

/**
 * Binds a routing-key pattern to an exchange (by its topology key) and a queue template.
 */
public class RoutingRule {

    private final String name;
    private final String pattern;
    private final String exchange;
    private final QueueConfig queueConfig;
    private final String description;
    private final int priority;
    private final boolean enabled;

    private RoutingRule(Builder builder) {
        this.name = builder.name;
        this.pattern = builder.pattern;
        this.exchange = builder.exchange;
        this.queueConfig = builder.queueConfig;
        this.description = builder.description;
        this.priority = builder.priority;
        this.enabled = builder.enabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() { return name; }
    public String getPattern() { return pattern; }
    public String getExchange() { return exchange; }
    public QueueConfig getQueueConfig() { return queueConfig; }
    public String getDescription() { return description; }
    public int getPriority() { return priority; }
    public boolean isEnabled() { return enabled; }

    /**
     * True when {@code routingKey} has the same number of segments as the pattern and
     * every literal segment is equal. Placeholder segments match any single segment.
     */
    public boolean matches(String routingKey) {
        return RoutingKeys.matches(pattern, routingKey);
    }

    @Override
    public String toString() {
        return "RoutingRule{name=" + name + ", pattern=" + pattern + ", exchange=" + exchange
                + ", priority=" + priority + ", enabled=" + enabled + "}";
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String exchange;
        private QueueConfig queueConfig;
        private String description = "";
        private int priority = 5;
        private boolean enabled = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder queueConfig(QueueConfig queueConfig) {
            this.queueConfig = queueConfig;
            return this;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public RoutingRule build() {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(exchange, "exchange");
            Objects.requireNonNull(queueConfig, "queueConfig");
            return new RoutingRule(this);
        }
    }
}
