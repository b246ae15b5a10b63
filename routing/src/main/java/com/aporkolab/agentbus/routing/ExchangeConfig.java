package com.aporkolab.agentbus.routing;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named exchange that messages are published into.
 */
public class ExchangeConfig {

    private final String name;
    private final ExchangeType type;
    private final boolean durable;
    private final boolean autoDelete;
    private final Map<String, Object> arguments;

    private ExchangeConfig(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.durable = builder.durable;
        this.autoDelete = builder.autoDelete;
        this.arguments = Map.copyOf(builder.arguments);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() { return name; }
    public ExchangeType getType() { return type; }
    public boolean isDurable() { return durable; }
    public boolean isAutoDelete() { return autoDelete; }
    public Map<String, Object> getArguments() { return arguments; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExchangeConfig that)) return false;
        return durable == that.durable && autoDelete == that.autoDelete
                && name.equals(that.name) && type == that.type && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, durable, autoDelete, arguments);
    }

    @Override
    public String toString() {
        return "ExchangeConfig{name=" + name + ", type=" + type.value() + ", durable=" + durable + "}";
    }

    public static class Builder {
        private String name;
        private ExchangeType type = ExchangeType.TOPIC;
        private boolean durable = true;
        private boolean autoDelete = false;
        private Map<String, Object> arguments = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(ExchangeType type) {
            this.type = type;
            return this;
        }

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder autoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
            return this;
        }

        public Builder arguments(Map<String, Object> arguments) {
            this.arguments = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
            return this;
        }

        public Builder argument(String key, Object value) {
            this.arguments.put(key, value);
            return this;
        }

        public ExchangeConfig build() {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
            return new ExchangeConfig(this);
        }
    }
}
