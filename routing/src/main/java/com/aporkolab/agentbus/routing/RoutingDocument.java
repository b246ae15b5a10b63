package com.aporkolab.agentbus.routing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.aporkolab.agentbus.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serialized form of a {@link MessageRoutingConfig}.
 * Rules reference exchanges and queue configs by their table keys.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
record RoutingDocument(
        @JsonProperty("exchanges") Map<String, ExchangeEntry> exchanges,
        @JsonProperty("queue_configs") Map<String, QueueEntry> queueConfigs,
        @JsonProperty("routing_rules") Map<String, RuleEntry> routingRules,
        @JsonProperty("agent_types") Map<String, AgentTypeEntry> agentTypes
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExchangeEntry(
            @JsonProperty("name") String name,
            @JsonProperty("type") ExchangeType type,
            @JsonProperty("durable") Boolean durable,
            @JsonProperty("auto_delete") Boolean autoDelete,
            @JsonProperty("arguments") Map<String, Object> arguments
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record QueueEntry(
            @JsonProperty("name_pattern") String namePattern,
            @JsonProperty("durable") Boolean durable,
            @JsonProperty("exclusive") Boolean exclusive,
            @JsonProperty("auto_delete") Boolean autoDelete,
            @JsonProperty("max_length") Integer maxLength,
            @JsonProperty("message_ttl") Long messageTtl,
            @JsonProperty("dead_letter_exchange") String deadLetterExchange,
            @JsonProperty("dead_letter_routing_key") String deadLetterRoutingKey
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleEntry(
            @JsonProperty("pattern") String pattern,
            @JsonProperty("exchange") String exchange,
            @JsonProperty("queue_config") String queueConfig,
            @JsonProperty("description") String description,
            @JsonProperty("priority") Integer priority,
            @JsonProperty("enabled") Boolean enabled
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AgentTypeEntry(
            @JsonProperty("routing_keys") List<String> routingKeys
    ) {}

    static RoutingDocument from(MessageRoutingConfig config) {
        Map<String, ExchangeEntry> exchanges = new LinkedHashMap<>();
        config.getExchanges().forEach((key, exchange) -> exchanges.put(key, new ExchangeEntry(
                exchange.getName(),
                exchange.getType(),
                exchange.isDurable(),
                exchange.isAutoDelete(),
                exchange.getArguments().isEmpty() ? null : exchange.getArguments())));

        Map<String, QueueEntry> queues = new LinkedHashMap<>();
        config.getQueueConfigs().forEach((key, queue) -> queues.put(key, new QueueEntry(
                queue.getNameTemplate(),
                queue.isDurable(),
                queue.isExclusive(),
                queue.isAutoDelete(),
                queue.getMaxLength().orElse(null),
                queue.getMessageTtlMs().orElse(null),
                queue.getDeadLetterExchange().orElse(null),
                queue.getDeadLetterRoutingKey().orElse(null))));

        Map<String, RuleEntry> rules = new LinkedHashMap<>();
        config.getRoutingRules().forEach((key, rule) -> rules.put(key, new RuleEntry(
                rule.getPattern(),
                rule.getExchange(),
                queueConfigKey(config, rule.getQueueConfig()),
                rule.getDescription(),
                rule.getPriority(),
                rule.isEnabled())));

        Map<String, AgentTypeEntry> agentTypes = new LinkedHashMap<>();
        config.getAgentTypeBindings().forEach((type, keys) -> agentTypes.put(type, new AgentTypeEntry(keys)));

        return new RoutingDocument(exchanges, queues, rules, agentTypes.isEmpty() ? null : agentTypes);
    }

    /**
     * Build a topology from this document. Sections missing from the document are taken from {@code base}.
     *
     * @throws ConfigurationException if a rule references an unknown queue config
     */
    MessageRoutingConfig toConfig(MessageRoutingConfig base) {
        Map<String, ExchangeConfig> exchangeTable = base.getExchanges();
        if (exchanges != null) {
            exchangeTable = new LinkedHashMap<>();
            for (Map.Entry<String, ExchangeEntry> entry : exchanges.entrySet()) {
                exchangeTable.put(entry.getKey(), toExchange(entry.getKey(), entry.getValue()));
            }
        }

        Map<String, QueueConfig> queueTable = base.getQueueConfigs();
        if (queueConfigs != null) {
            queueTable = new LinkedHashMap<>();
            for (Map.Entry<String, QueueEntry> entry : queueConfigs.entrySet()) {
                queueTable.put(entry.getKey(), toQueue(entry.getKey(), entry.getValue()));
            }
        }

        Map<String, RoutingRule> ruleTable = base.getRoutingRules();
        if (routingRules != null) {
            ruleTable = new LinkedHashMap<>();
            for (Map.Entry<String, RuleEntry> entry : routingRules.entrySet()) {
                ruleTable.put(entry.getKey(), toRule(entry.getKey(), entry.getValue(), queueTable));
            }
        }

        Map<String, List<String>> bindings = base.getAgentTypeBindings();
        if (agentTypes != null) {
            bindings = new LinkedHashMap<>();
            for (Map.Entry<String, AgentTypeEntry> entry : agentTypes.entrySet()) {
                List<String> keys = entry.getValue() == null || entry.getValue().routingKeys() == null
                        ? List.of()
                        : entry.getValue().routingKeys();
                bindings.put(entry.getKey(), keys);
            }
        }

        return new MessageRoutingConfig(exchangeTable, queueTable, ruleTable, bindings);
    }

    private static ExchangeConfig toExchange(String key, ExchangeEntry entry) {
        ExchangeConfig.Builder builder = ExchangeConfig.builder()
                .name(entry.name() != null ? entry.name() : key);
        if (entry.type() != null) builder.type(entry.type());
        if (entry.durable() != null) builder.durable(entry.durable());
        if (entry.autoDelete() != null) builder.autoDelete(entry.autoDelete());
        if (entry.arguments() != null) builder.arguments(entry.arguments());
        return builder.build();
    }

    private static QueueConfig toQueue(String key, QueueEntry entry) {
        QueueConfig.Builder builder = QueueConfig.builder()
                .name(key)
                .nameTemplate(entry.namePattern())
                .maxLength(entry.maxLength())
                .messageTtlMs(entry.messageTtl())
                .deadLetterExchange(entry.deadLetterExchange())
                .deadLetterRoutingKey(entry.deadLetterRoutingKey());
        if (entry.durable() != null) builder.durable(entry.durable());
        if (entry.exclusive() != null) builder.exclusive(entry.exclusive());
        if (entry.autoDelete() != null) builder.autoDelete(entry.autoDelete());
        return builder.build();
    }

    private static RoutingRule toRule(String key, RuleEntry entry, Map<String, QueueConfig> queues) {
        QueueConfig queue = queues.get(entry.queueConfig());
        if (queue == null) {
            throw ConfigurationException.unknownReference("queue config", entry.queueConfig(), key);
        }
        RoutingRule.Builder builder = RoutingRule.builder()
                .name(key)
                .pattern(entry.pattern())
                .exchange(entry.exchange())
                .queueConfig(queue);
        if (entry.description() != null) builder.description(entry.description());
        if (entry.priority() != null) builder.priority(entry.priority());
        if (entry.enabled() != null) builder.enabled(entry.enabled());
        return builder.build();
    }

    private static String queueConfigKey(MessageRoutingConfig config, QueueConfig queue) {
        for (Map.Entry<String, QueueConfig> entry : config.getQueueConfigs().entrySet()) {
            if (entry.getValue().equals(queue)) {
                return entry.getKey();
            }
        }
        return queue.getName() != null ? queue.getName() : "unknown";
    }
}
