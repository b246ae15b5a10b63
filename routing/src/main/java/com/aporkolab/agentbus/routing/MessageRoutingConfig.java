package com.aporkolab.agentbus.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routing topology: exchanges, queue templates, routing rules and per-agent-type bindings.
 * 
 * Design decisions:
 * - Tables keep insertion order; {@link #findRule(String)} relies on it
 * - Read-only during operation, replaced wholesale by {@link #replaceWith(MessageRoutingConfig)}
 * - Rule priority is carried for consumers of the topology but does not affect matching
 */
public class MessageRoutingConfig {

    private static final Logger log = LoggerFactory.getLogger(MessageRoutingConfig.class);

    private volatile Topology topology;

    public MessageRoutingConfig(Map<String, ExchangeConfig> exchanges,
                                Map<String, QueueConfig> queueConfigs,
                                Map<String, RoutingRule> routingRules,
                                Map<String, List<String>> agentTypeBindings) {
        this.topology = new Topology(exchanges, queueConfigs, routingRules, agentTypeBindings);
    }

    /**
     * The built-in topology used when no document is configured or loading fails.
     */
    public static MessageRoutingConfig defaults() {
        return DefaultTopology.create();
    }

    // ==================== KEY FORMATTING ====================

    /**
     * Produce a concrete routing key from a template.
     *
     * @throws MissingParameterException if a placeholder has no value
     */
    public String formatKey(String pattern, Map<String, ?> params) {
        try {
            return RoutingKeys.format(pattern, params);
        } catch (MissingParameterException e) {
            log.error("Missing parameter {} for routing pattern {}", e.getParameter(), pattern);
            throw e;
        }
    }

    /**
     * Produce a concrete queue name from a queue template.
     *
     * @throws MissingParameterException if a placeholder has no value
     */
    public String queueName(QueueConfig queueConfig, Map<String, ?> params) {
        try {
            return RoutingKeys.format(queueConfig.getNameTemplate(), params);
        } catch (MissingParameterException e) {
            log.error("Missing parameter {} for queue pattern {}", e.getParameter(), queueConfig.getNameTemplate());
            throw e;
        }
    }

    /**
     * Dead-letter routing key of a queue, empty when the queue has no dead-letter routing.
     */
    public Optional<String> deadLetterRoutingKey(QueueConfig queueConfig, Map<String, ?> params) {
        return queueConfig.getDeadLetterRoutingKey().map(template -> formatKey(template, params));
    }

    // ==================== MATCHING ====================

    /**
     * First rule, in insertion order, whose pattern structurally matches {@code routingKey}.
     * Priority and the enabled flag play no part.
     */
    public Optional<RoutingRule> findRule(String routingKey) {
        for (RoutingRule rule : topology.routingRules().values()) {
            if (rule.matches(routingKey)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #findRule(String)}, skipping rules switched off with {@code enabled: false}.
     */
    public Optional<RoutingRule> findEnabledRule(String routingKey) {
        for (RoutingRule rule : topology.routingRules().values()) {
            if (rule.isEnabled() && rule.matches(routingKey)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Subscription keys an agent registers for.
     */
    public List<String> agentRoutingKeys(String agentId, String agentType) {
        List<String> routingKeys = new ArrayList<>();
        routingKeys.add("agent." + agentId + ".*");
        if (agentType != null && !agentType.isBlank()) {
            routingKeys.add("task." + agentType + ".*");
        }
        routingKeys.add("broadcast.*");
        routingKeys.add("status." + agentId + ".*");
        routingKeys.add("error." + agentId + ".*");
        return routingKeys;
    }

    public List<String> agentRoutingKeys(String agentId) {
        return agentRoutingKeys(agentId, null);
    }

    /**
     * Bindings configured for an agent type; empty when the type is unknown.
     */
    public List<String> agentTypeRoutingKeys(String agentType) {
        return topology.agentTypeBindings().getOrDefault(agentType, List.of());
    }

    // ==================== LOOKUP ====================

    public Optional<ExchangeConfig> exchange(String key) {
        return Optional.ofNullable(topology.exchanges().get(key));
    }

    public Optional<RoutingRule> rule(String name) {
        return Optional.ofNullable(topology.routingRules().get(name));
    }

    public Optional<QueueConfig> queueConfig(String name) {
        return Optional.ofNullable(topology.queueConfigs().get(name));
    }

    public Map<String, ExchangeConfig> getExchanges() {
        return topology.exchanges();
    }

    public Map<String, QueueConfig> getQueueConfigs() {
        return topology.queueConfigs();
    }

    public Map<String, RoutingRule> getRoutingRules() {
        return topology.routingRules();
    }

    public Map<String, List<String>> getAgentTypeBindings() {
        return topology.agentTypeBindings();
    }

    // ==================== VALIDATION / RELOAD ====================

    /**
     * Consistency issues of the current topology as human-readable strings; never throws.
     */
    public List<String> validate() {
        Topology current = topology;
        List<String> issues = new ArrayList<>();

        current.routingRules().forEach((ruleName, rule) -> {
            if (!current.exchanges().containsKey(rule.getExchange())) {
                issues.add(String.format("Routing rule '%s' references unknown exchange '%s'",
                        ruleName, rule.getExchange()));
            }
        });

        Map<String, String> templates = new LinkedHashMap<>();
        current.queueConfigs().forEach((configName, config) -> {
            String previous = templates.putIfAbsent(config.getNameTemplate(), configName);
            if (previous != null) {
                issues.add(String.format("Duplicate queue pattern '%s' in configs '%s' and '%s'",
                        config.getNameTemplate(), previous, configName));
            }
        });

        return issues;
    }

    /**
     * Atomically replace every table with those of {@code source}.
     */
    public void replaceWith(MessageRoutingConfig source) {
        this.topology = source.topology;
        log.info("Routing configuration replaced: {} exchanges, {} queue configs, {} routing rules",
                topology.exchanges().size(), topology.queueConfigs().size(), topology.routingRules().size());
    }

    private record Topology(Map<String, ExchangeConfig> exchanges,
                            Map<String, QueueConfig> queueConfigs,
                            Map<String, RoutingRule> routingRules,
                            Map<String, List<String>> agentTypeBindings) {

        Topology {
            exchanges = Collections.unmodifiableMap(new LinkedHashMap<>(exchanges));
            queueConfigs = Collections.unmodifiableMap(new LinkedHashMap<>(queueConfigs));
            routingRules = Collections.unmodifiableMap(new LinkedHashMap<>(routingRules));
            Map<String, List<String>> bindings = new LinkedHashMap<>();
            if (agentTypeBindings != null) {
                agentTypeBindings.forEach((type, keys) -> bindings.put(type, List.copyOf(keys)));
            }
            agentTypeBindings = Collections.unmodifiableMap(bindings);
        }
    }
}
