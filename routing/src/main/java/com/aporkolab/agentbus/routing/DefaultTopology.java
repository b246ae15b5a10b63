package com.aporkolab.agentbus.routing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in topology for agent messaging.
 */
final class DefaultTopology {

    private static final Logger log = LoggerFactory.getLogger(DefaultTopology.class);

    static final String DLX_EXCHANGE_NAME = "agentbus.agents.dlx";

    private DefaultTopology() {
    }

    static MessageRoutingConfig create() {
        log.info("Setting up default message routing configuration");

        Map<String, ExchangeConfig> exchanges = new LinkedHashMap<>();
        exchanges.put("agents", exchange("agentbus.agents", ExchangeType.TOPIC,
                "Main exchange for agent communication"));
        exchanges.put("broadcast", exchange("agentbus.broadcast", ExchangeType.FANOUT,
                "Broadcast exchange for system messages"));
        exchanges.put("system", exchange("agentbus.system", ExchangeType.DIRECT,
                "System commands and control messages"));
        exchanges.put("dlx", exchange(DLX_EXCHANGE_NAME, ExchangeType.TOPIC,
                "Dead letter exchange for failed messages"));

        Map<String, QueueConfig> queues = new LinkedHashMap<>();
        queues.put("agent_direct", QueueConfig.builder()
                .name("agent_direct")
                .nameTemplate("agent.{agent_id}")
                .messageTtlMs(3_600_000L)
                .deadLetterExchange(DLX_EXCHANGE_NAME)
                .deadLetterRoutingKey("failed.{agent_id}")
                .build());
        queues.put("agent_tasks", QueueConfig.builder()
                .name("agent_tasks")
                .nameTemplate("agent.{agent_id}.tasks")
                .maxLength(1000)
                .messageTtlMs(7_200_000L)
                .deadLetterExchange(DLX_EXCHANGE_NAME)
                .deadLetterRoutingKey("failed.{agent_id}.tasks")
                .build());
        queues.put("broadcast", QueueConfig.builder()
                .name("broadcast")
                .nameTemplate("broadcast.{agent_id}")
                .durable(false)
                .autoDelete(true)
                .messageTtlMs(300_000L)
                .build());
        queues.put("system", QueueConfig.builder()
                .name("system")
                .nameTemplate("system.{component}")
                .messageTtlMs(1_800_000L)
                .deadLetterExchange(DLX_EXCHANGE_NAME)
                .deadLetterRoutingKey("failed.system.{component}")
                .build());
        queues.put("responses", QueueConfig.builder()
                .name("responses")
                .nameTemplate("response.{agent_id}.{correlation_id}")
                .durable(false)
                .exclusive(true)
                .autoDelete(true)
                .messageTtlMs(30_000L)
                .build());
        queues.put("dlx", QueueConfig.builder()
                .name("dlx")
                .nameTemplate("dlx.{original_routing_key}")
                .messageTtlMs(86_400_000L)
                .build());

        Map<String, RoutingRule> rules = new LinkedHashMap<>();
        rules.put("agent_direct", rule("agent_direct", "agent.{agent_id}.{message_type}", "agents",
                queues.get("agent_direct"), "Direct communication to specific agents", 10));
        rules.put("agent_tasks", rule("agent_tasks", "task.{agent_type}.{task_type}", "agents",
                queues.get("agent_tasks"), "Task distribution by agent and task type", 9));
        rules.put("broadcast_all", rule("broadcast_all", "broadcast.{message_type}", "broadcast",
                queues.get("broadcast"), "Broadcast messages to all agents", 7));
        rules.put("system_commands", rule("system_commands", "system.{command}", "system",
                queues.get("system"), "System-level commands and control", 8));
        rules.put("responses", rule("responses", "response.{agent_id}.{correlation_id}", "agents",
                queues.get("responses"), "Response messages for request-reply pattern", 10));
        rules.put("error_handling", rule("error_handling", "error.{agent_id}.{error_type}", "agents",
                queues.get("agent_direct"), "Error notification and handling", 6));
        rules.put("status_updates", rule("status_updates", "status.{agent_id}.{status_type}", "agents",
                queues.get("agent_direct"), "Agent status updates and heartbeats", 5));
        rules.put("dlx_routing", rule("dlx_routing", "failed.{original_routing_key}", "dlx",
                queues.get("dlx"), "Dead letter queue for failed messages", 1));

        Map<String, List<String>> agentTypes = new LinkedHashMap<>();
        agentTypes.put("cto", List.of("agent.cto.*", "task.management.*", "broadcast.*",
                "system.planning", "status.team.*"));
        agentTypes.put("backend", List.of("agent.backend.*", "task.backend.*", "task.api.*",
                "task.database.*", "broadcast.*"));
        agentTypes.put("frontend", List.of("agent.frontend.*", "task.frontend.*", "task.ui.*",
                "task.components.*", "broadcast.*"));
        agentTypes.put("qa", List.of("agent.qa.*", "task.testing.*", "task.quality.*",
                "broadcast.*", "error.*.*"));
        agentTypes.put("devops", List.of("agent.devops.*", "task.deployment.*", "task.infrastructure.*",
                "system.*", "broadcast.*"));

        return new MessageRoutingConfig(exchanges, queues, rules, agentTypes);
    }

    private static ExchangeConfig exchange(String name, ExchangeType type, String description) {
        return ExchangeConfig.builder()
                .name(name)
                .type(type)
                .argument("description", description)
                .build();
    }

    private static RoutingRule rule(String name, String pattern, String exchange, QueueConfig queue,
                                    String description, int priority) {
        return RoutingRule.builder()
                .name(name)
                .pattern(pattern)
                .exchange(exchange)
                .queueConfig(queue)
                .description(description)
                .priority(priority)
                .build();
    }
}
