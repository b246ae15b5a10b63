package com.aporkolab.agentbus.spring.autoconfigure;

import com.aporkolab.agentbus.dlq.DeadLetterQueueProcessor;
import com.aporkolab.agentbus.errors.ErrorClassifier;
import com.aporkolab.agentbus.errors.ErrorHandler;
import com.aporkolab.agentbus.metrics.ReliabilityMetrics;
import com.aporkolab.agentbus.routing.MessageRoutingConfig;
import com.aporkolab.agentbus.routing.RoutingConfigLoader;
import com.aporkolab.agentbus.transport.MessageTransport;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot Auto-Configuration for the agent bus reliability layer.
 *
 * Automatically configures:
 * - Routing topology, from {@code agentbus.routing.config-path} or the built-in defaults
 * - Error classifier and the shared retry scheduler
 * - Error handler and DLQ processor, once the application provides a {@link MessageTransport}
 * - Micrometer bindings when a {@link MeterRegistry} is present
 *
 * Everything is an injectable bean; nothing is reachable through static state.
 * Disable with: agentbus.enabled=false
 */
@AutoConfiguration
@EnableConfigurationProperties(AgentBusProperties.class)
@ConditionalOnProperty(prefix = "agentbus", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentBusAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentBusAutoConfiguration.class);

    // ==================== ROUTING ====================

    @Bean
    @ConditionalOnMissingBean
    public RoutingConfigLoader routingConfigLoader() {
        return new RoutingConfigLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageRoutingConfig messageRoutingConfig(RoutingConfigLoader loader, AgentBusProperties properties) {
        String configPath = properties.getRouting().getConfigPath();
        if (configPath == null || configPath.isBlank()) {
            return MessageRoutingConfig.defaults();
        }
        return loader.load(Path.of(configPath));
    }

    // ==================== ERROR HANDLING ====================

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean(name = "agentBusRetryScheduler", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "agentBusRetryScheduler")
    public ScheduledExecutorService agentBusRetryScheduler(AgentBusProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(Math.max(1, properties.getScheduler().getPoolSize()), r -> {
            Thread t = new Thread(r, "agentbus-retry-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnBean(MessageTransport.class)
    @ConditionalOnMissingBean
    public ErrorHandler errorHandler(MessageTransport transport,
                                     ErrorClassifier classifier,
                                     ScheduledExecutorService agentBusRetryScheduler,
                                     AgentBusProperties properties) {
        return ErrorHandler.builder()
                .transport(transport)
                .classifier(classifier)
                .scheduler(agentBusRetryScheduler)
                .defaultPolicy(properties.getRetry().toPolicy())
                .build();
    }

    // ==================== DEAD LETTER QUEUE ====================

    @Bean
    @ConditionalOnBean(MessageTransport.class)
    @ConditionalOnMissingBean
    public DeadLetterQueueProcessor deadLetterQueueProcessor(MessageTransport transport, AgentBusProperties properties) {
        DeadLetterQueueProcessor processor = new DeadLetterQueueProcessor(transport);
        AgentBusProperties.DlqProperties dlq = properties.getDlq();
        if (dlq.isMonitoringEnabled()) {
            processor.startMonitoring(dlq.getAgentId(), dlq.getQueueName()).join();
            log.info("DLQ monitoring started for agent {} on queue {}", dlq.getAgentId(), dlq.getQueueName());
        }
        return processor;
    }

    // ==================== METRICS ====================

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "agentbus.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ReliabilityMetrics reliabilityMetrics(MeterRegistry registry,
                                                     ObjectProvider<ErrorHandler> errorHandler,
                                                     ObjectProvider<DeadLetterQueueProcessor> dlqProcessor) {
            ReliabilityMetrics metrics = new ReliabilityMetrics(registry);
            errorHandler.ifAvailable(metrics::bindTo);
            dlqProcessor.ifAvailable(metrics::bindTo);
            return metrics;
        }
    }
}
