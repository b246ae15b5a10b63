package com.aporkolab.agentbus.spring.autoconfigure;

import com.aporkolab.agentbus.errors.ErrorKind;
import com.aporkolab.agentbus.errors.RetryPolicy;
import com.aporkolab.agentbus.errors.RetryStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Set;

/**
 * Configuration properties for the agent bus reliability layer.
 *
 * Example application.yml:
 * <pre>
 * agentbus:
 *   enabled: true
 *   retry:
 *     max-retries: 3
 *     strategy: EXPONENTIAL
 *     initial-delay-ms: 1000
 *     max-delay-ms: 300000
 *     backoff-factor: 2.0
 *     jitter: true
 *     no-retry-on: [AUTHENTICATION]
 *   routing:
 *     config-path: config/routing.yaml
 *   dlq:
 *     monitoring-enabled: true
 *     agent-id: dlq_processor
 *     queue-name: dlq.processor
 *   scheduler:
 *     pool-size: 1
 * </pre>
 */
@ConfigurationProperties(prefix = "agentbus")
public class AgentBusProperties {

    private boolean enabled = true;
    private RetryProperties retry = new RetryProperties();
    private RoutingProperties routing = new RoutingProperties();
    private DlqProperties dlq = new DlqProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public RoutingProperties getRouting() {
        return routing;
    }

    public void setRouting(RoutingProperties routing) {
        this.routing = routing;
    }

    public DlqProperties getDlq() {
        return dlq;
    }

    public void setDlq(DlqProperties dlq) {
        this.dlq = dlq;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    // ==================== NESTED PROPERTIES CLASSES ====================

    public static class RetryProperties {
        private int maxRetries = 3;
        private RetryStrategy strategy = RetryStrategy.EXPONENTIAL;
        private long initialDelayMs = 1000;
        private long maxDelayMs = 300_000;
        private double backoffFactor = 2.0;
        private boolean jitter = true;
        private Set<ErrorKind> retryOn;
        private Set<ErrorKind> noRetryOn;

        /**
         * Builds the handler's default policy. Invalid combinations fail here, at startup.
         */
        public RetryPolicy toPolicy() {
            RetryPolicy.Builder builder = RetryPolicy.builder()
                    .maxRetries(maxRetries)
                    .strategy(strategy)
                    .initialDelay(Duration.ofMillis(initialDelayMs))
                    .maxDelay(Duration.ofMillis(maxDelayMs))
                    .backoffFactor(backoffFactor)
                    .jitter(jitter);
            if (retryOn != null && !retryOn.isEmpty()) {
                builder.retryOn(retryOn);
            }
            if (noRetryOn != null && !noRetryOn.isEmpty()) {
                builder.noRetryOn(noRetryOn);
            }
            return builder.build();
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public RetryStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(RetryStrategy strategy) {
            this.strategy = strategy;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }

        public Set<ErrorKind> getRetryOn() {
            return retryOn;
        }

        public void setRetryOn(Set<ErrorKind> retryOn) {
            this.retryOn = retryOn;
        }

        public Set<ErrorKind> getNoRetryOn() {
            return noRetryOn;
        }

        public void setNoRetryOn(Set<ErrorKind> noRetryOn) {
            this.noRetryOn = noRetryOn;
        }
    }

    public static class RoutingProperties {
        /** Optional YAML routing document; the built-in topology is used when unset. */
        private String configPath;

        public String getConfigPath() {
            return configPath;
        }

        public void setConfigPath(String configPath) {
            this.configPath = configPath;
        }
    }

    public static class DlqProperties {
        private boolean monitoringEnabled = true;
        private String agentId = "dlq_processor";
        private String queueName = "dlq.processor";

        public boolean isMonitoringEnabled() {
            return monitoringEnabled;
        }

        public void setMonitoringEnabled(boolean monitoringEnabled) {
            this.monitoringEnabled = monitoringEnabled;
        }

        public String getAgentId() {
            return agentId;
        }

        public void setAgentId(String agentId) {
            this.agentId = agentId;
        }

        public String getQueueName() {
            return queueName;
        }

        public void setQueueName(String queueName) {
            this.queueName = queueName;
        }
    }

    public static class SchedulerProperties {
        private int poolSize = 1;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
