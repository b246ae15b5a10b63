package com.aporkolab.agentbus.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.aporkolab.agentbus.dlq.DeadLetterQueueProcessor;
import com.aporkolab.agentbus.dlq.DlqReport;
import com.aporkolab.agentbus.errors.ErrorHandler;
import com.aporkolab.agentbus.errors.ErrorKind;
import com.aporkolab.agentbus.errors.RetryPolicy;
import com.aporkolab.agentbus.errors.RetryStrategy;
import com.aporkolab.agentbus.exception.ValidationException;
import com.aporkolab.agentbus.metrics.ReliabilityMetrics;
import com.aporkolab.agentbus.routing.MessageRoutingConfig;
import com.aporkolab.agentbus.transport.AgentMessage;
import com.aporkolab.agentbus.transport.InMemoryMessageTransport;
import com.aporkolab.agentbus.transport.MessageMetadata;
import com.aporkolab.agentbus.transport.PublishRequest;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * End-to-end reliability flow over the in-memory transport.
 *
 * Tests the complete failure path:
 * 1. An agent handler throws while processing a message
 * 2. The error handler classifies the failure and re-publishes with backoff
 * 3. Once the retry budget is spent the message lands in the DLQ
 * 4. The DLQ processor ingests, reports and replays it
 */
class ReliabilityFlowIntegrationTest {

    private static final String AGENT_ID = "backend_1";

    private InMemoryMessageTransport transport;
    private ErrorHandler errorHandler;
    private DeadLetterQueueProcessor dlqProcessor;
    private SimpleMeterRegistry registry;
    private ReliabilityMetrics metrics;

    private final List<AgentMessage> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final AtomicBoolean rejectAsInvalid = new AtomicBoolean();

    @BeforeEach
    void setUp() {
        transport = new InMemoryMessageTransport();
        errorHandler = ErrorHandler.builder()
                .transport(transport)
                .defaultPolicy(RetryPolicy.builder()
                        .maxRetries(3)
                        .strategy(RetryStrategy.EXPONENTIAL)
                        .initialDelay(Duration.ofMillis(20))
                        .maxDelay(Duration.ofMillis(200))
                        .jitter(false)
                        .build())
                .build();
        dlqProcessor = new DeadLetterQueueProcessor(transport);
        registry = new SimpleMeterRegistry();
        metrics = new ReliabilityMetrics(registry).bindTo(errorHandler).bindTo(dlqProcessor);

        transport.onHandlerFailure((agentId, message, error) -> errorHandler.handle(error, message, agentId));
        dlqProcessor.startMonitoring().join();

        MessageRoutingConfig routing = MessageRoutingConfig.defaults();
        transport.registerHandler(AGENT_ID, this::handle,
                routing.agentRoutingKeys(AGENT_ID, "backend"), "agent." + AGENT_ID).join();
    }

    @AfterEach
    void tearDown() {
        errorHandler.close();
    }

    private Optional<AgentMessage> handle(AgentMessage message) {
        received.add(message);
        if (rejectAsInvalid.get()) {
            throw new ValidationException("payload", "missing task_id");
        }
        if (failuresLeft.getAndDecrement() > 0) {
            throw new IllegalStateException("Connection reset by peer");
        }
        return Optional.empty();
    }

    private void send(Map<String, Object> payload) {
        transport.publish(PublishRequest.builder()
                .routingKey("agent." + AGENT_ID + ".task")
                .payload(payload)
                .senderId("cto")
                .messageType("task")
                .build()).join();
    }

    @Test
    @DisplayName("Transient failure should be retried and then succeed")
    void transientFailureShouldRecover() {
        failuresLeft.set(1);

        send(Map.of("task_id", "T-1"));

        await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 2);
        await().atMost(Duration.ofSeconds(5)).until(() -> errorHandler.outstandingRetries() == 0);

        AgentMessage retried = received.get(1);
        assertThat(MessageMetadata.retryCount(retried)).isEqualTo(1);
        assertThat(MessageMetadata.errorHistory(retried)).hasSize(1);
        assertThat(MessageMetadata.errorHistory(retried).get(0)).containsEntry("error_type", "network");
        assertThat(retried.getPayload()).containsEntry("task_id", "T-1");
        assertThat(retried.getEnvelope().getSenderId()).isEqualTo("cto");

        assertThat(dlqProcessor.size()).isZero();
        assertThat(errorHandler.getRetriesScheduled()).isEqualTo(1);
        assertThat(metrics.getErrorCount(ErrorKind.NETWORK)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Persistent failure should exhaust retries and land in the DLQ")
    void persistentFailureShouldBeDeadLettered() {
        failuresLeft.set(Integer.MAX_VALUE);

        send(Map.of("task_id", "T-2"));

        await().atMost(Duration.ofSeconds(5)).until(() -> dlqProcessor.size() == 1);

        assertThat(received).hasSize(4);
        assertThat(received).extracting(MessageMetadata::retryCount).containsExactly(0, 1, 2, 3);
        assertThat(transport.getPublishedMessages("failed." + AGENT_ID)).hasSize(1);

        var entry = dlqProcessor.getEntries().get(0);
        assertThat(entry.errorInfo().kind()).isEqualTo(ErrorKind.NETWORK);
        assertThat(entry.errorInfo().retryCount()).isEqualTo(3);
        assertThat(entry.errorInfo().agentId()).isEqualTo(AGENT_ID);
        assertThat(entry.originalMessage().getPayload()).containsEntry("task_id", "T-2");
        assertThat(MessageMetadata.errorHistory(entry.originalMessage())).hasSize(3);

        assertThat(dlqProcessor.getStats().permanentFailures()).isZero();
        assertThat(registry.get("agentbus_dead_lettered_total").functionCounter().count()).isEqualTo(1.0);
        assertThat(registry.get("agentbus_dlq_depth").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Validation failure should skip retries and count as permanent")
    void validationFailureShouldBeDeadLetteredImmediately() {
        rejectAsInvalid.set(true);

        send(Map.of("task", "no id"));

        await().atMost(Duration.ofSeconds(5)).until(() -> dlqProcessor.size() == 1);

        assertThat(received).hasSize(1);
        assertThat(errorHandler.getRetriesScheduled()).isZero();
        assertThat(dlqProcessor.getStats().permanentFailures()).isEqualTo(1);
        assertThat(dlqProcessor.getStats().errorTypes()).containsEntry("validation", 1L);

        DlqReport report = dlqProcessor.report();
        assertThat(report.totalDlqMessages()).isEqualTo(1);
        assertThat(report.recent24h()).isEqualTo(1);
        assertThat(report.topErrors()).hasSize(1);
        assertThat(report.topErrors().get(0).errorType()).isEqualTo("validation");
    }

    @Test
    @DisplayName("Replayed DLQ entry should reach the agent with a fresh budget")
    void replayShouldRedeliverWithFreshBudget() {
        rejectAsInvalid.set(true);
        send(Map.of("task_id", "T-3"));
        await().atMost(Duration.ofSeconds(5)).until(() -> dlqProcessor.size() == 1);

        rejectAsInvalid.set(false);
        received.clear();

        assertThat(dlqProcessor.retry(0)).isTrue();

        assertThat(received).hasSize(1);
        AgentMessage replayed = received.get(0);
        assertThat(MessageMetadata.retryCount(replayed)).isZero();
        assertThat(replayed.getMetadata()).doesNotContainKey(MessageMetadata.ERROR_HISTORY);
        assertThat(replayed.getPayload()).containsEntry("task_id", "T-3");
        assertThat(MessageMetadata.routingKey(replayed)).isEqualTo("agent." + AGENT_ID + ".task");

        assertThat(dlqProcessor.getStats().retryAttempts()).isEqualTo(1);
        assertThat(dlqProcessor.size()).isEqualTo(1);
        assertThat(registry.get("agentbus_dlq_replays_total").functionCounter().count()).isEqualTo(1.0);
    }
}
