package com.aporkolab.agentbus.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.aporkolab.agentbus.dlq.DeadLetterQueueProcessor;
import com.aporkolab.agentbus.errors.DlqEntry;
import com.aporkolab.agentbus.errors.ErrorHandler;
import com.aporkolab.agentbus.errors.ErrorKind;
import com.aporkolab.agentbus.errors.ErrorSnapshot;
import com.aporkolab.agentbus.errors.RetryPolicy;
import com.aporkolab.agentbus.transport.AgentMessage;
import com.aporkolab.agentbus.transport.InMemoryMessageTransport;
import com.aporkolab.agentbus.transport.MessageEnvelope;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ReliabilityMetricsTest {

    private MeterRegistry registry;
    private InMemoryMessageTransport transport;
    private ReliabilityMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        transport = new InMemoryMessageTransport();
        metrics = new ReliabilityMetrics(registry);
    }

    private static AgentMessage message() {
        return new AgentMessage(MessageEnvelope.builder().id("m-1").build(), Map.of(), Map.of());
    }

    @Nested
    @DisplayName("Error handler")
    class ErrorHandlerMetrics {

        private ErrorHandler handler;

        @BeforeEach
        void setUp() {
            handler = ErrorHandler.builder()
                    .transport(transport)
                    .defaultPolicy(RetryPolicy.builder().initialDelay(Duration.ofMinutes(1)).build())
                    .build();
            metrics.bindTo(handler);
        }

        @AfterEach
        void tearDown() {
            handler.close();
        }

        @Test
        @DisplayName("should count handled failures by kind")
        void shouldCountErrorsByKind() {
            handler.handle(new RuntimeException("validation failed"), message(), "worker");
            handler.handle(new RuntimeException("validation failed"), message(), "worker");
            handler.handle(new RuntimeException("network down"), message(), "worker");

            assertThat(metrics.getErrorCount(ErrorKind.VALIDATION)).isEqualTo(2.0);
            assertThat(registry.get("agentbus_errors_total").tag("error_kind", "network").counter().count())
                    .isEqualTo(1.0);
            assertThat(registry.get("agentbus_errors_total").tag("error_kind", "timeout").counter().count())
                    .isZero();
        }

        @Test
        @DisplayName("should expose retry and dead-letter counters")
        void shouldExposeHandlerCounters() {
            handler.handle(new RuntimeException("network down"), message(), "worker");
            handler.handle(new RuntimeException("auth expired"), message(), "worker");

            assertThat(registry.get("agentbus_retries_scheduled_total").functionCounter().count()).isEqualTo(1.0);
            assertThat(registry.get("agentbus_dead_lettered_total").functionCounter().count()).isEqualTo(1.0);
            assertThat(registry.get("agentbus_retries_outstanding").gauge().value()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("DLQ processor")
    class ProcessorMetrics {

        @Test
        @DisplayName("should expose depth, ingestion and replay counts")
        void shouldExposeProcessorMetrics() {
            DeadLetterQueueProcessor processor = new DeadLetterQueueProcessor(transport);
            metrics.bindTo(processor);
            Instant now = Instant.now();
            ErrorSnapshot snapshot = new ErrorSnapshot(ErrorKind.VALIDATION.value(), "bad", now, "worker", 0, 3, null);

            processor.ingest(new DlqEntry(message(), snapshot, now));
            processor.ingest(new DlqEntry(message(), snapshot, now));
            processor.retry(0);

            assertThat(registry.get("agentbus_dlq_depth").gauge().value()).isEqualTo(2.0);
            assertThat(registry.get("agentbus_dlq_ingested_total").functionCounter().count()).isEqualTo(2.0);
            assertThat(registry.get("agentbus_dlq_permanent_failures_total").functionCounter().count()).isEqualTo(2.0);
            assertThat(registry.get("agentbus_dlq_replays_total").functionCounter().count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("should apply base tags")
    void shouldApplyBaseTags() {
        new ReliabilityMetrics(registry, Tags.of("service", "orchestrator"));

        assertThat(registry.get("agentbus_errors_total")
                .tags("service", "orchestrator", "error_kind", "unknown")
                .counter()).isNotNull();
    }
}
